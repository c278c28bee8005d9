package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A solution removed by one or more hard rules, kept with the reasons.
 */
public final class RejectedSolution {

    private final AllocationSolution solution;
    private final List<Violation> reasons;

    public RejectedSolution(AllocationSolution solution, List<Violation> reasons) {
        this.solution = Objects.requireNonNull(solution, "solution must not be null");
        Objects.requireNonNull(reasons, "reasons must not be null");
        if (reasons.isEmpty()) {
            throw new IllegalArgumentException("A rejected solution needs at least one reason");
        }
        this.reasons = Collections.unmodifiableList(new ArrayList<>(reasons));
    }

    public AllocationSolution getSolution() {
        return solution;
    }

    public List<Violation> getReasons() {
        return reasons;
    }

    @Override
    public String toString() {
        return "RejectedSolution{" + solution.getSolutionId() + ", reasons=" + reasons + '}';
    }
}
