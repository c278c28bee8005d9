package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of hard-rule filtering.
 */
public final class FilterResult {

    private final List<AllocationSolution> accepted;
    private final List<RejectedSolution> rejected;

    public FilterResult(List<AllocationSolution> accepted, List<RejectedSolution> rejected) {
        this.accepted = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(accepted, "accepted must not be null")));
        this.rejected = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(rejected, "rejected must not be null")));
    }

    public List<AllocationSolution> getAccepted() {
        return accepted;
    }

    public List<RejectedSolution> getRejected() {
        return rejected;
    }

    public boolean hasFeasibleSolutions() {
        return !accepted.isEmpty();
    }
}
