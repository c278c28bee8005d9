package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Output of task decomposition: an ordered sequence, its parallel groups and
 * any dependency violations found on the way.
 */
public final class DecompositionResult {

    private final List<TaskNode> sequence;
    private final List<Set<String>> parallelGroups;
    private final List<Violation> violations;

    public DecompositionResult(List<TaskNode> sequence, List<Set<String>> parallelGroups,
                               List<Violation> violations) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        Objects.requireNonNull(parallelGroups, "parallelGroups must not be null");
        Objects.requireNonNull(violations, "violations must not be null");
        this.sequence = Collections.unmodifiableList(new ArrayList<>(sequence));
        List<Set<String>> groups = new ArrayList<>();
        for (Set<String> group : parallelGroups) {
            groups.add(Collections.unmodifiableSet(new LinkedHashSet<>(group)));
        }
        this.parallelGroups = Collections.unmodifiableList(groups);
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public static DecompositionResult empty() {
        return new DecompositionResult(Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    public List<TaskNode> getSequence() {
        return sequence;
    }

    public List<Set<String>> getParallelGroups() {
        return parallelGroups;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public List<String> getTaskCodes() {
        List<String> codes = new ArrayList<>(sequence.size());
        for (TaskNode node : sequence) {
            codes.add(node.getTaskCode());
        }
        return codes;
    }

    /**
     * Smallest golden-hour window across the sequence, or null when no task has one.
     */
    public Integer getGoldenHourDeadlineMinutes() {
        Integer deadline = null;
        for (TaskNode node : sequence) {
            Integer minutes = node.getGoldenHourMinutes();
            if (minutes != null && (deadline == null || minutes < deadline)) {
                deadline = minutes;
            }
        }
        return deadline;
    }

    public boolean hasStrictViolations() {
        return violations.stream().anyMatch(Violation::isStrict);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecompositionResult)) {
            return false;
        }
        DecompositionResult other = (DecompositionResult) o;
        return sequence.equals(other.sequence)
                && parallelGroups.equals(other.parallelGroups)
                && violations.equals(other.violations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, parallelGroups, violations);
    }

    @Override
    public String toString() {
        return "DecompositionResult{sequence=" + getTaskCodes() + ", parallelGroups=" + parallelGroups
                + ", violations=" + violations.size() + '}';
    }
}
