package org.rapidrelief.engine.domain.model;

import java.util.Objects;

/**
 * Edge of the task graph: the owning task depends on {@code taskCode}.
 */
public final class TaskDependency {

    private final String taskCode;
    private final boolean strict;

    public TaskDependency(String taskCode, boolean strict) {
        this.taskCode = Objects.requireNonNull(taskCode, "taskCode must not be null");
        this.strict = strict;
    }

    public String getTaskCode() {
        return taskCode;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Merges two declarations of the same edge; strict wins.
     */
    public TaskDependency merge(TaskDependency other) {
        if (!taskCode.equals(other.taskCode)) {
            throw new IllegalArgumentException("Cannot merge edges to " + taskCode + " and " + other.taskCode);
        }
        return strict || !other.strict ? this : other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskDependency)) {
            return false;
        }
        TaskDependency other = (TaskDependency) o;
        return strict == other.strict && taskCode.equals(other.taskCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskCode, strict);
    }

    @Override
    public String toString() {
        return taskCode + (strict ? "!" : "?");
    }
}
