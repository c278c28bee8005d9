package org.rapidrelief.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A task type the event requires, with the capabilities needed to perform it.
 * Immutable once emitted for a run.
 */
public final class Requirement {

    private final String taskType;
    private final Priority priority;
    private final Set<String> requiredCapabilities;

    public Requirement(String taskType, Priority priority, Set<String> requiredCapabilities) {
        this.taskType = Objects.requireNonNull(taskType, "taskType must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(requiredCapabilities, "requiredCapabilities must not be null");
        this.requiredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities));
    }

    public String getTaskType() {
        return taskType;
    }

    public Priority getPriority() {
        return priority;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public boolean isCritical() {
        return priority == Priority.CRITICAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Requirement)) {
            return false;
        }
        Requirement other = (Requirement) o;
        return taskType.equals(other.taskType)
                && priority == other.priority
                && requiredCapabilities.equals(other.requiredCapabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskType, priority, requiredCapabilities);
    }

    @Override
    public String toString() {
        return "Requirement{" + taskType + ", " + priority.getCode() + ", " + requiredCapabilities + '}';
    }
}
