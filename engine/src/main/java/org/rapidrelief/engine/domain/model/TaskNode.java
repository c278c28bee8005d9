package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A task in the execution graph of a run. Never mutated after decomposition.
 */
public final class TaskNode {

    private final String taskCode;
    private final String name;
    private final String phase;
    private final List<TaskDependency> dependencies;
    private final Integer goldenHourMinutes;
    private final Set<String> requiredCapabilities;

    private TaskNode(Builder builder) {
        this.taskCode = Objects.requireNonNull(builder.taskCode, "taskCode must not be null");
        this.name = builder.name != null ? builder.name : builder.taskCode;
        this.phase = builder.phase;
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(builder.dependencies));
        this.goldenHourMinutes = builder.goldenHourMinutes;
        this.requiredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredCapabilities));
    }

    public String getTaskCode() {
        return taskCode;
    }

    public String getName() {
        return name;
    }

    public String getPhase() {
        return phase;
    }

    public List<TaskDependency> getDependencies() {
        return dependencies;
    }

    /**
     * Codes of every task this one depends on.
     */
    public Set<String> getDependsOn() {
        Set<String> codes = new LinkedHashSet<>();
        for (TaskDependency dependency : dependencies) {
            codes.add(dependency.getTaskCode());
        }
        return codes;
    }

    /**
     * True when at least one incoming edge is strict.
     */
    public boolean isStrictDependency() {
        return dependencies.stream().anyMatch(TaskDependency::isStrict);
    }

    /**
     * Minutes after which intervention effectiveness drops sharply, or null.
     */
    public Integer getGoldenHourMinutes() {
        return goldenHourMinutes;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public Builder toBuilder() {
        return new Builder()
                .taskCode(taskCode)
                .name(name)
                .phase(phase)
                .dependencies(dependencies)
                .goldenHourMinutes(goldenHourMinutes)
                .requiredCapabilities(requiredCapabilities);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskNode)) {
            return false;
        }
        TaskNode other = (TaskNode) o;
        return taskCode.equals(other.taskCode)
                && name.equals(other.name)
                && Objects.equals(phase, other.phase)
                && dependencies.equals(other.dependencies)
                && Objects.equals(goldenHourMinutes, other.goldenHourMinutes)
                && requiredCapabilities.equals(other.requiredCapabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskCode, dependencies, goldenHourMinutes);
    }

    @Override
    public String toString() {
        return "TaskNode{" + taskCode + ", dependsOn=" + dependencies + '}';
    }

    /**
     * Builder for TaskNode.
     */
    public static final class Builder {
        private String taskCode;
        private String name;
        private String phase;
        private List<TaskDependency> dependencies = Collections.emptyList();
        private Integer goldenHourMinutes;
        private Set<String> requiredCapabilities = Collections.emptySet();

        public Builder taskCode(String taskCode) {
            this.taskCode = taskCode;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder dependencies(List<TaskDependency> dependencies) {
            this.dependencies = Objects.requireNonNull(dependencies, "dependencies must not be null");
            return this;
        }

        public Builder goldenHourMinutes(Integer goldenHourMinutes) {
            if (goldenHourMinutes != null && goldenHourMinutes <= 0) {
                throw new IllegalArgumentException("goldenHourMinutes must be positive");
            }
            this.goldenHourMinutes = goldenHourMinutes;
            return this;
        }

        public Builder requiredCapabilities(Set<String> requiredCapabilities) {
            this.requiredCapabilities = Objects.requireNonNull(requiredCapabilities,
                    "requiredCapabilities must not be null");
            return this;
        }

        public TaskNode build() {
            return new TaskNode(this);
        }
    }
}
