package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A trigger rule whose condition held for an event, with its action payload.
 */
public final class MatchedRule {

    private final String ruleId;
    private final String name;
    private final Priority priority;
    private final double weight;
    private final List<String> taskTypes;
    private final List<CapabilityRequirement> capabilityRequirements;
    private final List<String> resourceTypes;
    private final List<String> matchedConditions;
    private final String tacticalNotes;

    private MatchedRule(Builder builder) {
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.name = builder.name != null ? builder.name : builder.ruleId;
        this.priority = Objects.requireNonNull(builder.priority, "priority must not be null");
        this.weight = builder.weight;
        this.taskTypes = Collections.unmodifiableList(new ArrayList<>(builder.taskTypes));
        this.capabilityRequirements = Collections.unmodifiableList(new ArrayList<>(builder.capabilityRequirements));
        this.resourceTypes = Collections.unmodifiableList(new ArrayList<>(builder.resourceTypes));
        this.matchedConditions = Collections.unmodifiableList(new ArrayList<>(builder.matchedConditions));
        this.tacticalNotes = builder.tacticalNotes;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getName() {
        return name;
    }

    public Priority getPriority() {
        return priority;
    }

    public double getWeight() {
        return weight;
    }

    public List<String> getTaskTypes() {
        return taskTypes;
    }

    public List<CapabilityRequirement> getCapabilityRequirements() {
        return capabilityRequirements;
    }

    public List<String> getResourceTypes() {
        return resourceTypes;
    }

    public List<String> getMatchedConditions() {
        return matchedConditions;
    }

    public String getTacticalNotes() {
        return tacticalNotes;
    }

    @Override
    public String toString() {
        return String.format("MatchedRule{%s, weight=%.2f, tasks=%s}", ruleId, weight, taskTypes);
    }

    /**
     * Builder for MatchedRule.
     */
    public static final class Builder {
        private String ruleId;
        private String name;
        private Priority priority = Priority.MEDIUM;
        private double weight;
        private List<String> taskTypes = Collections.emptyList();
        private List<CapabilityRequirement> capabilityRequirements = Collections.emptyList();
        private List<String> resourceTypes = Collections.emptyList();
        private List<String> matchedConditions = Collections.emptyList();
        private String tacticalNotes;

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder taskTypes(List<String> taskTypes) {
            this.taskTypes = Objects.requireNonNull(taskTypes, "taskTypes must not be null");
            return this;
        }

        public Builder capabilityRequirements(List<CapabilityRequirement> capabilityRequirements) {
            this.capabilityRequirements = Objects.requireNonNull(capabilityRequirements,
                    "capabilityRequirements must not be null");
            return this;
        }

        public Builder resourceTypes(List<String> resourceTypes) {
            this.resourceTypes = Objects.requireNonNull(resourceTypes, "resourceTypes must not be null");
            return this;
        }

        public Builder matchedConditions(List<String> matchedConditions) {
            this.matchedConditions = Objects.requireNonNull(matchedConditions, "matchedConditions must not be null");
            return this;
        }

        public Builder tacticalNotes(String tacticalNotes) {
            this.tacticalNotes = tacticalNotes;
            return this;
        }

        public MatchedRule build() {
            return new MatchedRule(this);
        }
    }
}
