package org.rapidrelief.engine.domain.rule;

import org.rapidrelief.engine.domain.model.CapabilityRequirement;
import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.model.MatchedRule;
import org.rapidrelief.engine.domain.model.Priority;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A compiled trigger rule: condition tree plus action payload.
 */
public final class TriggerRule {

    private final String id;
    private final String name;
    private final String description;
    private final Priority priority;
    private final double weight;
    private final Condition trigger;
    private final List<String> taskTypes;
    private final List<CapabilityRequirement> capabilityRequirements;
    private final List<String> resourceTypes;
    private final String tacticalNotes;

    private TriggerRule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description;
        this.priority = Objects.requireNonNull(builder.priority, "priority must not be null");
        if (builder.weight < 0.0 || builder.weight > 1.0) {
            throw new IllegalArgumentException("Rule " + builder.id + " weight must be within [0, 1]");
        }
        this.weight = builder.weight;
        this.trigger = Objects.requireNonNull(builder.trigger, "trigger must not be null");
        this.taskTypes = Collections.unmodifiableList(new ArrayList<>(builder.taskTypes));
        this.capabilityRequirements = Collections.unmodifiableList(new ArrayList<>(builder.capabilityRequirements));
        this.resourceTypes = Collections.unmodifiableList(new ArrayList<>(builder.resourceTypes));
        this.tacticalNotes = builder.tacticalNotes;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Priority getPriority() {
        return priority;
    }

    public double getWeight() {
        return weight;
    }

    public Condition getTrigger() {
        return trigger;
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

    public String getTacticalNotes() {
        return tacticalNotes;
    }

    public boolean matches(EventContext context) {
        return trigger.evaluate(context);
    }

    /**
     * Builds the match record for a context this rule holds for.
     */
    public MatchedRule toMatch(EventContext context) {
        List<String> matched = new ArrayList<>();
        trigger.collectMatches(context, matched);
        return new MatchedRule.Builder()
                .ruleId(id)
                .name(name)
                .priority(priority)
                .weight(weight)
                .taskTypes(taskTypes)
                .capabilityRequirements(capabilityRequirements)
                .resourceTypes(resourceTypes)
                .matchedConditions(matched)
                .tacticalNotes(tacticalNotes)
                .build();
    }

    @Override
    public String toString() {
        return "TriggerRule{" + id + ", weight=" + weight + ", trigger=" + trigger.describe() + '}';
    }

    /**
     * Builder for TriggerRule.
     */
    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private Priority priority = Priority.MEDIUM;
        private double weight;
        private Condition trigger;
        private List<String> taskTypes = Collections.emptyList();
        private List<CapabilityRequirement> capabilityRequirements = Collections.emptyList();
        private List<String> resourceTypes = Collections.emptyList();
        private String tacticalNotes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
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

        public Builder trigger(Condition trigger) {
            this.trigger = trigger;
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

        public Builder tacticalNotes(String tacticalNotes) {
            this.tacticalNotes = tacticalNotes;
            return this;
        }

        public TriggerRule build() {
            return new TriggerRule(this);
        }
    }
}
