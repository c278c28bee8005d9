package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One candidate allocation: the selected resources and every metric derived from them.
 * Instances are built by the solution evaluator so the metrics always agree with the selection.
 */
public final class AllocationSolution {

    private final String solutionId;
    private final String strategy;
    private final List<String> selectedResources;
    private final Set<String> coveredCapabilities;
    private final Set<String> uncoveredCapabilities;
    private final Set<String> uncoveredCriticalCapabilities;
    private final int totalRescueCapacity;
    private final int estimatedAffected;
    private final double capacityCoverageRate;
    private final ObjectiveValues objectiveValues;
    private final double redundancyRate;
    private final double meanMatchScore;
    private final String capacityWarning;
    private final List<Violation> violations;

    private AllocationSolution(Builder builder) {
        this.solutionId = Objects.requireNonNull(builder.solutionId, "solutionId must not be null");
        this.strategy = Objects.requireNonNull(builder.strategy, "strategy must not be null");
        this.selectedResources = Collections.unmodifiableList(new ArrayList<>(
                new LinkedHashSet<>(builder.selectedResources)));
        this.coveredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.coveredCapabilities));
        this.uncoveredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.uncoveredCapabilities));
        this.uncoveredCriticalCapabilities = Collections.unmodifiableSet(
                new LinkedHashSet<>(builder.uncoveredCriticalCapabilities));
        this.totalRescueCapacity = builder.totalRescueCapacity;
        this.estimatedAffected = builder.estimatedAffected;
        this.capacityCoverageRate = builder.capacityCoverageRate;
        this.objectiveValues = Objects.requireNonNull(builder.objectiveValues, "objectiveValues must not be null");
        this.redundancyRate = builder.redundancyRate;
        this.meanMatchScore = builder.meanMatchScore;
        this.capacityWarning = builder.capacityWarning;
        this.violations = Collections.unmodifiableList(new ArrayList<>(builder.violations));
    }

    public String getSolutionId() {
        return solutionId;
    }

    /**
     * Name of the strategy that produced this solution, e.g. {@code greedy:eta} or {@code nsga2}.
     */
    public String getStrategy() {
        return strategy;
    }

    public List<String> getSelectedResources() {
        return selectedResources;
    }

    public Set<String> getCoveredCapabilities() {
        return coveredCapabilities;
    }

    public Set<String> getUncoveredCapabilities() {
        return uncoveredCapabilities;
    }

    public Set<String> getUncoveredCriticalCapabilities() {
        return uncoveredCriticalCapabilities;
    }

    public int getTotalRescueCapacity() {
        return totalRescueCapacity;
    }

    public int getEstimatedAffected() {
        return estimatedAffected;
    }

    /**
     * Always {@code totalRescueCapacity / max(estimatedAffected, 1)}.
     */
    public double getCapacityCoverageRate() {
        return capacityCoverageRate;
    }

    public ObjectiveValues getObjectiveValues() {
        return objectiveValues;
    }

    /**
     * Fraction of required capabilities covered by at least two selected resources.
     */
    public double getRedundancyRate() {
        return redundancyRate;
    }

    public double getMeanMatchScore() {
        return meanMatchScore;
    }

    /**
     * Human-readable capacity shortfall, or null when capacity is sufficient.
     */
    public String getCapacityWarning() {
        return capacityWarning;
    }

    public boolean hasCapacityWarning() {
        return capacityWarning != null && !capacityWarning.isEmpty();
    }

    public List<Violation> getViolations() {
        return violations;
    }

    /**
     * Any critical violation means a human must look at this solution before it is committed.
     */
    public boolean requiresHumanReview() {
        return violations.stream().anyMatch(v -> v.getSeverity() == Severity.CRITICAL);
    }

    public AllocationSolution withAdditionalViolations(List<Violation> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        List<Violation> merged = new ArrayList<>(violations);
        for (Violation violation : additional) {
            if (!merged.contains(violation)) {
                merged.add(violation);
            }
        }
        return toBuilder().violations(merged).build();
    }

    public AllocationSolution withSolutionId(String newId) {
        return toBuilder().solutionId(newId).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .solutionId(solutionId)
                .strategy(strategy)
                .selectedResources(selectedResources)
                .coveredCapabilities(coveredCapabilities)
                .uncoveredCapabilities(uncoveredCapabilities)
                .uncoveredCriticalCapabilities(uncoveredCriticalCapabilities)
                .totalRescueCapacity(totalRescueCapacity)
                .estimatedAffected(estimatedAffected)
                .capacityCoverageRate(capacityCoverageRate)
                .objectiveValues(objectiveValues)
                .redundancyRate(redundancyRate)
                .meanMatchScore(meanMatchScore)
                .capacityWarning(capacityWarning)
                .violations(violations);
    }

    @Override
    public String toString() {
        return String.format("AllocationSolution{%s, %s, resources=%d, capacity=%d (%.0f%%), objectives=%s%s}",
                solutionId, strategy, selectedResources.size(), totalRescueCapacity,
                capacityCoverageRate * 100.0, objectiveValues, hasCapacityWarning() ? ", capacity warning" : "");
    }

    /**
     * Builder for AllocationSolution.
     */
    public static final class Builder {
        private String solutionId;
        private String strategy;
        private List<String> selectedResources = Collections.emptyList();
        private Set<String> coveredCapabilities = Collections.emptySet();
        private Set<String> uncoveredCapabilities = Collections.emptySet();
        private Set<String> uncoveredCriticalCapabilities = Collections.emptySet();
        private int totalRescueCapacity;
        private int estimatedAffected;
        private double capacityCoverageRate;
        private ObjectiveValues objectiveValues;
        private double redundancyRate;
        private double meanMatchScore;
        private String capacityWarning;
        private List<Violation> violations = Collections.emptyList();

        public Builder solutionId(String solutionId) {
            this.solutionId = solutionId;
            return this;
        }

        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder selectedResources(List<String> selectedResources) {
            this.selectedResources = Objects.requireNonNull(selectedResources, "selectedResources must not be null");
            return this;
        }

        public Builder coveredCapabilities(Set<String> coveredCapabilities) {
            this.coveredCapabilities = Objects.requireNonNull(coveredCapabilities,
                    "coveredCapabilities must not be null");
            return this;
        }

        public Builder uncoveredCapabilities(Set<String> uncoveredCapabilities) {
            this.uncoveredCapabilities = Objects.requireNonNull(uncoveredCapabilities,
                    "uncoveredCapabilities must not be null");
            return this;
        }

        public Builder uncoveredCriticalCapabilities(Set<String> uncoveredCriticalCapabilities) {
            this.uncoveredCriticalCapabilities = Objects.requireNonNull(uncoveredCriticalCapabilities,
                    "uncoveredCriticalCapabilities must not be null");
            return this;
        }

        public Builder totalRescueCapacity(int totalRescueCapacity) {
            this.totalRescueCapacity = totalRescueCapacity;
            return this;
        }

        public Builder estimatedAffected(int estimatedAffected) {
            this.estimatedAffected = estimatedAffected;
            return this;
        }

        public Builder capacityCoverageRate(double capacityCoverageRate) {
            this.capacityCoverageRate = capacityCoverageRate;
            return this;
        }

        public Builder objectiveValues(ObjectiveValues objectiveValues) {
            this.objectiveValues = objectiveValues;
            return this;
        }

        public Builder redundancyRate(double redundancyRate) {
            this.redundancyRate = redundancyRate;
            return this;
        }

        public Builder meanMatchScore(double meanMatchScore) {
            this.meanMatchScore = meanMatchScore;
            return this;
        }

        public Builder capacityWarning(String capacityWarning) {
            this.capacityWarning = capacityWarning;
            return this;
        }

        public Builder violations(List<Violation> violations) {
            this.violations = Objects.requireNonNull(violations, "violations must not be null");
            return this;
        }

        public AllocationSolution build() {
            return new AllocationSolution(this);
        }
    }
}
