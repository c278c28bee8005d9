package org.rapidrelief.engine.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.rapidrelief.engine.domain.model.AllocationPlan;
import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.Violation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pushed to the notification sink once a plan is committed.
 */
public final class PlanCommittedEvent {

    private final String runId;
    private final String eventId;
    private final String solutionId;
    private final List<String> resourceIds;
    private final int totalRescueCapacity;
    private final double capacityCoverageRate;
    private final boolean fullySatisfied;
    private final List<String> warnings;
    private final Instant committedAt;

    private PlanCommittedEvent(AllocationPlan plan, AllocationSolution solution) {
        this.runId = plan.getRunId();
        this.eventId = plan.getEventId();
        this.solutionId = solution.getSolutionId();
        this.resourceIds = solution.getSelectedResources();
        this.totalRescueCapacity = solution.getTotalRescueCapacity();
        this.capacityCoverageRate = solution.getCapacityCoverageRate();
        this.fullySatisfied = plan.isFullySatisfied();
        List<String> messages = new ArrayList<>();
        for (Violation violation : plan.getViolations()) {
            messages.add(violation.getMessage());
        }
        for (Violation violation : solution.getViolations()) {
            messages.add(violation.getMessage());
        }
        this.warnings = Collections.unmodifiableList(messages);
        this.committedAt = plan.getCompletedAt();
    }

    /**
     * @throws IllegalArgumentException if the plan was not committed
     */
    public static PlanCommittedEvent of(AllocationPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        if (!plan.isCommitted()) {
            throw new IllegalArgumentException("Plan " + plan.getRunId() + " is not committed");
        }
        return new PlanCommittedEvent(plan, plan.getCommittedSolution());
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    @JsonProperty("solution_id")
    public String getSolutionId() {
        return solutionId;
    }

    @JsonProperty("resource_ids")
    public List<String> getResourceIds() {
        return resourceIds;
    }

    @JsonProperty("total_rescue_capacity")
    public int getTotalRescueCapacity() {
        return totalRescueCapacity;
    }

    @JsonProperty("capacity_coverage_rate")
    public double getCapacityCoverageRate() {
        return capacityCoverageRate;
    }

    @JsonProperty("fully_satisfied")
    public boolean isFullySatisfied() {
        return fullySatisfied;
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return warnings;
    }

    @JsonProperty("committed_at")
    public Instant getCommittedAt() {
        return committedAt;
    }
}
