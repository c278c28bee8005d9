package org.rapidrelief.engine.review;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.rapidrelief.engine.domain.model.ReviewDecision;
import org.rapidrelief.engine.domain.model.ScoredSolution;
import org.rapidrelief.engine.domain.model.Violation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A run blocked on human review.
 */
public final class PendingReview {

    private final String runId;
    private final ScoredSolution solution;
    private final Instant requestedAt;
    private final CompletableFuture<ReviewDecision> decision = new CompletableFuture<>();

    PendingReview(String runId, ScoredSolution solution, Instant requestedAt) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.solution = Objects.requireNonNull(solution, "solution must not be null");
        this.requestedAt = Objects.requireNonNull(requestedAt, "requestedAt must not be null");
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("solution_id")
    public String getSolutionId() {
        return solution.getSolution().getSolutionId();
    }

    @JsonProperty("resource_ids")
    public List<String> getResourceIds() {
        return solution.getSolution().getSelectedResources();
    }

    @JsonProperty("reasons")
    public List<String> getReasons() {
        List<String> reasons = new ArrayList<>();
        for (Violation violation : solution.getSolution().getViolations()) {
            reasons.add(violation.getMessage());
        }
        return reasons;
    }

    @JsonProperty("requested_at")
    public Instant getRequestedAt() {
        return requestedAt;
    }

    ScoredSolution getSolution() {
        return solution;
    }

    CompletableFuture<ReviewDecision> getDecision() {
        return decision;
    }
}
