package org.rapidrelief.engine.audit;

import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.RejectedSolution;
import org.rapidrelief.engine.domain.model.Violation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit trail of one pipeline run: input snapshot, intermediate results, outcome and timings.
 */
public final class PipelineRunRecord {

    public static final String OUTCOME_FAILED = "FAILED";

    private final String runId;
    private final String eventId;
    private final String outcome;
    private final String errorCode;
    private final String errorMessage;
    private final Map<String, Object> request;
    private final List<String> matchedRules;
    private final List<String> taskSequence;
    private final List<AllocationSolution> solutionsConsidered;
    private final List<RejectedSolution> rejectedSolutions;
    private final AllocationSolution committedSolution;
    private final List<Violation> violations;
    private final Map<String, Long> stageTimingsMillis;
    private final Instant startedAt;
    private final Instant completedAt;

    private PipelineRunRecord(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId must not be null");
        this.eventId = builder.eventId;
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome must not be null");
        this.errorCode = builder.errorCode;
        this.errorMessage = builder.errorMessage;
        this.request = Collections.unmodifiableMap(new LinkedHashMap<>(builder.request));
        this.matchedRules = Collections.unmodifiableList(new ArrayList<>(builder.matchedRules));
        this.taskSequence = Collections.unmodifiableList(new ArrayList<>(builder.taskSequence));
        this.solutionsConsidered = Collections.unmodifiableList(new ArrayList<>(builder.solutionsConsidered));
        this.rejectedSolutions = Collections.unmodifiableList(new ArrayList<>(builder.rejectedSolutions));
        this.committedSolution = builder.committedSolution;
        this.violations = Collections.unmodifiableList(new ArrayList<>(builder.violations));
        this.stageTimingsMillis = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stageTimingsMillis));
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    public String getRunId() {
        return runId;
    }

    public String getEventId() {
        return eventId;
    }

    /**
     * Plan status name, or {@link #OUTCOME_FAILED} when the run ended with an error.
     */
    public String getOutcome() {
        return outcome;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getRequest() {
        return request;
    }

    /**
     * Ids of the matched trigger rules, best match first.
     */
    public List<String> getMatchedRules() {
        return matchedRules;
    }

    public List<String> getTaskSequence() {
        return taskSequence;
    }

    public List<AllocationSolution> getSolutionsConsidered() {
        return solutionsConsidered;
    }

    public List<RejectedSolution> getRejectedSolutions() {
        return rejectedSolutions;
    }

    public AllocationSolution getCommittedSolution() {
        return committedSolution;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public Map<String, Long> getStageTimingsMillis() {
        return stageTimingsMillis;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "PipelineRunRecord{runId='" + runId + "', outcome=" + outcome
                + (errorCode != null ? ", error=" + errorCode : "") + '}';
    }

    public static final class Builder {
        private String runId;
        private String eventId;
        private String outcome;
        private String errorCode;
        private String errorMessage;
        private Map<String, Object> request = Collections.emptyMap();
        private List<String> matchedRules = Collections.emptyList();
        private List<String> taskSequence = Collections.emptyList();
        private List<AllocationSolution> solutionsConsidered = Collections.emptyList();
        private List<RejectedSolution> rejectedSolutions = Collections.emptyList();
        private AllocationSolution committedSolution;
        private List<Violation> violations = Collections.emptyList();
        private Map<String, Long> stageTimingsMillis = Collections.emptyMap();
        private Instant startedAt;
        private Instant completedAt;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder error(String errorCode, String errorMessage) {
            this.errorCode = errorCode;
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder request(Map<String, Object> request) {
            this.request = Objects.requireNonNull(request, "request must not be null");
            return this;
        }

        public Builder matchedRules(List<String> matchedRules) {
            this.matchedRules = Objects.requireNonNull(matchedRules, "matchedRules must not be null");
            return this;
        }

        public Builder taskSequence(List<String> taskSequence) {
            this.taskSequence = Objects.requireNonNull(taskSequence, "taskSequence must not be null");
            return this;
        }

        public Builder solutionsConsidered(List<AllocationSolution> solutionsConsidered) {
            this.solutionsConsidered = Objects.requireNonNull(solutionsConsidered,
                    "solutionsConsidered must not be null");
            return this;
        }

        public Builder rejectedSolutions(List<RejectedSolution> rejectedSolutions) {
            this.rejectedSolutions = Objects.requireNonNull(rejectedSolutions, "rejectedSolutions must not be null");
            return this;
        }

        public Builder committedSolution(AllocationSolution committedSolution) {
            this.committedSolution = committedSolution;
            return this;
        }

        public Builder violations(List<Violation> violations) {
            this.violations = Objects.requireNonNull(violations, "violations must not be null");
            return this;
        }

        public Builder stageTimingsMillis(Map<String, Long> stageTimingsMillis) {
            this.stageTimingsMillis = Objects.requireNonNull(stageTimingsMillis, "stageTimingsMillis must not be null");
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public PipelineRunRecord build() {
            return new PipelineRunRecord(this);
        }
    }
}
