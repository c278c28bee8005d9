package org.rapidrelief.engine.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a pipeline run. Carries enough detail for a caller to tell a fully
 * satisfied plan from a best-effort, under-resourced one.
 */
public final class AllocationPlan {

    private final String runId;
    private final String eventId;
    private final PlanStatus status;
    private final OptimizationMode mode;
    private final List<MatchedRule> matchedRules;
    private final List<Requirement> requirements;
    private final DecompositionResult decomposition;
    private final List<ScoredSolution> rankedSolutions;
    private final List<RejectedSolution> rejectedSolutions;
    private final AllocationSolution committedSolution;
    private final ReviewDecision reviewDecision;
    private final List<Violation> violations;
    private final Map<String, Long> stageTimingsMillis;
    private final Instant startedAt;
    private final Instant completedAt;

    private AllocationPlan(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId must not be null");
        this.eventId = Objects.requireNonNull(builder.eventId, "eventId must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.mode = builder.mode;
        this.matchedRules = Collections.unmodifiableList(new ArrayList<>(builder.matchedRules));
        this.requirements = Collections.unmodifiableList(new ArrayList<>(builder.requirements));
        this.decomposition = builder.decomposition != null ? builder.decomposition : DecompositionResult.empty();
        this.rankedSolutions = Collections.unmodifiableList(new ArrayList<>(builder.rankedSolutions));
        this.rejectedSolutions = Collections.unmodifiableList(new ArrayList<>(builder.rejectedSolutions));
        this.committedSolution = builder.committedSolution;
        this.reviewDecision = builder.reviewDecision;
        this.violations = Collections.unmodifiableList(new ArrayList<>(builder.violations));
        this.stageTimingsMillis = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stageTimingsMillis));
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        if (status == PlanStatus.COMMITTED && committedSolution == null) {
            throw new IllegalStateException("A committed plan needs a committed solution");
        }
    }

    public String getRunId() {
        return runId;
    }

    public String getEventId() {
        return eventId;
    }

    public PlanStatus getStatus() {
        return status;
    }

    public OptimizationMode getMode() {
        return mode;
    }

    public List<MatchedRule> getMatchedRules() {
        return matchedRules;
    }

    public List<Requirement> getRequirements() {
        return requirements;
    }

    public DecompositionResult getDecomposition() {
        return decomposition;
    }

    public List<ScoredSolution> getRankedSolutions() {
        return rankedSolutions;
    }

    public List<RejectedSolution> getRejectedSolutions() {
        return rejectedSolutions;
    }

    /**
     * The solution that was locked and committed, or null.
     */
    public AllocationSolution getCommittedSolution() {
        return committedSolution;
    }

    public ReviewDecision getReviewDecision() {
        return reviewDecision;
    }

    /**
     * Decomposition violations, optimizer warnings and hard-rule warnings of the run.
     */
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

    public boolean isCommitted() {
        return status == PlanStatus.COMMITTED;
    }

    /**
     * True only for a committed plan with full capability coverage, sufficient
     * capacity and no warnings or violations of any kind.
     */
    public boolean isFullySatisfied() {
        if (!isCommitted()) {
            return false;
        }
        return violations.isEmpty()
                && committedSolution.getViolations().isEmpty()
                && !committedSolution.hasCapacityWarning()
                && committedSolution.getUncoveredCapabilities().isEmpty();
    }

    @Override
    public String toString() {
        return "AllocationPlan{runId='" + runId + "', status=" + status
                + ", committed=" + (committedSolution != null ? committedSolution.getSolutionId() : "none")
                + ", violations=" + violations.size() + '}';
    }

    /**
     * Builder for AllocationPlan.
     */
    public static final class Builder {
        private String runId;
        private String eventId;
        private PlanStatus status;
        private OptimizationMode mode;
        private List<MatchedRule> matchedRules = Collections.emptyList();
        private List<Requirement> requirements = Collections.emptyList();
        private DecompositionResult decomposition;
        private List<ScoredSolution> rankedSolutions = Collections.emptyList();
        private List<RejectedSolution> rejectedSolutions = Collections.emptyList();
        private AllocationSolution committedSolution;
        private ReviewDecision reviewDecision;
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

        public Builder status(PlanStatus status) {
            this.status = status;
            return this;
        }

        public Builder mode(OptimizationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder matchedRules(List<MatchedRule> matchedRules) {
            this.matchedRules = Objects.requireNonNull(matchedRules, "matchedRules must not be null");
            return this;
        }

        public Builder requirements(List<Requirement> requirements) {
            this.requirements = Objects.requireNonNull(requirements, "requirements must not be null");
            return this;
        }

        public Builder decomposition(DecompositionResult decomposition) {
            this.decomposition = decomposition;
            return this;
        }

        public Builder rankedSolutions(List<ScoredSolution> rankedSolutions) {
            this.rankedSolutions = Objects.requireNonNull(rankedSolutions, "rankedSolutions must not be null");
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

        public Builder reviewDecision(ReviewDecision reviewDecision) {
            this.reviewDecision = reviewDecision;
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

        public AllocationPlan build() {
            return new AllocationPlan(this);
        }
    }
}
