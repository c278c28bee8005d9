package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.api.NotificationSink;
import org.rapidrelief.engine.api.PlanCommittedEvent;
import org.rapidrelief.engine.api.ResourceCatalog;
import org.rapidrelief.engine.audit.AuditSink;
import org.rapidrelief.engine.audit.PipelineRunRecord;
import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.exception.AllocationCancelledException;
import org.rapidrelief.engine.domain.exception.AllocationException;
import org.rapidrelief.engine.domain.exception.OptimizerNonConvergenceException;
import org.rapidrelief.engine.domain.exception.OptimizerTimeoutException;
import org.rapidrelief.engine.domain.exception.ResourceUnavailableException;
import org.rapidrelief.engine.domain.model.AllocationPlan;
import org.rapidrelief.engine.domain.model.AllocationProblem;
import org.rapidrelief.engine.domain.model.AllocationRequest;
import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.DecompositionResult;
import org.rapidrelief.engine.domain.model.FilterResult;
import org.rapidrelief.engine.domain.model.MatchedRule;
import org.rapidrelief.engine.domain.model.OptimizationMode;
import org.rapidrelief.engine.domain.model.PlanStatus;
import org.rapidrelief.engine.domain.model.RejectedSolution;
import org.rapidrelief.engine.domain.model.Requirement;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.rapidrelief.engine.domain.model.ReviewDecision;
import org.rapidrelief.engine.domain.model.ScoredSolution;
import org.rapidrelief.engine.domain.model.Violation;
import org.rapidrelief.engine.lock.LockHandle;
import org.rapidrelief.engine.lock.ResourceLockManager;
import org.rapidrelief.engine.review.HumanReviewGate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Implementation of AllocationPipeline.
 *
 * Stages, each timed and logged with the run id:
 * <ol>
 *   <li>rule evaluation and requirement aggregation</li>
 *   <li>task decomposition</li>
 *   <li>catalog query and capacity estimation</li>
 *   <li>optimization, with an optional caller-requested greedy retry</li>
 *   <li>hard-rule filtering and soft scoring</li>
 *   <li>human review of a flagged top solution</li>
 *   <li>commit: lock, revalidate, mark committed, release</li>
 * </ol>
 * Every run, failed or not, is sent to the audit sink.
 */
public final class AllocationPipelineImpl implements AllocationPipeline {

    private static final Logger LOG = Logger.getLogger(AllocationPipelineImpl.class.getName());

    static final String STAGE_RULES = "rule_evaluation";
    static final String STAGE_DECOMPOSITION = "decomposition";
    static final String STAGE_CATALOG = "catalog_query";
    static final String STAGE_OPTIMIZATION = "optimization";
    static final String STAGE_FILTER = "filtering";
    static final String STAGE_REVIEW = "review";
    static final String STAGE_COMMIT = "commit";

    static final String MODIFIED_STRATEGY = "review:modified";

    private final RuleEngine ruleEngine;
    private final RequirementAggregator requirementAggregator;
    private final TaskDecomposer taskDecomposer;
    private final ResourceCatalog catalog;
    private final CapacityEstimator capacityEstimator;
    private final AllocationOptimizer optimizer;
    private final SolutionEvaluator solutionEvaluator;
    private final ConstraintFilter constraintFilter;
    private final ResourceLockManager lockManager;
    private final HumanReviewGate reviewGate;
    private final NotificationSink notificationSink;
    private final AuditSink auditSink;
    private final ExecutorService executor;
    private final Clock clock;
    private final int defaultMaxResults;
    private final Duration lockTtl;
    private final Duration reviewTimeout;

    private AllocationPipelineImpl(Builder builder) {
        this.ruleEngine = Objects.requireNonNull(builder.ruleEngine, "ruleEngine must not be null");
        this.requirementAggregator = new RequirementAggregator();
        this.taskDecomposer = Objects.requireNonNull(builder.taskDecomposer, "taskDecomposer must not be null");
        this.catalog = Objects.requireNonNull(builder.catalog, "catalog must not be null");
        this.optimizer = Objects.requireNonNull(builder.optimizer, "optimizer must not be null");
        this.constraintFilter = Objects.requireNonNull(builder.constraintFilter, "constraintFilter must not be null");
        this.lockManager = Objects.requireNonNull(builder.lockManager, "lockManager must not be null");
        this.reviewGate = Objects.requireNonNull(builder.reviewGate, "reviewGate must not be null");
        this.notificationSink = Objects.requireNonNull(builder.notificationSink, "notificationSink must not be null");
        this.auditSink = Objects.requireNonNull(builder.auditSink, "auditSink must not be null");
        this.executor = Objects.requireNonNull(builder.executor, "executor must not be null");
        this.clock = Objects.requireNonNull(builder.clock, "clock must not be null");
        AllocationConfig allocationConfig = Objects.requireNonNull(builder.allocationConfig,
                "allocationConfig must not be null");
        ScoringService scoringService = Objects.requireNonNull(builder.scoringService,
                "scoringService must not be null");
        this.capacityEstimator = new CapacityEstimator(allocationConfig);
        this.solutionEvaluator = new SolutionEvaluator(scoringService, allocationConfig);
        this.defaultMaxResults = builder.defaultMaxResults;
        this.lockTtl = Objects.requireNonNull(builder.lockTtl, "lockTtl must not be null");
        this.reviewTimeout = Objects.requireNonNull(builder.reviewTimeout, "reviewTimeout must not be null");
    }

    @Override
    public Future<AllocationPlan> allocateAsync(AllocationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return executor.submit(() -> allocate(request));
    }

    @Override
    public AllocationPlan allocate(AllocationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Run run = new Run(UUID.randomUUID().toString(), request, clock.instant());
        LOG.info(() -> String.format("[%s] Allocation started for event %s (scenes=%s, affected=%d)",
                run.runId, request.getEventId(), request.getSceneCodes(), request.getEstimatedAffected()));
        try {
            AllocationPlan plan = execute(run);
            LOG.info(() -> String.format("[%s] Allocation finished: %s, fully satisfied=%s, timings=%s",
                    run.runId, plan.getStatus(), plan.isFullySatisfied(), plan.getStageTimingsMillis()));
            audit(run.toRecord(plan.getStatus().name(), null, null));
            return plan;
        } catch (AllocationException e) {
            LOG.log(Level.WARNING, e, () -> String.format("[%s] Allocation failed: %s", run.runId, e.getErrorCode()));
            audit(run.toRecord(PipelineRunRecord.OUTCOME_FAILED, e.getErrorCode(), e.getMessage()));
            throw e;
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e, () -> String.format("[%s] Allocation failed unexpectedly", run.runId));
            audit(run.toRecord(PipelineRunRecord.OUTCOME_FAILED, "INTERNAL_ERROR", e.getMessage()));
            throw e;
        }
    }

    private AllocationPlan execute(Run run) {
        AllocationRequest request = run.request;

        long start = System.nanoTime();
        run.matchedRules = ruleEngine.evaluate(request.getContext());
        run.requirements = requirementAggregator.aggregate(run.matchedRules);
        run.time(STAGE_RULES, start);
        LOG.info(() -> String.format("[%s] %d rules matched, %d requirements",
                run.runId, run.matchedRules.size(), run.requirements.size()));
        if (run.matchedRules.isEmpty()) {
            return run.plan(PlanStatus.NO_MATCHING_RULES).build();
        }

        start = System.nanoTime();
        run.decomposition = taskDecomposer.decompose(run.requirements, request.getSceneCodes());
        run.violations.addAll(run.decomposition.getViolations());
        run.time(STAGE_DECOMPOSITION, start);
        LOG.info(() -> String.format("[%s] Task sequence %s", run.runId, run.decomposition.getTaskCodes()));

        checkCancelled(run, STAGE_CATALOG);
        start = System.nanoTime();
        Set<String> capabilities = requiredCapabilities(run.requirements);
        int maxResults = request.getMaxResults() != null ? request.getMaxResults() : defaultMaxResults;
        List<ResourceCandidate> raw;
        try {
            raw = catalog.query(capabilities, request.getArea(), maxResults);
        } catch (AllocationException e) {
            checkCancelled(run, STAGE_CATALOG);
            throw e;
        }
        run.candidates = capacityEstimator.resolve(raw);
        run.time(STAGE_CATALOG, start);
        LOG.info(() -> String.format("[%s] %d candidates (max_results=%d)",
                run.runId, run.candidates.size(), maxResults));

        checkCancelled(run, STAGE_OPTIMIZATION);
        start = System.nanoTime();
        run.mode = request.getMode() != null
                ? request.getMode()
                : optimizer.selectMode(countAllocatable(run.candidates));
        run.solutions = optimize(run);
        run.time(STAGE_OPTIMIZATION, start);

        start = System.nanoTime();
        Integer deadline = run.decomposition.getGoldenHourDeadlineMinutes();
        FilterResult filtered = constraintFilter.filter(run.solutions, deadline);
        run.rejected.addAll(filtered.getRejected());
        if (!filtered.hasFeasibleSolutions()) {
            run.time(STAGE_FILTER, start);
            LOG.warning(() -> String.format("[%s] All %d solutions rejected by hard rules",
                    run.runId, run.solutions.size()));
            return run.plan(PlanStatus.NO_FEASIBLE_SOLUTION).build();
        }
        run.ranked = constraintFilter.score(filtered.getAccepted());
        run.time(STAGE_FILTER, start);

        ScoredSolution top = run.ranked.get(0);
        AllocationSolution chosen = top.getSolution();
        if (top.requiresHumanReview()) {
            start = System.nanoTime();
            run.reviewDecision = awaitReview(run, top);
            run.time(STAGE_REVIEW, start);
            if (run.reviewDecision.getType() == ReviewDecision.Type.REJECT) {
                return run.plan(PlanStatus.REJECTED_BY_REVIEW).build();
            }
            if (run.reviewDecision.getType() == ReviewDecision.Type.MODIFY) {
                AllocationSolution modified = applyModification(run, run.reviewDecision.getReplacementResourceIds());
                FilterResult refiltered = constraintFilter.filter(List.of(modified), deadline);
                run.solutions.add(modified);
                if (!refiltered.hasFeasibleSolutions()) {
                    run.rejected.addAll(refiltered.getRejected());
                    LOG.warning(() -> String.format("[%s] Reviewer modification rejected by hard rules", run.runId));
                    return run.plan(PlanStatus.NO_FEASIBLE_SOLUTION).build();
                }
                chosen = refiltered.getAccepted().get(0);
            }
        }

        checkCancelled(run, STAGE_COMMIT);
        start = System.nanoTime();
        commit(run, chosen);
        run.time(STAGE_COMMIT, start);
        run.committed = chosen;

        AllocationPlan plan = run.plan(PlanStatus.COMMITTED).build();
        notifyCommitted(plan);
        return plan;
    }

    private List<AllocationSolution> optimize(Run run) {
        try {
            return new ArrayList<>(optimizer.optimize(run.requirements, run.candidates,
                    run.request.getEstimatedAffected(), run.mode));
        } catch (OptimizerTimeoutException | OptimizerNonConvergenceException e) {
            if (!run.request.isAllowGreedyRetry() || run.mode == OptimizationMode.GREEDY) {
                throw e;
            }
            checkCancelled(run, STAGE_OPTIMIZATION);
            LOG.warning(() -> String.format("[%s] %s failed (%s), retrying in greedy mode as requested",
                    run.runId, run.mode, e.getErrorCode()));
            run.violations.add(Violation.warning(Violation.GREEDY_RETRY,
                    "Multi-objective optimization failed (" + e.getMessage() + "); greedy result used instead"));
            run.mode = OptimizationMode.GREEDY;
            return new ArrayList<>(optimizer.optimize(run.requirements, run.candidates,
                    run.request.getEstimatedAffected(), OptimizationMode.GREEDY));
        }
    }

    private ReviewDecision awaitReview(Run run, ScoredSolution top) {
        LOG.info(() -> String.format("[%s] Solution %s requires human review",
                run.runId, top.getSolution().getSolutionId()));
        try {
            return reviewGate.awaitDecision(run.runId, top, reviewTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AllocationCancelledException(run.runId, STAGE_REVIEW);
        }
    }

    /**
     * Builds the reviewer's replacement selection, fetching resources missing from the snapshot.
     */
    private AllocationSolution applyModification(Run run, List<String> replacementIds) {
        Map<String, ResourceCandidate> known = new LinkedHashMap<>();
        for (ResourceCandidate candidate : run.candidates) {
            known.put(candidate.getId(), candidate);
        }
        List<String> missing = new ArrayList<>();
        for (String id : replacementIds) {
            if (!known.containsKey(id)) {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            for (ResourceCandidate fetched : capacityEstimator.resolve(catalog.findByIds(missing))) {
                known.put(fetched.getId(), fetched);
            }
        }
        List<ResourceCandidate> selected = new ArrayList<>();
        Set<String> unknown = new LinkedHashSet<>();
        for (String id : replacementIds) {
            ResourceCandidate candidate = known.get(id);
            if (candidate == null) {
                unknown.add(id);
            } else {
                selected.add(candidate);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ResourceUnavailableException(unknown);
        }
        AllocationProblem problem = new AllocationProblem(run.requirements, new ArrayList<>(known.values()),
                run.request.getEstimatedAffected());
        return solutionEvaluator.evaluate("review-" + run.runId.substring(0, 8), MODIFIED_STRATEGY,
                selected, problem);
    }

    /**
     * Lock, revalidate against the live catalog, mark committed. Locks are always released.
     */
    private void commit(Run run, AllocationSolution solution) {
        List<String> ids = solution.getSelectedResources();
        LockHandle handle = lockManager.acquire(run.runId, new LinkedHashSet<>(ids), lockTtl);
        LOG.info(() -> String.format("[%s] Locked %d resources for %s", run.runId, ids.size(),
                solution.getSolutionId()));
        try {
            checkCancelled(run, STAGE_COMMIT);
            Map<String, ResourceCandidate> current = new LinkedHashMap<>();
            for (ResourceCandidate candidate : catalog.findByIds(ids)) {
                current.put(candidate.getId(), candidate);
            }
            Set<String> unavailable = new LinkedHashSet<>();
            for (String id : ids) {
                ResourceCandidate candidate = current.get(id);
                if (candidate == null || !candidate.isAllocatable()) {
                    unavailable.add(id);
                }
            }
            if (!unavailable.isEmpty()) {
                throw new ResourceUnavailableException(unavailable);
            }
            checkCancelled(run, STAGE_COMMIT);
            catalog.markCommitted(run.runId, solution.getSolutionId(), ids);
            LOG.info(() -> String.format("[%s] Committed %s", run.runId, solution.getSolutionId()));
        } finally {
            lockManager.release(handle);
        }
    }

    private void notifyCommitted(AllocationPlan plan) {
        try {
            notificationSink.planCommitted(PlanCommittedEvent.of(plan));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "Notification failed for run " + plan.getRunId());
        }
    }

    private void audit(PipelineRunRecord record) {
        try {
            auditSink.record(record);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e, () -> "Audit record lost for run " + record.getRunId());
        }
    }

    private static void checkCancelled(Run run, String stage) {
        if (Thread.currentThread().isInterrupted()) {
            LOG.warning(() -> String.format("[%s] Cancelled before %s", run.runId, stage));
            throw new AllocationCancelledException(run.runId, stage);
        }
    }

    private static Set<String> requiredCapabilities(List<Requirement> requirements) {
        Set<String> capabilities = new LinkedHashSet<>();
        for (Requirement requirement : requirements) {
            capabilities.addAll(requirement.getRequiredCapabilities());
        }
        return capabilities;
    }

    private static int countAllocatable(List<ResourceCandidate> candidates) {
        int count = 0;
        for (ResourceCandidate candidate : candidates) {
            if (candidate.isAllocatable()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Stage outputs of one run, accumulated by the orchestrator only.
     */
    private final class Run {
        private final String runId;
        private final AllocationRequest request;
        private final Instant startedAt;
        private final Map<String, Long> timings = new LinkedHashMap<>();
        private final List<Violation> violations = new ArrayList<>();
        private final List<RejectedSolution> rejected = new ArrayList<>();
        private List<MatchedRule> matchedRules = Collections.emptyList();
        private List<Requirement> requirements = Collections.emptyList();
        private DecompositionResult decomposition = DecompositionResult.empty();
        private List<ResourceCandidate> candidates = Collections.emptyList();
        private List<AllocationSolution> solutions = new ArrayList<>();
        private List<ScoredSolution> ranked = Collections.emptyList();
        private OptimizationMode mode;
        private ReviewDecision reviewDecision;
        private AllocationSolution committed;

        Run(String runId, AllocationRequest request, Instant startedAt) {
            this.runId = runId;
            this.request = request;
            this.startedAt = startedAt;
        }

        void time(String stage, long startNanos) {
            timings.put(stage, (System.nanoTime() - startNanos) / 1_000_000L);
        }

        AllocationPlan.Builder plan(PlanStatus status) {
            return new AllocationPlan.Builder()
                    .runId(runId)
                    .eventId(request.getEventId())
                    .status(status)
                    .mode(mode)
                    .matchedRules(matchedRules)
                    .requirements(requirements)
                    .decomposition(decomposition)
                    .rankedSolutions(ranked)
                    .rejectedSolutions(rejected)
                    .committedSolution(committed)
                    .reviewDecision(reviewDecision)
                    .violations(violations)
                    .stageTimingsMillis(timings)
                    .startedAt(startedAt)
                    .completedAt(clock.instant());
        }

        PipelineRunRecord toRecord(String outcome, String errorCode, String errorMessage) {
            List<String> ruleIds = new ArrayList<>();
            for (MatchedRule rule : matchedRules) {
                ruleIds.add(rule.getRuleId());
            }
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("event_id", request.getEventId());
            snapshot.put("scene_codes", request.getSceneCodes());
            snapshot.put("context", request.getContext().getValues());
            snapshot.put("center_latitude", request.getArea().getCenter().getLatitude());
            snapshot.put("center_longitude", request.getArea().getCenter().getLongitude());
            snapshot.put("radius_km", request.getArea().getRadiusKm());
            snapshot.put("estimated_affected", request.getEstimatedAffected());
            snapshot.put("max_results", request.getMaxResults());
            snapshot.put("mode", request.getMode() != null ? request.getMode().name() : null);
            snapshot.put("allow_greedy_retry", request.isAllowGreedyRetry());
            return new PipelineRunRecord.Builder()
                    .runId(runId)
                    .eventId(request.getEventId())
                    .outcome(outcome)
                    .error(errorCode, errorMessage)
                    .request(snapshot)
                    .matchedRules(ruleIds)
                    .taskSequence(decomposition.getTaskCodes())
                    .solutionsConsidered(solutions)
                    .rejectedSolutions(rejected)
                    .committedSolution(committed)
                    .violations(violations)
                    .stageTimingsMillis(timings)
                    .startedAt(startedAt)
                    .completedAt(clock.instant())
                    .build();
        }
    }

    /**
     * Builder for AllocationPipelineImpl.
     */
    public static final class Builder {
        private RuleEngine ruleEngine;
        private TaskDecomposer taskDecomposer;
        private ResourceCatalog catalog;
        private ScoringService scoringService;
        private AllocationOptimizer optimizer;
        private ConstraintFilter constraintFilter;
        private ResourceLockManager lockManager;
        private HumanReviewGate reviewGate;
        private NotificationSink notificationSink;
        private AuditSink auditSink;
        private AllocationConfig allocationConfig;
        private ExecutorService executor;
        private Clock clock = Clock.systemUTC();
        private int defaultMaxResults = 500;
        private Duration lockTtl = Duration.ofMinutes(5);
        private Duration reviewTimeout = Duration.ofMinutes(15);

        public Builder ruleEngine(RuleEngine ruleEngine) {
            this.ruleEngine = ruleEngine;
            return this;
        }

        public Builder taskDecomposer(TaskDecomposer taskDecomposer) {
            this.taskDecomposer = taskDecomposer;
            return this;
        }

        public Builder catalog(ResourceCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder scoringService(ScoringService scoringService) {
            this.scoringService = scoringService;
            return this;
        }

        public Builder optimizer(AllocationOptimizer optimizer) {
            this.optimizer = optimizer;
            return this;
        }

        public Builder constraintFilter(ConstraintFilter constraintFilter) {
            this.constraintFilter = constraintFilter;
            return this;
        }

        public Builder lockManager(ResourceLockManager lockManager) {
            this.lockManager = lockManager;
            return this;
        }

        public Builder reviewGate(HumanReviewGate reviewGate) {
            this.reviewGate = reviewGate;
            return this;
        }

        public Builder notificationSink(NotificationSink notificationSink) {
            this.notificationSink = notificationSink;
            return this;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = auditSink;
            return this;
        }

        public Builder allocationConfig(AllocationConfig allocationConfig) {
            this.allocationConfig = allocationConfig;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder defaultMaxResults(int defaultMaxResults) {
            if (defaultMaxResults < 1) {
                throw new IllegalArgumentException("defaultMaxResults must be at least 1");
            }
            this.defaultMaxResults = defaultMaxResults;
            return this;
        }

        public Builder lockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
            return this;
        }

        public Builder reviewTimeout(Duration reviewTimeout) {
            this.reviewTimeout = reviewTimeout;
            return this;
        }

        public AllocationPipelineImpl build() {
            return new AllocationPipelineImpl(this);
        }
    }
}
