package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.model.FilterResult;
import org.rapidrelief.engine.domain.model.ObjectiveValues;
import org.rapidrelief.engine.domain.model.RejectedSolution;
import org.rapidrelief.engine.domain.model.ScoredSolution;
import org.rapidrelief.engine.domain.model.Violation;
import org.rapidrelief.engine.domain.rule.HardRule;
import org.rapidrelief.engine.domain.rule.HardRuleAction;
import org.rapidrelief.engine.library.HardRuleLibrary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Implementation of ConstraintFilter.
 *
 * Hard rules see a flat metric map per solution:
 * <pre>
 *   risk, response_time, coverage_rate, cost, redundancy_rate,
 *   capacity_coverage_rate, total_rescue_capacity, estimated_affected,
 *   uncovered_count, uncovered_critical_count, resource_count,
 *   golden_hour_deadline (only when the task sequence has one)
 * </pre>
 *
 * Soft dimensions, each in [0, 1]:
 * <pre>
 *   success_rate  = 0.4 * coverage + 0.4 * min(1, capacity_coverage) + 0.2 * mean_match_score
 *   response_time = max(0, 1 - response_time / horizon)
 *   coverage_rate = coverage
 *   risk          = 1 - risk
 *   redundancy    = redundancy_rate
 * </pre>
 */
public final class ConstraintFilterImpl implements ConstraintFilter {

    private static final Logger LOG = Logger.getLogger(ConstraintFilterImpl.class.getName());

    public static final String METRIC_RISK = "risk";
    public static final String METRIC_RESPONSE_TIME = "response_time";
    public static final String METRIC_COVERAGE_RATE = "coverage_rate";
    public static final String METRIC_COST = "cost";
    public static final String METRIC_REDUNDANCY_RATE = "redundancy_rate";
    public static final String METRIC_CAPACITY_COVERAGE_RATE = "capacity_coverage_rate";
    public static final String METRIC_TOTAL_RESCUE_CAPACITY = "total_rescue_capacity";
    public static final String METRIC_ESTIMATED_AFFECTED = "estimated_affected";
    public static final String METRIC_UNCOVERED_COUNT = "uncovered_count";
    public static final String METRIC_UNCOVERED_CRITICAL_COUNT = "uncovered_critical_count";
    public static final String METRIC_RESOURCE_COUNT = "resource_count";
    public static final String METRIC_GOLDEN_HOUR_DEADLINE = "golden_hour_deadline";

    private final HardRuleLibrary hardRules;
    private final AllocationConfig config;

    public ConstraintFilterImpl(HardRuleLibrary hardRules, AllocationConfig config) {
        this.hardRules = Objects.requireNonNull(hardRules, "hardRules must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public FilterResult filter(List<AllocationSolution> solutions, Integer goldenHourDeadlineMinutes) {
        List<AllocationSolution> accepted = new ArrayList<>();
        List<RejectedSolution> rejected = new ArrayList<>();

        for (AllocationSolution solution : solutions) {
            EventContext metrics = metricsOf(solution, goldenHourDeadlineMinutes);
            List<Violation> rejections = new ArrayList<>();
            List<Violation> warnings = new ArrayList<>();
            for (HardRule rule : hardRules.getRules()) {
                Optional<Violation> violation = rule.evaluate(metrics);
                if (violation.isEmpty()) {
                    continue;
                }
                if (rule.getAction() == HardRuleAction.REJECT) {
                    rejections.add(violation.get());
                } else {
                    warnings.add(violation.get());
                }
            }
            if (rejections.isEmpty()) {
                accepted.add(solution.withAdditionalViolations(warnings));
            } else {
                LOG.fine(() -> "Rejected " + solution.getSolutionId() + ": " + rejections);
                rejected.add(new RejectedSolution(solution, rejections));
            }
        }

        LOG.info(() -> String.format("Hard rules accepted %d of %d solutions",
                accepted.size(), solutions.size()));
        return new FilterResult(accepted, rejected);
    }

    @Override
    public List<ScoredSolution> score(List<AllocationSolution> solutions) {
        List<ScoredSolution> scored = new ArrayList<>(solutions.size());
        for (AllocationSolution solution : solutions) {
            Map<String, Double> dimensions = dimensionsOf(solution);
            double total = config.getSuccessRateWeight() * dimensions.get(ScoredSolution.SUCCESS_RATE)
                    + config.getResponseTimeWeight() * dimensions.get(ScoredSolution.RESPONSE_TIME)
                    + config.getCoverageRateWeight() * dimensions.get(ScoredSolution.COVERAGE_RATE)
                    + config.getRiskWeight() * dimensions.get(ScoredSolution.RISK)
                    + config.getRedundancyWeight() * dimensions.get(ScoredSolution.REDUNDANCY);
            scored.add(new ScoredSolution(solution, total, dimensions));
        }
        Collections.sort(scored);
        return scored;
    }

    private Map<String, Double> dimensionsOf(AllocationSolution solution) {
        ObjectiveValues objectives = solution.getObjectiveValues();
        double successRate = 0.4 * objectives.getCoverageRate()
                + 0.4 * Math.min(1.0, solution.getCapacityCoverageRate())
                + 0.2 * solution.getMeanMatchScore();
        double responseTime = Math.max(0.0,
                1.0 - objectives.getResponseTime() / config.getResponseTimeHorizonMinutes());

        Map<String, Double> dimensions = new LinkedHashMap<>();
        dimensions.put(ScoredSolution.SUCCESS_RATE, successRate);
        dimensions.put(ScoredSolution.RESPONSE_TIME, responseTime);
        dimensions.put(ScoredSolution.COVERAGE_RATE, objectives.getCoverageRate());
        dimensions.put(ScoredSolution.RISK, 1.0 - objectives.getRisk());
        dimensions.put(ScoredSolution.REDUNDANCY, solution.getRedundancyRate());
        return dimensions;
    }

    static EventContext metricsOf(AllocationSolution solution, Integer goldenHourDeadlineMinutes) {
        ObjectiveValues objectives = solution.getObjectiveValues();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put(METRIC_RISK, objectives.getRisk());
        metrics.put(METRIC_RESPONSE_TIME, objectives.getResponseTime());
        metrics.put(METRIC_COVERAGE_RATE, objectives.getCoverageRate());
        metrics.put(METRIC_COST, objectives.getCost());
        metrics.put(METRIC_REDUNDANCY_RATE, solution.getRedundancyRate());
        metrics.put(METRIC_CAPACITY_COVERAGE_RATE, solution.getCapacityCoverageRate());
        metrics.put(METRIC_TOTAL_RESCUE_CAPACITY, solution.getTotalRescueCapacity());
        metrics.put(METRIC_ESTIMATED_AFFECTED, solution.getEstimatedAffected());
        metrics.put(METRIC_UNCOVERED_COUNT, solution.getUncoveredCapabilities().size());
        metrics.put(METRIC_UNCOVERED_CRITICAL_COUNT, solution.getUncoveredCriticalCapabilities().size());
        metrics.put(METRIC_RESOURCE_COUNT, solution.getSelectedResources().size());
        if (goldenHourDeadlineMinutes != null) {
            metrics.put(METRIC_GOLDEN_HOUR_DEADLINE, goldenHourDeadlineMinutes);
        }
        return EventContext.of(metrics);
    }
}
