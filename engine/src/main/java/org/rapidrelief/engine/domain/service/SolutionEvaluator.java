package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.AllocationProblem;
import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.ObjectiveValues;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.rapidrelief.engine.domain.model.Violation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes every metric of an allocation from its selected resources.
 * <ul>
 *   <li>response time: largest ETA of the selection</li>
 *   <li>coverage rate: covered required capabilities / required (1 when nothing is required)</li>
 *   <li>cost: sum of deployment costs</li>
 *   <li>risk: {@code 1 - coverage x (1 - max hazard)}</li>
 *   <li>capacity coverage: {@code total capacity / max(affected, 1)}</li>
 *   <li>redundancy: fraction of required capabilities covered by two or more resources</li>
 * </ul>
 * A capacity warning is attached when people are affected and capacity coverage is below
 * the configured threshold.
 */
public final class SolutionEvaluator {

    private final ScoringService scoringService;
    private final AllocationConfig config;

    public SolutionEvaluator(ScoringService scoringService, AllocationConfig config) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public AllocationSolution evaluate(String solutionId, String strategy, List<ResourceCandidate> selected,
                                       AllocationProblem problem) {
        Set<String> required = problem.getRequiredCapabilities();
        Map<String, Integer> providers = new HashMap<>();
        List<String> ids = new ArrayList<>(selected.size());
        int totalCapacity = 0;
        double responseTime = 0.0;
        double cost = 0.0;
        double maxHazard = 0.0;
        double matchSum = 0.0;

        for (ResourceCandidate candidate : selected) {
            ids.add(candidate.getId());
            totalCapacity += candidate.requireRescueCapacity();
            responseTime = Math.max(responseTime, candidate.getEtaMinutes());
            cost += candidate.getDeploymentCost();
            maxHazard = Math.max(maxHazard, candidate.getHazardLevel());
            matchSum += scoringService.score(candidate, required, config).getScore();
            for (String capability : candidate.getCapabilities()) {
                if (required.contains(capability)) {
                    providers.merge(capability, 1, Integer::sum);
                }
            }
        }

        Set<String> covered = new LinkedHashSet<>();
        Set<String> uncovered = new LinkedHashSet<>();
        int redundant = 0;
        for (String capability : required) {
            int count = providers.getOrDefault(capability, 0);
            if (count > 0) {
                covered.add(capability);
            } else {
                uncovered.add(capability);
            }
            if (count >= 2) {
                redundant++;
            }
        }
        Set<String> uncoveredCritical = new LinkedHashSet<>(problem.getCriticalCapabilities());
        uncoveredCritical.retainAll(uncovered);

        double coverageRate = required.isEmpty() ? 1.0 : (double) covered.size() / required.size();
        double redundancyRate = required.isEmpty() ? 1.0 : (double) redundant / required.size();
        double risk = 1.0 - coverageRate * (1.0 - maxHazard);
        int affected = problem.getEstimatedAffected();
        double capacityCoverage = capacityCoverage(totalCapacity, affected);

        String capacityWarning = null;
        List<Violation> violations = new ArrayList<>();
        if (affected > 0 && capacityCoverage < config.getCoverageThreshold()) {
            capacityWarning = String.format(
                    "Rescue capacity %d covers %.1f%% of %d affected people (target %.0f%%); %d people without rescue capacity",
                    totalCapacity, capacityCoverage * 100.0, affected, config.getCoverageThreshold() * 100.0,
                    Math.max(0, affected - totalCapacity));
            violations.add(Violation.warning(Violation.CAPACITY_WARNING, capacityWarning));
        }

        return new AllocationSolution.Builder()
                .solutionId(solutionId)
                .strategy(strategy)
                .selectedResources(ids)
                .coveredCapabilities(covered)
                .uncoveredCapabilities(uncovered)
                .uncoveredCriticalCapabilities(uncoveredCritical)
                .totalRescueCapacity(totalCapacity)
                .estimatedAffected(affected)
                .capacityCoverageRate(capacityCoverage)
                .objectiveValues(new ObjectiveValues(responseTime, coverageRate, cost, risk))
                .redundancyRate(redundancyRate)
                .meanMatchScore(selected.isEmpty() ? 0.0 : matchSum / selected.size())
                .capacityWarning(capacityWarning)
                .violations(violations)
                .build();
    }

    /**
     * {@code total / max(affected, 1)}.
     */
    public static double capacityCoverage(int totalCapacity, int estimatedAffected) {
        return (double) totalCapacity / Math.max(estimatedAffected, 1);
    }
}
