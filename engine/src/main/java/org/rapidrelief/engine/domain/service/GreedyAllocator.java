package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.AllocationProblem;
import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.rapidrelief.engine.domain.model.ScoredCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Deterministic capacity-aware greedy selection, run over three candidate orderings
 * (match score, ETA, rescue capacity). Identical selections are collapsed.
 * <p>
 * A candidate is taken when it adds a missing required capability, or when people are
 * affected, capacity is still short of {@code coverage_threshold x affected} and the
 * candidate brings capacity. Selection stops only once every required capability is
 * covered and, when people are affected, the capacity target is reached. Running out of
 * candidates still yields a solution, carrying a capacity warning.
 */
public final class GreedyAllocator {

    private static final Logger LOG = Logger.getLogger(GreedyAllocator.class.getName());

    public static final String BY_MATCH_SCORE = "greedy:match_score";
    public static final String BY_ETA = "greedy:eta";
    public static final String BY_CAPACITY = "greedy:capacity";

    private final ScoringService scoringService;
    private final SolutionEvaluator evaluator;
    private final AllocationConfig config;

    public GreedyAllocator(ScoringService scoringService, SolutionEvaluator evaluator, AllocationConfig config) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public List<AllocationSolution> allocate(AllocationProblem problem) {
        List<ScoredCandidate> scored = new ArrayList<>();
        for (ResourceCandidate candidate : problem.getAllocatableCandidates()) {
            scored.add(scoringService.score(candidate, problem.getRequiredCapabilities(), config));
        }

        Map<String, Comparator<ScoredCandidate>> orderings = new LinkedHashMap<>();
        orderings.put(BY_MATCH_SCORE, Comparator.naturalOrder());
        orderings.put(BY_ETA, Comparator.comparingDouble((ScoredCandidate c) -> c.getCandidate().getEtaMinutes())
                .thenComparing(Comparator.<ScoredCandidate>naturalOrder()));
        orderings.put(BY_CAPACITY, Comparator
                .comparingInt((ScoredCandidate c) -> c.getCandidate().requireRescueCapacity()).reversed()
                .thenComparing(Comparator.<ScoredCandidate>naturalOrder()));

        List<AllocationSolution> solutions = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        for (Map.Entry<String, Comparator<ScoredCandidate>> ordering : orderings.entrySet()) {
            List<ScoredCandidate> ordered = new ArrayList<>(scored);
            ordered.sort(ordering.getValue());
            List<ResourceCandidate> selection = select(ordered, problem);

            Set<String> key = new TreeSet<>();
            selection.forEach(c -> key.add(c.getId()));
            if (!seen.add(key)) {
                LOG.fine(() -> ordering.getKey() + " produced a duplicate selection");
                continue;
            }
            solutions.add(evaluator.evaluate("greedy-" + (solutions.size() + 1), ordering.getKey(),
                    selection, problem));
        }

        LOG.info(() -> String.format("Greedy allocation over %d candidates produced %d distinct solutions",
                scored.size(), solutions.size()));
        return solutions;
    }

    /**
     * One greedy pass over candidates in the given order.
     */
    List<ResourceCandidate> select(List<ScoredCandidate> ordered, AllocationProblem problem) {
        Set<String> required = problem.getRequiredCapabilities();
        int affected = problem.getEstimatedAffected();
        double capacityTarget = config.getCoverageThreshold() * affected;

        List<ResourceCandidate> selected = new ArrayList<>();
        Set<String> covered = new HashSet<>();
        int totalCapacity = 0;

        for (ScoredCandidate scored : ordered) {
            if (isSatisfied(covered, required, totalCapacity, affected, capacityTarget)) {
                break;
            }
            ResourceCandidate candidate = scored.getCandidate();
            boolean addsCapability = candidate.getCapabilities().stream()
                    .anyMatch(capability -> required.contains(capability) && !covered.contains(capability));
            boolean addsCapacity = affected > 0
                    && totalCapacity < capacityTarget
                    && candidate.requireRescueCapacity() > 0;
            if (addsCapability || addsCapacity) {
                selected.add(candidate);
                totalCapacity += candidate.requireRescueCapacity();
                for (String capability : candidate.getCapabilities()) {
                    if (required.contains(capability)) {
                        covered.add(capability);
                    }
                }
            }
        }

        int backups = config.getGreedyRedundancyBackups();
        for (ScoredCandidate scored : ordered) {
            if (backups <= 0) {
                break;
            }
            if (!selected.contains(scored.getCandidate()) && scored.getCapabilityOverlap() > 0.0
                    && !required.isEmpty()) {
                selected.add(scored.getCandidate());
                backups--;
            }
        }
        return selected;
    }

    private static boolean isSatisfied(Set<String> covered, Set<String> required, int totalCapacity,
                                       int affected, double capacityTarget) {
        return covered.containsAll(required) && (affected == 0 || totalCapacity >= capacityTarget);
    }
}
