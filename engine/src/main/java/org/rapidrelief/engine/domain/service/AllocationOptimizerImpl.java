package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.exception.AllocationException;
import org.rapidrelief.engine.domain.exception.OptimizerNonConvergenceException;
import org.rapidrelief.engine.domain.model.AllocationProblem;
import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.OptimizationMode;
import org.rapidrelief.engine.domain.model.Requirement;
import org.rapidrelief.engine.domain.model.ResourceCandidate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Implementation of AllocationOptimizer.
 *
 * Greedy mode returns the greedy baselines. Multi-objective mode seeds NSGA-II with those
 * baselines and returns its Pareto front; any failure is raised to the caller as is.
 */
public final class AllocationOptimizerImpl implements AllocationOptimizer {

    private static final Logger LOG = Logger.getLogger(AllocationOptimizerImpl.class.getName());

    private final GreedyAllocator greedyAllocator;
    private final Nsga2Allocator nsga2Allocator;
    private final AllocationConfig config;

    public AllocationOptimizerImpl(ScoringService scoringService, AllocationConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        SolutionEvaluator evaluator = new SolutionEvaluator(scoringService, config);
        this.greedyAllocator = new GreedyAllocator(scoringService, evaluator, config);
        this.nsga2Allocator = new Nsga2Allocator(evaluator, config, clock);
    }

    @Override
    public List<AllocationSolution> optimize(List<Requirement> requirements, List<ResourceCandidate> candidates,
                                             int estimatedAffected, OptimizationMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        AllocationProblem problem = new AllocationProblem(requirements, candidates, estimatedAffected);
        int allocatable = problem.getAllocatableCandidates().size();
        LOG.info(() -> String.format("Optimizing in %s mode: %d candidates (%d allocatable), %d required capabilities, %d affected",
                mode, problem.getCandidates().size(), allocatable, problem.getRequiredCapabilities().size(),
                estimatedAffected));

        List<AllocationSolution> greedy = greedyAllocator.allocate(problem);
        if (mode == OptimizationMode.GREEDY) {
            return greedy;
        }

        Duration timeout = timeoutFor(allocatable);
        try {
            return nsga2Allocator.allocate(problem, greedy, timeout);
        } catch (AllocationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e, () -> "Multi-objective optimization failed");
            throw new OptimizerNonConvergenceException("Multi-objective optimization failed: " + e.getMessage(), e);
        }
    }

    @Override
    public OptimizationMode selectMode(int allocatableCandidates) {
        return allocatableCandidates > config.getMultiObjectiveCandidateThreshold()
                ? OptimizationMode.MULTI_OBJECTIVE
                : OptimizationMode.GREEDY;
    }

    /**
     * Larger candidate sets get the larger time budget.
     */
    Duration timeoutFor(int allocatableCandidates) {
        long seconds = allocatableCandidates > config.getLargeInstanceCandidateThreshold()
                ? config.getOptimizerTimeoutSecondsLarge()
                : config.getOptimizerTimeoutSecondsSmall();
        return Duration.ofSeconds(seconds);
    }
}
