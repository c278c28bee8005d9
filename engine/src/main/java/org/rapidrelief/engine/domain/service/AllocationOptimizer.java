package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.OptimizationMode;
import org.rapidrelief.engine.domain.model.Requirement;
import org.rapidrelief.engine.domain.model.ResourceCandidate;

import java.util.List;

/**
 * Selects resources for a set of requirements.
 */
public interface AllocationOptimizer {

    /**
     * Produces one or more allocation solutions. Never falls back to another mode on failure.
     *
     * @param requirements requirements of the run
     * @param candidates candidate snapshot; every rescue capacity must already be resolved
     * @param estimatedAffected people affected, 0 for purely capability-driven tasks
     * @param mode optimization mode
     * @return at least one solution
     * @throws org.rapidrelief.engine.domain.exception.OptimizerTimeoutException if multi-objective
     *         optimization runs out of time with no feasible individual
     * @throws org.rapidrelief.engine.domain.exception.OptimizerNonConvergenceException if it ends
     *         without a feasible individual or fails internally
     */
    List<AllocationSolution> optimize(List<Requirement> requirements, List<ResourceCandidate> candidates,
                                      int estimatedAffected, OptimizationMode mode);

    /**
     * Mode used when the caller does not force one: multi-objective above the configured candidate count.
     */
    OptimizationMode selectMode(int allocatableCandidates);
}
