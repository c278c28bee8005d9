package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.model.AllocationPlan;
import org.rapidrelief.engine.domain.model.AllocationRequest;

import java.util.concurrent.Future;

/**
 * End-to-end allocation run: rules, decomposition, catalog query, optimization,
 * filtering, optional human review and commit under resource locks.
 */
public interface AllocationPipeline {

    /**
     * Runs the pipeline on the calling thread.
     *
     * @param request the allocation request
     * @return the plan; runs without matching rules, without feasible solution or rejected in
     *         review return a plan with the corresponding status
     * @throws org.rapidrelief.engine.domain.exception.AllocationException for run-level failures
     */
    AllocationPlan allocate(AllocationRequest request);

    /**
     * Runs the pipeline as an independent task. Cancelling the future with interruption aborts
     * the run at its next suspension point, releasing any locks it holds.
     */
    Future<AllocationPlan> allocateAsync(AllocationRequest request);
}
