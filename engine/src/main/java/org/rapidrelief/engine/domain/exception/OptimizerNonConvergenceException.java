package org.rapidrelief.engine.domain.exception;

/**
 * The optimizer finished its generation budget without a feasible allocation,
 * or failed internally.
 */
public final class OptimizerNonConvergenceException extends AllocationException {

    public OptimizerNonConvergenceException(String message) {
        super("OPTIMIZER_NON_CONVERGENCE", message);
    }

    public OptimizerNonConvergenceException(String message, Throwable cause) {
        super("OPTIMIZER_NON_CONVERGENCE", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
