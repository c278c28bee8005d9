package org.rapidrelief.engine.domain.exception;

import java.time.Duration;

/**
 * The multi-objective optimizer ran out of time before finding any feasible allocation.
 */
public final class OptimizerTimeoutException extends AllocationException {

    private final Duration timeout;

    public OptimizerTimeoutException(Duration timeout, int generationsCompleted) {
        super("OPTIMIZER_TIMEOUT", String.format(
                "No feasible allocation within %ds (%d generations completed)",
                timeout.getSeconds(), generationsCompleted));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
