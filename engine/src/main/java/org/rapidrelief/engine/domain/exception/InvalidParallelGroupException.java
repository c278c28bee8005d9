package org.rapidrelief.engine.domain.exception;

import java.util.Set;

/**
 * A declared parallel group contains two tasks that depend on each other.
 */
public final class InvalidParallelGroupException extends AllocationException {

    public InvalidParallelGroupException(Set<String> group, String dependent, String dependency) {
        super("INVALID_PARALLEL_GROUP", String.format(
                "Parallel group %s is invalid: %s depends on %s", group, dependent, dependency));
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
