package org.rapidrelief.engine.domain.exception;

import java.time.Duration;
import java.util.Collections;
import java.util.Set;

/**
 * One or more requested resources are locked by another run.
 * Nothing was locked by the failed attempt.
 */
public final class LockConflictException extends AllocationException {

    private final Set<String> conflictingResources;
    private final Duration retryAfter;

    public LockConflictException(Set<String> conflictingResources, Duration retryAfter) {
        super("RESOURCE_LOCKED", "Resources already locked: " + conflictingResources);
        this.conflictingResources = Collections.unmodifiableSet(conflictingResources);
        this.retryAfter = retryAfter;
    }

    public Set<String> getConflictingResources() {
        return conflictingResources;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
