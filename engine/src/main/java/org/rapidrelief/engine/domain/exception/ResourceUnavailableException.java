package org.rapidrelief.engine.domain.exception;

import java.util.Collections;
import java.util.Set;

/**
 * Commit-time revalidation found that selected resources are no longer available.
 */
public final class ResourceUnavailableException extends AllocationException {

    private final Set<String> unavailableResources;

    public ResourceUnavailableException(Set<String> unavailableResources) {
        super("RESOURCE_UNAVAILABLE", "Resources no longer available at commit time: " + unavailableResources);
        this.unavailableResources = Collections.unmodifiableSet(unavailableResources);
    }

    public Set<String> getUnavailableResources() {
        return unavailableResources;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
