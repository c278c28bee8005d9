package org.rapidrelief.engine.lock;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One locked resource, as reported by {@link ResourceLockManager#activeLocks()}.
 */
public final class ResourceLock {

    private final String resourceId;
    private final String handleId;
    private final String ownerId;
    private final Instant expiresAt;

    public ResourceLock(String resourceId, String handleId, String ownerId, Instant expiresAt) {
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId must not be null");
        this.handleId = Objects.requireNonNull(handleId, "handleId must not be null");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    @JsonProperty("resource_id")
    public String getResourceId() {
        return resourceId;
    }

    @JsonProperty("handle_id")
    public String getHandleId() {
        return handleId;
    }

    @JsonProperty("owner_id")
    public String getOwnerId() {
        return ownerId;
    }

    @JsonProperty("expires_at")
    public Instant getExpiresAt() {
        return expiresAt;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return resourceId + "@" + ownerId + " until " + expiresAt;
    }
}
