package org.rapidrelief.engine.lock;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Proof of ownership of a batch of resource locks. Release is keyed on the handle id,
 * so a handle whose locks already expired cannot release locks taken by someone else.
 */
public final class LockHandle {

    private final String handleId;
    private final String ownerId;
    private final Set<String> resourceIds;
    private final Instant acquiredAt;
    private final Instant expiresAt;

    public LockHandle(String handleId, String ownerId, Set<String> resourceIds, Instant acquiredAt,
                      Instant expiresAt) {
        this.handleId = Objects.requireNonNull(handleId, "handleId must not be null");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
        this.resourceIds = Collections.unmodifiableSet(new TreeSet<>(
                Objects.requireNonNull(resourceIds, "resourceIds must not be null")));
        this.acquiredAt = Objects.requireNonNull(acquiredAt, "acquiredAt must not be null");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    public String getHandleId() {
        return handleId;
    }

    /**
     * The pipeline run holding the locks.
     */
    public String getOwnerId() {
        return ownerId;
    }

    public Set<String> getResourceIds() {
        return resourceIds;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return handleId.equals(((LockHandle) o).handleId);
    }

    @Override
    public int hashCode() {
        return handleId.hashCode();
    }

    @Override
    public String toString() {
        return "LockHandle{handleId='" + handleId + "', ownerId='" + ownerId + "', resources=" + resourceIds
                + ", expiresAt=" + expiresAt + '}';
    }
}
