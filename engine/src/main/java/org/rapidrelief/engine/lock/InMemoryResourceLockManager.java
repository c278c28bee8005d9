package org.rapidrelief.engine.lock;

import org.rapidrelief.engine.domain.exception.LockConflictException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Process-local lock table guarded by a single mutex. Expired entries are purged on every
 * acquisition and by the periodic reaper.
 */
public final class InMemoryResourceLockManager implements ResourceLockManager {

    private static final Logger LOG = Logger.getLogger(InMemoryResourceLockManager.class.getName());

    private final Clock clock;
    private final Lock mutex = new ReentrantLock();
    private final Map<String, ResourceLock> locks = new HashMap<>();

    public InMemoryResourceLockManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public LockHandle acquire(String ownerId, Set<String> resourceIds, Duration ttl) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(resourceIds, "resourceIds must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (resourceIds.isEmpty()) {
            throw new IllegalArgumentException("resourceIds must not be empty");
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        mutex.lock();
        try {
            Instant now = clock.instant();
            purgeExpiredLocked(now);

            Set<String> conflicts = new TreeSet<>();
            Duration retryAfter = Duration.ZERO;
            for (String resourceId : resourceIds) {
                ResourceLock existing = locks.get(resourceId);
                if (existing != null) {
                    conflicts.add(resourceId);
                    Duration remaining = Duration.between(now, existing.getExpiresAt());
                    if (remaining.compareTo(retryAfter) > 0) {
                        retryAfter = remaining;
                    }
                }
            }
            if (!conflicts.isEmpty()) {
                LOG.info(() -> String.format("Lock conflict for %s on %s", ownerId, conflicts));
                throw new LockConflictException(conflicts, retryAfter);
            }

            LockHandle handle = new LockHandle(UUID.randomUUID().toString(), ownerId, resourceIds, now,
                    now.plus(ttl));
            for (String resourceId : handle.getResourceIds()) {
                locks.put(resourceId, new ResourceLock(resourceId, handle.getHandleId(), ownerId,
                        handle.getExpiresAt()));
            }
            LOG.fine(() -> "Acquired " + handle);
            return handle;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public void release(LockHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        mutex.lock();
        try {
            int released = 0;
            for (String resourceId : handle.getResourceIds()) {
                ResourceLock existing = locks.get(resourceId);
                if (existing != null && existing.getHandleId().equals(handle.getHandleId())) {
                    locks.remove(resourceId);
                    released++;
                }
            }
            int count = released;
            LOG.fine(() -> String.format("Released %d/%d locks of %s", count,
                    handle.getResourceIds().size(), handle.getOwnerId()));
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public List<ResourceLock> activeLocks() {
        mutex.lock();
        try {
            Instant now = clock.instant();
            List<ResourceLock> active = new ArrayList<>();
            for (ResourceLock lock : locks.values()) {
                if (!lock.isExpired(now)) {
                    active.add(lock);
                }
            }
            active.sort(Comparator.comparing(ResourceLock::getResourceId));
            return active;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public int purgeExpired() {
        mutex.lock();
        try {
            return purgeExpiredLocked(clock.instant());
        } finally {
            mutex.unlock();
        }
    }

    private int purgeExpiredLocked(Instant now) {
        int purged = 0;
        Iterator<ResourceLock> iterator = locks.values().iterator();
        while (iterator.hasNext()) {
            ResourceLock lock = iterator.next();
            if (lock.isExpired(now)) {
                iterator.remove();
                purged++;
                LOG.warning(() -> "Lock on " + lock.getResourceId() + " held by " + lock.getOwnerId()
                        + " expired without release");
            }
        }
        return purged;
    }
}
