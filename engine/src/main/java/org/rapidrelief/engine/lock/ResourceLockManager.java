package org.rapidrelief.engine.lock;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Mutual exclusion over resource sets across concurrent pipeline runs.
 */
public interface ResourceLockManager {

    /**
     * Locks every requested resource or none of them. Fails fast instead of waiting.
     *
     * @param ownerId run acquiring the locks
     * @param resourceIds resources to lock, must not be empty
     * @param ttl time after which the locks expire if never released
     * @return handle for {@link #release(LockHandle)}
     * @throws org.rapidrelief.engine.domain.exception.LockConflictException if any resource is
     *         already locked, including by the same owner
     */
    LockHandle acquire(String ownerId, Set<String> resourceIds, Duration ttl);

    /**
     * Releases the locks still held by this handle. Calling it twice is harmless.
     */
    void release(LockHandle handle);

    /**
     * Snapshot of unexpired locks.
     */
    List<ResourceLock> activeLocks();

    /**
     * Drops expired locks.
     *
     * @return number of locks removed
     */
    int purgeExpired();
}
