package org.rapidrelief.engine.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rapidrelief.engine.domain.exception.LockConflictException;
import org.rapidrelief.engine.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class InMemoryResourceLockManagerTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    private MutableClock clock;
    private InMemoryResourceLockManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-11-29T08:00:00Z"));
        manager = new InMemoryResourceLockManager(clock);
    }

    @Test
    @DisplayName("disjoint resource sets can be locked side by side")
    void acquireDisjointSets() {
        LockHandle first = manager.acquire("run-1", setOf("r1", "r2"), TTL);
        LockHandle second = manager.acquire("run-2", setOf("r3"), TTL);

        assertThat(first.getResourceIds()).containsExactlyInAnyOrder("r1", "r2");
        assertThat(second.getExpiresAt()).isEqualTo(Instant.parse("2025-11-29T08:00:30Z"));
        assertThat(manager.activeLocks()).extracting(ResourceLock::getResourceId)
                .containsExactly("r1", "r2", "r3");
    }

    @Test
    @DisplayName("a single overlap locks nothing and reports the conflicting resources")
    void acquireIsAllOrNothing() {
        manager.acquire("run-1", setOf("r2"), TTL);
        clock.advance(Duration.ofSeconds(10));

        LockConflictException conflict = catchThrowableOfType(
                () -> manager.acquire("run-2", setOf("r1", "r2", "r3"), TTL),
                LockConflictException.class);

        assertThat(conflict.getConflictingResources()).containsExactly("r2");
        assertThat(conflict.getRetryAfter()).isEqualTo(Duration.ofSeconds(20));
        assertThat(conflict.isRetryable()).isTrue();
        assertThat(manager.activeLocks()).extracting(ResourceLock::getResourceId).containsExactly("r2");
    }

    @Test
    @DisplayName("locks are not re-entrant for the same owner")
    void sameOwnerCannotReacquire() {
        manager.acquire("run-1", setOf("r1"), TTL);

        assertThatThrownBy(() -> manager.acquire("run-1", setOf("r1"), TTL))
                .isInstanceOf(LockConflictException.class);
    }

    @Test
    @DisplayName("empty resource sets and non-positive TTLs are rejected")
    void acquireValidatesArguments() {
        assertThatThrownBy(() -> manager.acquire("run-1", Collections.emptySet(), TTL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.acquire("run-1", setOf("r1"), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("expired locks free their resources for other runs")
    void expiredLocksAreReleased() {
        manager.acquire("run-1", setOf("r1"), TTL);
        clock.advance(TTL);

        assertThat(manager.activeLocks()).isEmpty();
        LockHandle handle = manager.acquire("run-2", setOf("r1"), TTL);
        assertThat(handle.getOwnerId()).isEqualTo("run-2");
    }

    @Test
    @DisplayName("purgeExpired reports how many locks it removed")
    void purgeExpiredCountsRemoved() {
        manager.acquire("run-1", setOf("r1", "r2"), Duration.ofSeconds(5));
        manager.acquire("run-2", setOf("r3"), TTL);
        clock.advance(Duration.ofSeconds(6));

        assertThat(manager.purgeExpired()).isEqualTo(2);
        assertThat(manager.purgeExpired()).isZero();
        assertThat(manager.activeLocks()).extracting(ResourceLock::getOwnerId).containsExactly("run-2");
    }

    @Test
    @DisplayName("release is idempotent and never frees another handle's lock")
    void releaseIsIdempotentAndScopedToHandle() {
        LockHandle stale = manager.acquire("run-1", setOf("r1"), Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(5));
        LockHandle fresh = manager.acquire("run-2", setOf("r1"), TTL);

        manager.release(stale);
        manager.release(stale);
        assertThat(manager.activeLocks()).extracting(ResourceLock::getHandleId)
                .containsExactly(fresh.getHandleId());

        manager.release(fresh);
        manager.release(fresh);
        assertThat(manager.activeLocks()).isEmpty();
    }

    @Test
    @DisplayName("concurrent overlapping requests grant the shared resource once")
    void concurrentAcquireGrantsEachResourceOnce() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<LockHandle>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String owner = "run-" + i;
                Set<String> resources = setOf("shared", "r" + i);
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        LockHandle handle = manager.acquire(owner, resources, TTL);
                        granted.incrementAndGet();
                        return handle;
                    } catch (LockConflictException e) {
                        conflicts.incrementAndGet();
                        return null;
                    }
                }));
            }
            start.countDown();

            List<LockHandle> handles = new ArrayList<>();
            for (Future<LockHandle> future : futures) {
                LockHandle handle = future.get(5, TimeUnit.SECONDS);
                if (handle != null) {
                    handles.add(handle);
                }
            }

            assertThat(granted.get()).isEqualTo(1);
            assertThat(conflicts.get()).isEqualTo(threads - 1);
            assertThat(manager.activeLocks()).hasSize(2)
                    .allSatisfy(lock -> assertThat(lock.getHandleId()).isEqualTo(handles.get(0).getHandleId()));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("concurrent disjoint requests all succeed")
    void concurrentDisjointAcquireAllSucceed() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LockHandle>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Set<String> resources = setOf("a" + i, "b" + i);
                String owner = "run-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return manager.acquire(owner, resources, TTL);
                }));
            }
            start.countDown();
            Set<String> handleIds = new HashSet<>();
            for (Future<LockHandle> future : futures) {
                handleIds.add(future.get(5, TimeUnit.SECONDS).getHandleId());
            }

            assertThat(handleIds).hasSize(threads);
            assertThat(manager.activeLocks()).hasSize(threads * 2);
        } finally {
            executor.shutdownNow();
        }
    }

    private static Set<String> setOf(String... ids) {
        return new LinkedHashSet<>(Arrays.asList(ids));
    }
}
