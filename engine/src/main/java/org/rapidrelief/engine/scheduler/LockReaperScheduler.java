package org.rapidrelief.engine.scheduler;

import org.rapidrelief.engine.lock.ResourceLockManager;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically purges expired resource locks, so locks of crashed runs never outlive their TTL
 * even when no new acquisition happens.
 */
public final class LockReaperScheduler {

    private static final Logger LOG = Logger.getLogger(LockReaperScheduler.class.getName());

    private final ScheduledExecutorService executor;
    private final ResourceLockManager lockManager;
    private final int intervalSeconds;
    private volatile boolean running = false;

    public LockReaperScheduler(ResourceLockManager lockManager, int intervalSeconds) {
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager must not be null");

        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be at least 1");
        }
        this.intervalSeconds = intervalSeconds;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lock-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            LOG.warning("Lock reaper already running");
            return;
        }

        LOG.info(() -> "Starting lock reaper with interval: " + intervalSeconds + "s");

        executor.scheduleAtFixedRate(
                this::reap,
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS
        );

        running = true;
    }

    /**
     * Stop the scheduler.
     */
    public void stop() {
        if (!running) {
            return;
        }

        LOG.info("Stopping lock reaper");
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One purge pass; failures are logged so the schedule keeps running.
     */
    void reap() {
        try {
            int purged = lockManager.purgeExpired();
            if (purged > 0) {
                LOG.info(() -> "Lock reaper removed " + purged + " expired locks");
            }
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Error in lock reaper cycle", e);
        }
    }
}
