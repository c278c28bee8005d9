package org.rapidrelief.engine.review;

import org.rapidrelief.engine.domain.model.ReviewDecision;
import org.rapidrelief.engine.domain.model.ScoredSolution;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Review gate completed from outside, typically by the callback server.
 * Each waiting run is registered under its run id until a decision arrives or its wait ends.
 */
public final class PendingReviewRegistry implements HumanReviewGate {

    private static final Logger LOG = Logger.getLogger(PendingReviewRegistry.class.getName());

    private final Clock clock;
    private final Map<String, PendingReview> pending = new ConcurrentHashMap<>();

    public PendingReviewRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ReviewDecision awaitDecision(String runId, ScoredSolution solution, Duration timeout)
            throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        PendingReview review = new PendingReview(runId, solution, clock.instant());
        if (pending.putIfAbsent(runId, review) != null) {
            throw new IllegalStateException("Run " + runId + " is already awaiting review");
        }
        LOG.info(() -> String.format("Run %s awaiting review of %s (timeout %ds)",
                runId, solution.getSolution().getSolutionId(), timeout.getSeconds()));
        try {
            ReviewDecision decision = review.getDecision().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.info(() -> "Run " + runId + " reviewed: " + decision);
            return decision;
        } catch (TimeoutException e) {
            LOG.warning(() -> "Review of run " + runId + " timed out, treating as rejection");
            return ReviewDecision.timedOut();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Review of run " + runId + " failed", e.getCause());
        } finally {
            pending.remove(runId, review);
        }
    }

    /**
     * Delivers a decision to a waiting run.
     *
     * @return false when no run with that id is waiting
     */
    public boolean submit(String runId, ReviewDecision decision) {
        Objects.requireNonNull(decision, "decision must not be null");
        PendingReview review = pending.get(runId);
        if (review == null) {
            LOG.warning(() -> "No pending review for run " + runId);
            return false;
        }
        return review.getDecision().complete(decision);
    }

    /**
     * Runs currently waiting, oldest first.
     */
    public List<PendingReview> pendingReviews() {
        List<PendingReview> snapshot = new ArrayList<>(pending.values());
        snapshot.sort(Comparator.comparing(PendingReview::getRequestedAt).thenComparing(PendingReview::getRunId));
        return snapshot;
    }
}
