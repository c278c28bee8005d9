package org.rapidrelief.engine.review;

import org.rapidrelief.engine.domain.model.ReviewDecision;
import org.rapidrelief.engine.domain.model.ScoredSolution;

import java.time.Duration;

/**
 * Pauses a run until a human approves, rejects or modifies a flagged solution.
 */
public interface HumanReviewGate {

    /**
     * Blocks until a decision arrives or the timeout elapses.
     *
     * @param runId run waiting for review
     * @param solution solution to review
     * @param timeout maximum wait
     * @return the reviewer's decision, or {@link ReviewDecision#timedOut()} when nobody answered
     * @throws InterruptedException if the waiting thread is interrupted
     */
    ReviewDecision awaitDecision(String runId, ScoredSolution solution, Duration timeout) throws InterruptedException;
}
