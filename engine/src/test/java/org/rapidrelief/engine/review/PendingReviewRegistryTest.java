package org.rapidrelief.engine.review;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rapidrelief.engine.domain.model.ReviewDecision;
import org.rapidrelief.engine.support.TestCandidates;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingReviewRegistryTest {

    private PendingReviewRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        registry = new PendingReviewRegistry(Clock.fixed(Instant.parse("2025-11-29T08:00:00Z"), ZoneOffset.UTC));
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("a submitted decision wakes the waiting run")
    void submitCompletesWaitingRun() throws Exception {
        Future<ReviewDecision> waiting = executor.submit(() ->
                registry.awaitDecision("run-1", TestCandidates.scored("greedy-1", "r1", "r2"), Duration.ofSeconds(10)));
        awaitPending("run-1");

        PendingReview pending = registry.pendingReviews().get(0);
        assertThat(pending.getSolutionId()).isEqualTo("greedy-1");
        assertThat(pending.getResourceIds()).containsExactly("r1", "r2");

        assertThat(registry.submit("run-1", ReviewDecision.approve("duty-officer", "ok"))).isTrue();

        ReviewDecision decision = waiting.get(5, TimeUnit.SECONDS);
        assertThat(decision.getType()).isEqualTo(ReviewDecision.Type.APPROVE);
        assertThat(decision.getReviewer()).isEqualTo("duty-officer");
        assertThat(registry.pendingReviews()).isEmpty();
    }

    @Test
    @DisplayName("a modify decision carries the replacement resources")
    void modifyDecisionCarriesReplacement() throws Exception {
        Future<ReviewDecision> waiting = executor.submit(() ->
                registry.awaitDecision("run-2", TestCandidates.scored("nsga2-1", "r1"), Duration.ofSeconds(10)));
        awaitPending("run-2");

        registry.submit("run-2", ReviewDecision.modify(Arrays.asList("r7", "r8"), "duty-officer", null));

        ReviewDecision decision = waiting.get(5, TimeUnit.SECONDS);
        assertThat(decision.getType()).isEqualTo(ReviewDecision.Type.MODIFY);
        assertThat(decision.getReplacementResourceIds()).containsExactly("r7", "r8");
    }

    @Test
    @DisplayName("no answer before the timeout counts as a rejection")
    void timeoutIsRejection() throws Exception {
        ReviewDecision decision = registry.awaitDecision("run-3", TestCandidates.scored("greedy-1", "r1"),
                Duration.ofMillis(50));

        assertThat(decision.getType()).isEqualTo(ReviewDecision.Type.REJECT);
        assertThat(decision.getReviewer()).isEqualTo("system");
        assertThat(registry.pendingReviews()).isEmpty();
    }

    @Test
    @DisplayName("decisions for unknown runs are refused")
    void submitForUnknownRun() {
        assertThat(registry.submit("missing", ReviewDecision.reject("duty-officer", "no"))).isFalse();
    }

    @Test
    @DisplayName("a run cannot wait on two reviews at once")
    void duplicateRunIdIsRejected() throws Exception {
        executor.submit(() ->
                registry.awaitDecision("run-4", TestCandidates.scored("greedy-1", "r1"), Duration.ofSeconds(10)));
        awaitPending("run-4");

        assertThatThrownBy(() -> registry.awaitDecision("run-4", TestCandidates.scored("greedy-2", "r2"),
                Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("run-4");

        registry.submit("run-4", ReviewDecision.reject("duty-officer", "done"));
    }

    @Test
    @DisplayName("modify decisions need replacement resources")
    void modifyRequiresResources() {
        assertThatThrownBy(() -> ReviewDecision.modify(Collections.emptyList(), "duty-officer", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void awaitPending(String runId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (registry.pendingReviews().stream().noneMatch(r -> r.getRunId().equals(runId))) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("run " + runId + " never started waiting");
            }
            Thread.sleep(10);
        }
    }
}
