package org.rapidrelief.engine.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rapidrelief.engine.api.dto.AllocationRequestDto;
import org.rapidrelief.engine.api.dto.LocationDto;
import org.rapidrelief.engine.api.dto.ReviewDecisionDto;
import org.rapidrelief.engine.domain.exception.CyclicDependencyException;
import org.rapidrelief.engine.domain.exception.LockConflictException;
import org.rapidrelief.engine.domain.exception.OptimizerNonConvergenceException;
import org.rapidrelief.engine.domain.exception.ResourceCatalogException;
import org.rapidrelief.engine.domain.model.AllocationPlan;
import org.rapidrelief.engine.domain.model.AllocationRequest;
import org.rapidrelief.engine.domain.model.OptimizationMode;
import org.rapidrelief.engine.domain.model.PlanStatus;
import org.rapidrelief.engine.domain.model.ReviewDecision;
import org.rapidrelief.engine.domain.service.AllocationPipeline;
import org.rapidrelief.engine.lock.InMemoryResourceLockManager;
import org.rapidrelief.engine.review.PendingReviewRegistry;
import org.rapidrelief.engine.support.TestCandidates;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallbackServerTest {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final String ALLOCATION_BODY = "{\"event_id\": \"EVT-7\","
            + " \"context\": {\"disaster_type\": \"earthquake\", \"has_trapped\": true},"
            + " \"scene_codes\": [\"EQ_COLLAPSE\"],"
            + " \"center\": {\"latitude\": 30.66, \"longitude\": 104.06},"
            + " \"radius_km\": 30, \"estimated_affected\": 250, \"max_results\": 80, \"mode\": \"greedy\"}";

    @Mock
    private AllocationPipeline pipeline;

    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient client = new OkHttpClient.Builder()
            .readTimeout(10, TimeUnit.SECONDS)
            .build();

    private PendingReviewRegistry reviews;
    private InMemoryResourceLockManager lockManager;
    private CallbackServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        reviews = new PendingReviewRegistry(Clock.systemUTC());
        lockManager = new InMemoryResourceLockManager(Clock.systemUTC());
        server = new CallbackServer(0, pipeline, reviews, lockManager, Duration.ofSeconds(5));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("health answers healthy")
    void health() throws IOException {
        try (Response response = client.newCall(new Request.Builder().url(baseUrl + "/health").build()).execute()) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.body().string()).contains("healthy");
        }
    }

    @Test
    @DisplayName("an allocation request runs the pipeline and returns the plan")
    void allocationReturnsPlan() throws IOException {
        when(pipeline.allocateAsync(any(AllocationRequest.class))).thenReturn(CompletableFuture.completedFuture(
                new AllocationPlan.Builder()
                        .runId("run-1")
                        .eventId("EVT-7")
                        .status(PlanStatus.NO_MATCHING_RULES)
                        .build()));

        try (Response response = post("/allocations", ALLOCATION_BODY)) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode plan = mapper.readTree(response.body().string());
            assertThat(plan.get("run_id").asText()).isEqualTo("run-1");
            assertThat(plan.get("status").asText()).isEqualTo("NO_MATCHING_RULES");
        }

        ArgumentCaptor<AllocationRequest> captor = ArgumentCaptor.forClass(AllocationRequest.class);
        verify(pipeline).allocateAsync(captor.capture());
        AllocationRequest request = captor.getValue();
        assertThat(request.getEventId()).isEqualTo("EVT-7");
        assertThat(request.getMaxResults()).isEqualTo(80);
        assertThat(request.getMode()).isEqualTo(OptimizationMode.GREEDY);
        assertThat(request.getContext().resolve("has_trapped")).contains(true);
    }

    @Test
    @DisplayName("lock conflicts answer 409 with Retry-After")
    void lockConflictIs409() throws IOException {
        when(pipeline.allocateAsync(any(AllocationRequest.class))).thenReturn(CompletableFuture.failedFuture(
                new LockConflictException(Collections.singleton("SR-01"), Duration.ofSeconds(42))));

        try (Response response = post("/allocations", ALLOCATION_BODY)) {
            assertThat(response.code()).isEqualTo(409);
            assertThat(response.header("Retry-After")).isEqualTo("42");
            JsonNode error = mapper.readTree(response.body().string());
            assertThat(error.get("error").asText()).isEqualTo("RESOURCE_LOCKED");
            assertThat(error.get("retryable").asBoolean()).isTrue();
        }
    }

    @Test
    @DisplayName("a run that outlives the run timeout answers 504 and is cancelled")
    void slowRunIsCancelled() throws IOException {
        CompletableFuture<AllocationPlan> neverDone = new CompletableFuture<>();
        when(pipeline.allocateAsync(any(AllocationRequest.class))).thenReturn(neverDone);
        CallbackServer impatient = new CallbackServer(0, pipeline, reviews, lockManager, Duration.ofMillis(100));
        impatient.start();
        try (Response response = client.newCall(new Request.Builder()
                .url("http://127.0.0.1:" + impatient.getPort() + "/allocations")
                .post(RequestBody.create(ALLOCATION_BODY, JSON))
                .build()).execute()) {
            assertThat(response.code()).isEqualTo(504);
            JsonNode error = mapper.readTree(response.body().string());
            assertThat(error.get("error").asText()).isEqualTo("RUN_TIMEOUT");
            assertThat(error.get("retryable").asBoolean()).isTrue();
        } finally {
            impatient.stop();
        }

        assertThat(neverDone.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("unexpected failures of a run answer 500")
    void unexpectedFailureIs500() throws IOException {
        when(pipeline.allocateAsync(any(AllocationRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        try (Response response = post("/allocations", ALLOCATION_BODY)) {
            assertThat(response.code()).isEqualTo(500);
            assertThat(mapper.readTree(response.body().string()).get("error").asText()).isEqualTo("INTERNAL_ERROR");
        }
    }

    @Test
    @DisplayName("malformed allocation bodies answer 400 without running the pipeline")
    void malformedBodyIs400() throws IOException {
        try (Response response = post("/allocations", "{\"event_id\": \"EVT-8\"}")) {
            assertThat(response.code()).isEqualTo(400);
        }
        try (Response response = post("/allocations", "not json")) {
            assertThat(response.code()).isEqualTo(400);
        }
    }

    @Test
    @DisplayName("a decision posted for a waiting run completes its review")
    void reviewDecisionReachesWaitingRun() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ReviewDecision> waiting = executor.submit(() -> reviews.awaitDecision("run-5",
                    TestCandidates.scored("greedy-1", "SR-01"), Duration.ofSeconds(10)));
            while (reviews.pendingReviews().isEmpty()) {
                Thread.sleep(10);
            }

            try (Response listing = client.newCall(new Request.Builder().url(baseUrl + "/reviews").build()).execute()) {
                JsonNode pending = mapper.readTree(listing.body().string());
                assertThat(pending).hasSize(1);
                assertThat(pending.get(0).get("run_id").asText()).isEqualTo("run-5");
            }

            try (Response response = post("/reviews/run-5",
                    "{\"decision\": \"modify\", \"resource_ids\": [\"SR-02\"], \"reviewer\": \"duty-officer\"}")) {
                assertThat(response.code()).isEqualTo(200);
            }

            ReviewDecision decision = waiting.get(5, TimeUnit.SECONDS);
            assertThat(decision.getType()).isEqualTo(ReviewDecision.Type.MODIFY);
            assertThat(decision.getReplacementResourceIds()).containsExactly("SR-02");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("decisions for runs that are not waiting answer 404")
    void unknownReviewIs404() throws IOException {
        try (Response response = post("/reviews/run-404", "{\"decision\": \"approve\"}")) {
            assertThat(response.code()).isEqualTo(404);
        }
    }

    @Test
    @DisplayName("active locks are listed")
    void listsLocks() throws IOException {
        lockManager.acquire("run-3", Collections.singleton("SR-01"), Duration.ofMinutes(5));

        try (Response response = client.newCall(new Request.Builder().url(baseUrl + "/locks").build()).execute()) {
            JsonNode locks = mapper.readTree(response.body().string());
            assertThat(locks).hasSize(1);
            assertThat(locks.get(0).get("resource_id").asText()).isEqualTo("SR-01");
            assertThat(locks.get(0).get("owner_id").asText()).isEqualTo("run-3");
        }
    }

    @Test
    @DisplayName("error categories map to HTTP statuses")
    void statusMapping() {
        assertThat(CallbackServer.statusFor(new LockConflictException(Collections.singleton("a"), Duration.ZERO)))
                .isEqualTo(409);
        assertThat(CallbackServer.statusFor(new CyclicDependencyException(Arrays.asList("A", "B", "A"))))
                .isEqualTo(422);
        assertThat(CallbackServer.statusFor(new ResourceCatalogException("down"))).isEqualTo(503);
        assertThat(CallbackServer.statusFor(new OptimizerNonConvergenceException("none"))).isEqualTo(500);
    }

    @Test
    @DisplayName("request documents convert to domain requests")
    void toRequestConversion() {
        AllocationRequestDto dto = new AllocationRequestDto();
        dto.setEventId("EVT-9");
        Map<String, Object> context = new HashMap<>();
        context.put("disaster_type", "flood");
        dto.setContext(context);
        dto.setCenter(new LocationDto(30.0, 104.0));
        dto.setRadiusKm(15.0);
        dto.setEstimatedAffected(40);

        AllocationRequest request = CallbackServer.toRequest(dto);

        assertThat(request.getSceneCodes()).isEmpty();
        assertThat(request.getMode()).isNull();
        assertThat(request.getMaxResults()).isNull();
        assertThat(request.getArea().getRadiusKm()).isEqualTo(15.0);

        dto.setCenter(null);
        assertThatThrownBy(() -> CallbackServer.toRequest(dto)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("decision documents convert to review decisions")
    void toDecisionConversion() {
        ReviewDecisionDto approve = new ReviewDecisionDto();
        approve.setDecision(" APPROVE ");
        approve.setReviewer("duty-officer");
        ReviewDecisionDto unknown = new ReviewDecisionDto();
        unknown.setDecision("escalate");
        ReviewDecisionDto emptyModify = new ReviewDecisionDto();
        emptyModify.setDecision("modify");

        assertThat(CallbackServer.toDecision(approve).getType()).isEqualTo(ReviewDecision.Type.APPROVE);
        assertThatThrownBy(() -> CallbackServer.toDecision(unknown)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CallbackServer.toDecision(emptyModify)).isInstanceOf(IllegalArgumentException.class);
    }

    private Response post(String path, String body) throws IOException {
        return client.newCall(new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(body, JSON))
                .build()).execute();
    }
}
