package org.rapidrelief.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.rapidrelief.engine.api.dto.AllocationRequestDto;
import org.rapidrelief.engine.api.dto.ReviewDecisionDto;
import org.rapidrelief.engine.domain.exception.AllocationCancelledException;
import org.rapidrelief.engine.domain.exception.AllocationException;
import org.rapidrelief.engine.domain.exception.ConfigurationException;
import org.rapidrelief.engine.domain.exception.CyclicDependencyException;
import org.rapidrelief.engine.domain.exception.InvalidParallelGroupException;
import org.rapidrelief.engine.domain.exception.LockConflictException;
import org.rapidrelief.engine.domain.exception.ResourceCatalogException;
import org.rapidrelief.engine.domain.exception.ResourceUnavailableException;
import org.rapidrelief.engine.domain.exception.RuleLoadException;
import org.rapidrelief.engine.domain.model.AllocationPlan;
import org.rapidrelief.engine.domain.model.AllocationRequest;
import org.rapidrelief.engine.domain.model.Area;
import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.model.GeoPoint;
import org.rapidrelief.engine.domain.model.OptimizationMode;
import org.rapidrelief.engine.domain.model.ReviewDecision;
import org.rapidrelief.engine.domain.service.AllocationPipeline;
import org.rapidrelief.engine.lock.ResourceLockManager;
import org.rapidrelief.engine.review.PendingReviewRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP entry point of the engine.
 * <pre>
 *   GET  /health           liveness
 *   POST /allocations      run the pipeline, answer with the plan (504 and cancelled after the run timeout)
 *   GET  /reviews          runs waiting for human review
 *   POST /reviews/{runId}  deliver a review decision
 *   GET  /locks            active resource locks
 * </pre>
 * Runs execute on the pipeline's executor; the request thread waits for the result, so the
 * server uses an unbounded pool and review decisions can always get through.
 */
public final class CallbackServer {

    private static final Logger LOG = Logger.getLogger(CallbackServer.class.getName());

    private static final String REVIEWS_PREFIX = "/reviews/";

    private final HttpServer server;
    private final ExecutorService executor;
    private final AllocationPipeline pipeline;
    private final PendingReviewRegistry reviews;
    private final ResourceLockManager lockManager;
    private final Duration runTimeout;
    private final ObjectMapper mapper;

    public CallbackServer(int port, AllocationPipeline pipeline, PendingReviewRegistry reviews,
                          ResourceLockManager lockManager, Duration runTimeout) throws IOException {
        this.runTimeout = Objects.requireNonNull(runTimeout, "runTimeout must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.reviews = Objects.requireNonNull(reviews, "reviews must not be null");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager must not be null");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "callback-server");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "Callback server initialized on port " + port);
    }

    private void registerHandlers() {
        server.createContext("/health", this::handleHealth);
        server.createContext("/allocations", this::handleAllocation);
        server.createContext("/reviews", this::handleReviews);
        server.createContext("/locks", this::handleLocks);
    }

    /**
     * Start the callback server.
     */
    public void start() {
        server.start();
        LOG.info("Callback server started");
    }

    /**
     * Stop the callback server.
     */
    public void stop() {
        server.stop(1);
        executor.shutdownNow();
        LOG.info("Callback server stopped");
    }

    /**
     * Port the server is bound to, useful when it was created with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Health check endpoint.
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }
        sendResponse(exchange, 200, "{\"status\":\"healthy\"}");
    }

    /**
     * Run an allocation.
     * POST /allocations
     */
    private void handleAllocation(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }

        AllocationRequest request;
        try {
            request = toRequest(readBody(exchange, AllocationRequestDto.class));
        } catch (JsonProcessingException | IllegalArgumentException | NullPointerException e) {
            LOG.log(Level.FINE, "Rejected malformed allocation request", e);
            sendError(exchange, 400, "BAD_REQUEST", e.getMessage(), false);
            return;
        }

        LOG.info(() -> "Received allocation request for event: " + request.getEventId());
        Future<AllocationPlan> run = pipeline.allocateAsync(request);
        try {
            AllocationPlan plan = run.get(runTimeout.toMillis(), TimeUnit.MILLISECONDS);
            sendJson(exchange, 200, plan);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AllocationException) {
                sendAllocationError(exchange, (AllocationException) cause);
            } else {
                LOG.log(Level.SEVERE, "Allocation failed for " + request.getEventId(), cause);
                sendError(exchange, 500, "INTERNAL_ERROR", "allocation failed", false);
            }
        } catch (TimeoutException e) {
            run.cancel(true);
            LOG.warning(() -> String.format("Allocation for event %s exceeded %d s and was cancelled",
                    request.getEventId(), runTimeout.getSeconds()));
            sendError(exchange, 504, "RUN_TIMEOUT", "allocation did not finish within " + runTimeout, true);
        } catch (InterruptedException e) {
            run.cancel(true);
            Thread.currentThread().interrupt();
            sendError(exchange, 503, "RUN_CANCELLED", "server is shutting down", true);
        }
    }

    private void sendAllocationError(HttpExchange exchange, AllocationException e) throws IOException {
        if (e instanceof LockConflictException) {
            long seconds = Math.max(1L, ((LockConflictException) e).getRetryAfter().getSeconds());
            exchange.getResponseHeaders().set("Retry-After", Long.toString(seconds));
        } else if (e instanceof ResourceUnavailableException) {
            exchange.getResponseHeaders().set("Retry-After", "1");
        }
        sendError(exchange, statusFor(e), e.getErrorCode(), e.getMessage(), e.isRetryable());
    }

    /**
     * Pending reviews and review decisions.
     * GET /reviews, POST /reviews/{runId}
     */
    private void handleReviews(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();

        if ("GET".equals(method) && ("/reviews".equals(path) || "/reviews/".equals(path))) {
            sendJson(exchange, 200, reviews.pendingReviews());
            return;
        }
        if (!"POST".equals(method)) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }

        String runId = extractRunId(path);
        if (runId == null) {
            sendError(exchange, 400, "BAD_REQUEST", "missing run ID", false);
            return;
        }

        ReviewDecision decision;
        try {
            decision = toDecision(readBody(exchange, ReviewDecisionDto.class));
        } catch (JsonProcessingException | IllegalArgumentException | NullPointerException e) {
            sendError(exchange, 400, "BAD_REQUEST", e.getMessage(), false);
            return;
        }

        LOG.info(() -> "Received review decision for run " + runId + ": " + decision);
        if (reviews.submit(runId, decision)) {
            sendResponse(exchange, 200, "{\"status\":\"accepted\"}");
        } else {
            sendError(exchange, 404, "NOT_FOUND", "no pending review for run " + runId, false);
        }
    }

    /**
     * Active resource locks.
     * GET /locks
     */
    private void handleLocks(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }
        sendJson(exchange, 200, lockManager.activeLocks());
    }

    static int statusFor(AllocationException e) {
        if (e instanceof LockConflictException || e instanceof ResourceUnavailableException) {
            return 409;
        }
        if (e instanceof ConfigurationException || e instanceof RuleLoadException
                || e instanceof CyclicDependencyException || e instanceof InvalidParallelGroupException) {
            return 422;
        }
        if (e instanceof ResourceCatalogException || e instanceof AllocationCancelledException) {
            return 503;
        }
        return 500;
    }

    static AllocationRequest toRequest(AllocationRequestDto dto) {
        if (dto.getCenter() == null) {
            throw new IllegalArgumentException("center is required");
        }
        OptimizationMode mode = dto.getMode() == null || dto.getMode().isBlank()
                ? null
                : OptimizationMode.valueOf(dto.getMode().trim().toUpperCase(Locale.ROOT));
        return new AllocationRequest.Builder()
                .eventId(dto.getEventId())
                .context(EventContext.of(dto.getContext() != null ? dto.getContext() : Collections.emptyMap()))
                .sceneCodes(dto.getSceneCodes() != null ? dto.getSceneCodes() : Collections.emptyList())
                .area(new Area(new GeoPoint(dto.getCenter().getLatitude(), dto.getCenter().getLongitude()),
                        dto.getRadiusKm()))
                .estimatedAffected(dto.getEstimatedAffected())
                .maxResults(dto.getMaxResults())
                .mode(mode)
                .allowGreedyRetry(dto.isAllowGreedyRetry())
                .build();
    }

    static ReviewDecision toDecision(ReviewDecisionDto dto) {
        String decision = Objects.requireNonNull(dto.getDecision(), "decision is required");
        switch (decision.trim().toLowerCase(Locale.ROOT)) {
            case "approve":
                return ReviewDecision.approve(dto.getReviewer(), dto.getComment());
            case "reject":
                return ReviewDecision.reject(dto.getReviewer(), dto.getComment());
            case "modify":
                return ReviewDecision.modify(dto.getResourceIds() != null ? dto.getResourceIds()
                        : Collections.emptyList(), dto.getReviewer(), dto.getComment());
            default:
                throw new IllegalArgumentException("Unknown decision: " + decision);
        }
    }

    /**
     * Extract run ID from path like /reviews/{runId}
     */
    private String extractRunId(String path) {
        if (path == null || !path.startsWith(REVIEWS_PREFIX)) {
            return null;
        }
        String id = path.substring(REVIEWS_PREFIX.length());
        if (id.endsWith("/")) {
            id = id.substring(0, id.length() - 1);
        }
        return id.isEmpty() ? null : id;
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream body = exchange.getRequestBody()) {
            return mapper.readValue(body, type);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object value) throws IOException {
        sendResponse(exchange, statusCode, mapper.writeValueAsString(value));
    }

    private void sendError(HttpExchange exchange, int statusCode, String code, String message, boolean retryable)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        body.put("retryable", retryable);
        sendJson(exchange, statusCode, body);
    }

    /**
     * Send HTTP response.
     */
    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
