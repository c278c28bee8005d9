package org.rapidrelief.engine;

import org.rapidrelief.engine.api.ApiNotificationSink;
import org.rapidrelief.engine.api.ApiResourceCatalog;
import org.rapidrelief.engine.api.NotificationSink;
import org.rapidrelief.engine.api.ResourceCatalog;
import org.rapidrelief.engine.audit.AuditSink;
import org.rapidrelief.engine.audit.JsonLinesAuditSink;
import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.config.ConfigurationLoader;
import org.rapidrelief.engine.config.EngineConfig;
import org.rapidrelief.engine.domain.service.AllocationOptimizer;
import org.rapidrelief.engine.domain.service.AllocationOptimizerImpl;
import org.rapidrelief.engine.domain.service.AllocationPipeline;
import org.rapidrelief.engine.domain.service.AllocationPipelineImpl;
import org.rapidrelief.engine.domain.service.ConstraintFilter;
import org.rapidrelief.engine.domain.service.ConstraintFilterImpl;
import org.rapidrelief.engine.domain.service.RuleEngine;
import org.rapidrelief.engine.domain.service.RuleEngineImpl;
import org.rapidrelief.engine.domain.service.ScoringService;
import org.rapidrelief.engine.domain.service.ScoringServiceImpl;
import org.rapidrelief.engine.domain.service.TaskDecomposer;
import org.rapidrelief.engine.domain.service.TaskDecomposerImpl;
import org.rapidrelief.engine.http.CallbackServer;
import org.rapidrelief.engine.library.HardRuleLibrary;
import org.rapidrelief.engine.library.HardRuleLibraryLoader;
import org.rapidrelief.engine.library.RuleLibrary;
import org.rapidrelief.engine.library.RuleLibraryLoader;
import org.rapidrelief.engine.library.TaskTemplateLibrary;
import org.rapidrelief.engine.library.TaskTemplateLibraryLoader;
import org.rapidrelief.engine.lock.InMemoryResourceLockManager;
import org.rapidrelief.engine.lock.ResourceLockManager;
import org.rapidrelief.engine.review.PendingReviewRegistry;
import org.rapidrelief.engine.scheduler.LockReaperScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the Rapid Relief allocation engine.
 *
 * Rule, hard-rule, task-template and allocation documents are loaded once at startup;
 * any load failure stops the process. Allocation runs arrive over HTTP and execute
 * concurrently on the pipeline executor.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Rapid Relief Allocation Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        // Configure logging
        configureLogging(config);

        // Load rule, template and allocation documents
        ConfigurationLoader loader = new ConfigurationLoader();
        RuleLibrary rules = new RuleLibraryLoader(loader).load(config.getTriggerRulesLocation());
        HardRuleLibrary hardRules = new HardRuleLibraryLoader(loader).load(config.getHardRulesLocation());
        TaskTemplateLibrary templates = new TaskTemplateLibraryLoader(loader).load(config.getTaskTemplatesLocation());
        AllocationConfig allocationConfig = AllocationConfig.fromDocument(
                loader.load(config.getAllocationConfigLocation()));
        LOG.info(() -> String.format("Loaded %d trigger rules (version %s), %d hard rules, %d scene templates",
                rules.getRules().size(), rules.getVersion(), hardRules.size(), templates.getScenes().size()));
        LOG.info(() -> "Allocation configuration: " + allocationConfig);

        // External collaborators
        Clock clock = Clock.systemUTC();
        ResourceCatalog catalog = new ApiResourceCatalog(config.getApiBaseUrl());
        NotificationSink notificationSink = new ApiNotificationSink(config.getApiBaseUrl());
        AuditSink auditSink = new JsonLinesAuditSink(Paths.get(config.getAuditLogFilePath()));
        LOG.info(() -> "API client configured for: " + config.getApiBaseUrl());

        // Create services
        ScoringService scoringService = new ScoringServiceImpl();
        RuleEngine ruleEngine = new RuleEngineImpl(rules);
        TaskDecomposer taskDecomposer = new TaskDecomposerImpl(templates);
        AllocationOptimizer optimizer = new AllocationOptimizerImpl(scoringService, allocationConfig, clock);
        ConstraintFilter constraintFilter = new ConstraintFilterImpl(hardRules, allocationConfig);
        ResourceLockManager lockManager = new InMemoryResourceLockManager(clock);
        PendingReviewRegistry reviews = new PendingReviewRegistry(clock);
        ExecutorService pipelineExecutor = newPipelineExecutor(config.getPipelineThreads());

        AllocationPipeline pipeline = new AllocationPipelineImpl.Builder()
                .ruleEngine(ruleEngine)
                .taskDecomposer(taskDecomposer)
                .catalog(catalog)
                .scoringService(scoringService)
                .optimizer(optimizer)
                .constraintFilter(constraintFilter)
                .lockManager(lockManager)
                .reviewGate(reviews)
                .notificationSink(notificationSink)
                .auditSink(auditSink)
                .allocationConfig(allocationConfig)
                .executor(pipelineExecutor)
                .clock(clock)
                .defaultMaxResults(config.getCatalogMaxResults())
                .lockTtl(Duration.ofSeconds(config.getLockTtlSeconds()))
                .reviewTimeout(Duration.ofSeconds(config.getReviewTimeoutSeconds()))
                .build();

        // Start callback server
        CallbackServer callbackServer = new CallbackServer(config.getCallbackPort(), pipeline, reviews, lockManager,
                Duration.ofSeconds(config.getRunTimeoutSeconds()));
        callbackServer.start();
        LOG.info(() -> "Callback server started on port " + config.getCallbackPort());

        // Start lock reaper
        LockReaperScheduler reaper = new LockReaperScheduler(lockManager, config.getLockReaperIntervalSeconds());
        reaper.start();

        // Register shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            callbackServer.stop();
            reaper.stop();
            pipelineExecutor.shutdown();
            try {
                if (!pipelineExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    pipelineExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                pipelineExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== Allocation Engine started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Health: http://localhost:" + config.getCallbackPort() + "/health");
        LOG.info(() -> "  - Allocate: POST http://localhost:" + config.getCallbackPort() + "/allocations");
        LOG.info(() -> "  - Reviews: GET|POST http://localhost:" + config.getCallbackPort() + "/reviews/{runId}");
        LOG.info(() -> "  - Locks: GET http://localhost:" + config.getCallbackPort() + "/locks");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    private static ExecutorService newPipelineExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "allocation-pipeline-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        String logFilePath = config.getLogFilePath();
        Path target = Paths.get(logFilePath).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
