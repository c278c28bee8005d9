package org.rapidrelief.engine.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Immutable process configuration of the allocation engine.
 * Values come from environment variables, falling back to a {@code .env} file, then to defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_API_URL = "http://localhost:8081";
    public static final int DEFAULT_CALLBACK_PORT = 8082;
    public static final int DEFAULT_CATALOG_MAX_RESULTS = 500;
    public static final int DEFAULT_LOCK_TTL_SECONDS = 300;
    public static final int DEFAULT_LOCK_REAPER_INTERVAL_SECONDS = 30;
    public static final int DEFAULT_REVIEW_TIMEOUT_SECONDS = 900;
    public static final int DEFAULT_PIPELINE_THREADS = 4;
    public static final int DEFAULT_RUN_TIMEOUT_SECONDS = 1200;
    public static final String DEFAULT_TRIGGER_RULES = "classpath:config/trigger-rules.yaml";
    public static final String DEFAULT_HARD_RULES = "classpath:config/hard-rules.yaml";
    public static final String DEFAULT_TASK_TEMPLATES = "classpath:config/task-templates.yaml";
    public static final String DEFAULT_ALLOCATION_CONFIG = "classpath:config/allocation-config.yaml";
    public static final String DEFAULT_AUDIT_LOG_FILE = "/app/logs/engine/audit.jsonl";
    public static final String DEFAULT_LOG_FILE = "/app/logs/engine/engine.log";

    // API Configuration
    private final String apiBaseUrl;
    private final int catalogMaxResults;

    // Callback Server Configuration
    private final int callbackPort;

    // Locking and review
    private final int lockTtlSeconds;
    private final int lockReaperIntervalSeconds;
    private final int reviewTimeoutSeconds;
    private final int pipelineThreads;
    private final int runTimeoutSeconds;

    // Configuration documents
    private final String triggerRulesLocation;
    private final String hardRulesLocation;
    private final String taskTemplatesLocation;
    private final String allocationConfigLocation;

    // Logging Configuration
    private final String auditLogFilePath;
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.apiBaseUrl = builder.apiBaseUrl;
        this.catalogMaxResults = builder.catalogMaxResults;
        this.callbackPort = builder.callbackPort;
        this.lockTtlSeconds = builder.lockTtlSeconds;
        this.lockReaperIntervalSeconds = builder.lockReaperIntervalSeconds;
        this.reviewTimeoutSeconds = builder.reviewTimeoutSeconds;
        this.pipelineThreads = builder.pipelineThreads;
        this.runTimeoutSeconds = builder.runTimeoutSeconds;
        this.triggerRulesLocation = builder.triggerRulesLocation;
        this.hardRulesLocation = builder.hardRulesLocation;
        this.taskTemplatesLocation = builder.taskTemplatesLocation;
        this.allocationConfigLocation = builder.allocationConfigLocation;
        this.auditLogFilePath = builder.auditLogFilePath;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables, with {@code .env} fallback.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return fromVariables(key -> {
            String value = System.getenv(key);
            return value != null && !value.trim().isEmpty() ? value : dotenv.get(key);
        });
    }

    /**
     * Creates configuration from an arbitrary variable lookup.
     */
    public static EngineConfig fromVariables(UnaryOperator<String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return new Builder()
                .apiBaseUrl(getString(lookup, "API_BASE_URL", DEFAULT_API_URL))
                .catalogMaxResults(getInt(lookup, "CATALOG_MAX_RESULTS", DEFAULT_CATALOG_MAX_RESULTS))
                .callbackPort(getInt(lookup, "ENGINE_CALLBACK_PORT", DEFAULT_CALLBACK_PORT))
                .lockTtlSeconds(getInt(lookup, "LOCK_TTL_SECONDS", DEFAULT_LOCK_TTL_SECONDS))
                .lockReaperIntervalSeconds(getInt(lookup, "LOCK_REAPER_INTERVAL_SECONDS",
                        DEFAULT_LOCK_REAPER_INTERVAL_SECONDS))
                .reviewTimeoutSeconds(getInt(lookup, "REVIEW_TIMEOUT_SECONDS", DEFAULT_REVIEW_TIMEOUT_SECONDS))
                .pipelineThreads(getInt(lookup, "PIPELINE_THREADS", DEFAULT_PIPELINE_THREADS))
                .runTimeoutSeconds(getInt(lookup, "RUN_TIMEOUT_SECONDS", DEFAULT_RUN_TIMEOUT_SECONDS))
                .triggerRulesLocation(getString(lookup, "TRIGGER_RULES_FILE", DEFAULT_TRIGGER_RULES))
                .hardRulesLocation(getString(lookup, "HARD_RULES_FILE", DEFAULT_HARD_RULES))
                .taskTemplatesLocation(getString(lookup, "TASK_TEMPLATES_FILE", DEFAULT_TASK_TEMPLATES))
                .allocationConfigLocation(getString(lookup, "ALLOCATION_CONFIG_FILE", DEFAULT_ALLOCATION_CONFIG))
                .auditLogFilePath(getString(lookup, "AUDIT_LOG_FILE", DEFAULT_AUDIT_LOG_FILE))
                .logFilePath(getString(lookup, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, "ENGINE_FILE_LOGGING_ENABLED", true))
                .build();
    }

    // Getters
    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public int getCatalogMaxResults() {
        return catalogMaxResults;
    }

    public int getCallbackPort() {
        return callbackPort;
    }

    public int getLockTtlSeconds() {
        return lockTtlSeconds;
    }

    public int getLockReaperIntervalSeconds() {
        return lockReaperIntervalSeconds;
    }

    public int getReviewTimeoutSeconds() {
        return reviewTimeoutSeconds;
    }

    public int getPipelineThreads() {
        return pipelineThreads;
    }

    /**
     * Longest time an HTTP caller waits for a run before it is cancelled.
     */
    public int getRunTimeoutSeconds() {
        return runTimeoutSeconds;
    }

    public String getTriggerRulesLocation() {
        return triggerRulesLocation;
    }

    public String getHardRulesLocation() {
        return hardRulesLocation;
    }

    public String getTaskTemplatesLocation() {
        return taskTemplatesLocation;
    }

    public String getAllocationConfigLocation() {
        return allocationConfigLocation;
    }

    public String getAuditLogFilePath() {
        return auditLogFilePath;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Variable helpers
    private static String getString(UnaryOperator<String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(UnaryOperator<String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(UnaryOperator<String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "apiBaseUrl='" + apiBaseUrl + '\'' +
                ", catalogMaxResults=" + catalogMaxResults +
                ", callbackPort=" + callbackPort +
                ", lockTtlSeconds=" + lockTtlSeconds +
                ", reviewTimeoutSeconds=" + reviewTimeoutSeconds +
                ", pipelineThreads=" + pipelineThreads +
                ", runTimeoutSeconds=" + runTimeoutSeconds +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String apiBaseUrl = DEFAULT_API_URL;
        private int catalogMaxResults = DEFAULT_CATALOG_MAX_RESULTS;
        private int callbackPort = DEFAULT_CALLBACK_PORT;
        private int lockTtlSeconds = DEFAULT_LOCK_TTL_SECONDS;
        private int lockReaperIntervalSeconds = DEFAULT_LOCK_REAPER_INTERVAL_SECONDS;
        private int reviewTimeoutSeconds = DEFAULT_REVIEW_TIMEOUT_SECONDS;
        private int pipelineThreads = DEFAULT_PIPELINE_THREADS;
        private int runTimeoutSeconds = DEFAULT_RUN_TIMEOUT_SECONDS;
        private String triggerRulesLocation = DEFAULT_TRIGGER_RULES;
        private String hardRulesLocation = DEFAULT_HARD_RULES;
        private String taskTemplatesLocation = DEFAULT_TASK_TEMPLATES;
        private String allocationConfigLocation = DEFAULT_ALLOCATION_CONFIG;
        private String auditLogFilePath = DEFAULT_AUDIT_LOG_FILE;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = true;

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl must not be null");
            return this;
        }

        public Builder catalogMaxResults(int catalogMaxResults) {
            if (catalogMaxResults < 1) {
                throw new IllegalArgumentException("catalogMaxResults must be at least 1");
            }
            this.catalogMaxResults = catalogMaxResults;
            return this;
        }

        public Builder callbackPort(int callbackPort) {
            if (callbackPort <= 0 || callbackPort > 65535) {
                throw new IllegalArgumentException("callbackPort must be between 1 and 65535");
            }
            this.callbackPort = callbackPort;
            return this;
        }

        public Builder lockTtlSeconds(int lockTtlSeconds) {
            if (lockTtlSeconds < 1) {
                throw new IllegalArgumentException("lockTtlSeconds must be at least 1");
            }
            this.lockTtlSeconds = lockTtlSeconds;
            return this;
        }

        public Builder lockReaperIntervalSeconds(int lockReaperIntervalSeconds) {
            if (lockReaperIntervalSeconds < 1) {
                throw new IllegalArgumentException("lockReaperIntervalSeconds must be at least 1");
            }
            this.lockReaperIntervalSeconds = lockReaperIntervalSeconds;
            return this;
        }

        public Builder reviewTimeoutSeconds(int reviewTimeoutSeconds) {
            if (reviewTimeoutSeconds < 1) {
                throw new IllegalArgumentException("reviewTimeoutSeconds must be at least 1");
            }
            this.reviewTimeoutSeconds = reviewTimeoutSeconds;
            return this;
        }

        public Builder pipelineThreads(int pipelineThreads) {
            if (pipelineThreads < 1) {
                throw new IllegalArgumentException("pipelineThreads must be at least 1");
            }
            this.pipelineThreads = pipelineThreads;
            return this;
        }

        public Builder runTimeoutSeconds(int runTimeoutSeconds) {
            if (runTimeoutSeconds < 1) {
                throw new IllegalArgumentException("runTimeoutSeconds must be at least 1");
            }
            this.runTimeoutSeconds = runTimeoutSeconds;
            return this;
        }

        public Builder triggerRulesLocation(String triggerRulesLocation) {
            this.triggerRulesLocation = Objects.requireNonNull(triggerRulesLocation,
                    "triggerRulesLocation must not be null");
            return this;
        }

        public Builder hardRulesLocation(String hardRulesLocation) {
            this.hardRulesLocation = Objects.requireNonNull(hardRulesLocation, "hardRulesLocation must not be null");
            return this;
        }

        public Builder taskTemplatesLocation(String taskTemplatesLocation) {
            this.taskTemplatesLocation = Objects.requireNonNull(taskTemplatesLocation,
                    "taskTemplatesLocation must not be null");
            return this;
        }

        public Builder allocationConfigLocation(String allocationConfigLocation) {
            this.allocationConfigLocation = Objects.requireNonNull(allocationConfigLocation,
                    "allocationConfigLocation must not be null");
            return this;
        }

        public Builder auditLogFilePath(String auditLogFilePath) {
            this.auditLogFilePath = Objects.requireNonNull(auditLogFilePath, "auditLogFilePath must not be null");
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
