package org.rapidrelief.engine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    @DisplayName("unset variables fall back to the defaults")
    void defaultsWhenUnset() {
        EngineConfig config = EngineConfig.fromVariables(key -> null);

        assertThat(config.getApiBaseUrl()).isEqualTo(EngineConfig.DEFAULT_API_URL);
        assertThat(config.getCatalogMaxResults()).isEqualTo(500);
        assertThat(config.getCallbackPort()).isEqualTo(8082);
        assertThat(config.getLockTtlSeconds()).isEqualTo(300);
        assertThat(config.getReviewTimeoutSeconds()).isEqualTo(900);
        assertThat(config.getRunTimeoutSeconds()).isEqualTo(1200);
        assertThat(config.getTriggerRulesLocation()).isEqualTo("classpath:config/trigger-rules.yaml");
        assertThat(config.isFileLoggingEnabled()).isTrue();
    }

    @Test
    @DisplayName("variables override defaults and are trimmed")
    void variablesOverrideDefaults() {
        Map<String, String> env = new HashMap<>();
        env.put("API_BASE_URL", " http://catalog:9000 ");
        env.put("CATALOG_MAX_RESULTS", "50");
        env.put("HARD_RULES_FILE", "/etc/engine/hard-rules.yaml");
        env.put("ENGINE_FILE_LOGGING_ENABLED", "false");
        env.put("PIPELINE_THREADS", "8");
        env.put("RUN_TIMEOUT_SECONDS", "90");

        EngineConfig config = EngineConfig.fromVariables(env::get);

        assertThat(config.getApiBaseUrl()).isEqualTo("http://catalog:9000");
        assertThat(config.getCatalogMaxResults()).isEqualTo(50);
        assertThat(config.getHardRulesLocation()).isEqualTo("/etc/engine/hard-rules.yaml");
        assertThat(config.isFileLoggingEnabled()).isFalse();
        assertThat(config.getPipelineThreads()).isEqualTo(8);
        assertThat(config.getRunTimeoutSeconds()).isEqualTo(90);
    }

    @Test
    @DisplayName("unparseable integers fall back to the default")
    void invalidIntegerUsesDefault() {
        Map<String, String> env = new HashMap<>();
        env.put("LOCK_TTL_SECONDS", "five minutes");

        assertThat(EngineConfig.fromVariables(env::get).getLockTtlSeconds())
                .isEqualTo(EngineConfig.DEFAULT_LOCK_TTL_SECONDS);
    }

    @Test
    @DisplayName("out of range values are rejected")
    void outOfRangeValuesRejected() {
        Map<String, String> env = new HashMap<>();
        env.put("ENGINE_CALLBACK_PORT", "70000");

        assertThatThrownBy(() -> EngineConfig.fromVariables(env::get))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("callbackPort");
    }
}
