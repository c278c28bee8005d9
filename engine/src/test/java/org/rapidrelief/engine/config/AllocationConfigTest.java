package org.rapidrelief.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rapidrelief.engine.domain.exception.ConfigurationException;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AllocationConfigTest {

    @Test
    @DisplayName("the bundled document matches the built-in defaults")
    void bundledDocumentMatchesDefaults() {
        AllocationConfig bundled = AllocationConfig.fromDocument(
                new ConfigurationLoader().load(EngineConfig.DEFAULT_ALLOCATION_CONFIG));

        assertThat(bundled.asMap()).isEqualTo(AllocationConfig.defaults().asMap());
        assertThat(bundled.getSuccessRateWeight()).isEqualTo(0.35);
        assertThat(bundled.getMultiObjectiveCandidateThreshold()).isEqualTo(10);
        assertThat(bundled.getOptimizerTimeoutSecondsLarge()).isEqualTo(60L);
    }

    @Test
    @DisplayName("overrides layer over the defaults")
    void overridesLayerOverDefaults() {
        Map<String, Double> overrides = new HashMap<>();
        overrides.put("WEIGHT_SUCCESS_RATE", 0.40);
        overrides.put(AllocationConfig.WEIGHT_RESPONSE_TIME, 0.25);
        overrides.put(AllocationConfig.MAX_SOLUTIONS, 3.0);

        AllocationConfig config = AllocationConfig.fromMap(overrides);

        assertThat(config.getSuccessRateWeight()).isEqualTo(0.40);
        assertThat(config.getResponseTimeWeight()).isEqualTo(0.25);
        assertThat(config.getMaxSolutions()).isEqualTo(3);
        assertThat(config.getCoverageThreshold()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("weights that do not sum to one are rejected")
    void weightsMustSumToOne() {
        Map<String, Double> overrides = new HashMap<>();
        overrides.put(AllocationConfig.WEIGHT_RISK, 0.30);

        assertThatThrownBy(() -> AllocationConfig.fromMap(overrides))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sum to 1.0");
    }

    @Test
    @DisplayName("fractions above one and negative values are rejected")
    void rangesAreValidated() {
        Map<String, Double> fraction = new HashMap<>();
        fraction.put(AllocationConfig.COVERAGE_THRESHOLD, 1.5);
        Map<String, Double> negative = new HashMap<>();
        negative.put(AllocationConfig.NSGA_GENERATIONS, -1.0);

        assertThatThrownBy(() -> AllocationConfig.fromMap(fraction)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> AllocationConfig.fromMap(negative)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("non-numeric document values are rejected")
    void nonNumericValuesRejected() {
        ObjectNode document = new ObjectMapper().createObjectNode();
        document.put(AllocationConfig.MAX_SOLUTIONS, "five");

        assertThatThrownBy(() -> AllocationConfig.fromDocument(document))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max_solutions");
    }

    @Test
    @DisplayName("capacity coefficients fall back to the default for unknown types")
    void capacityCoefficients() {
        AllocationConfig config = AllocationConfig.defaults();

        assertThat(config.getCapacityCoefficient("medical")).isEqualTo(5.0);
        assertThat(config.getCapacityCoefficient(" Search_Rescue ")).isCloseTo(1.5, within(1e-9));
        assertThat(config.getCapacityCoefficient("drone")).isEqualTo(1.0);
        assertThat(config.getCapacityCoefficient(null)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("unknown keys are reported")
    void unknownKeyLookup() {
        assertThatThrownBy(() -> AllocationConfig.defaults().get("weight_luck"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
