package org.rapidrelief.engine.domain.rule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.model.Severity;
import org.rapidrelief.engine.domain.model.Violation;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HardRuleTest {

    private static final HardRule RISK_CEILING = new HardRule.Builder()
            .id("HR-T-001")
            .check("risk", ComparisonOperator.GT)
            .threshold(0.10)
            .action(HardRuleAction.REJECT)
            .severity(Severity.CRITICAL)
            .message("Rescuer risk {value} exceeds {threshold}")
            .build();

    private static final HardRule GOLDEN_HOUR = new HardRule.Builder()
            .id("HR-T-002")
            .check("response_time", ComparisonOperator.GT)
            .thresholdField("golden_hour_deadline")
            .message("Arrival {value} misses {threshold}")
            .build();

    @Test
    @DisplayName("a firing reject rule yields a strict violation with a formatted message")
    void rejectRuleFires() {
        Optional<Violation> violation = RISK_CEILING.evaluate(metrics("risk", 0.15));

        assertThat(violation).isPresent();
        assertThat(violation.get().getCode()).isEqualTo(Violation.HARD_RULE_REJECTED);
        assertThat(violation.get().isStrict()).isTrue();
        assertThat(violation.get().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(violation.get().getMessage()).isEqualTo("[HR-T-001] Rescuer risk 0.150 exceeds 0.100");
    }

    @Test
    @DisplayName("values on the safe side of the threshold pass")
    void ruleHolds() {
        assertThat(RISK_CEILING.evaluate(metrics("risk", 0.10))).isEmpty();
    }

    @Test
    @DisplayName("a missing metric or missing threshold field lets the solution pass")
    void missingValuesPass() {
        assertThat(RISK_CEILING.evaluate(metrics("coverage_rate", 0.4))).isEmpty();
        assertThat(GOLDEN_HOUR.evaluate(metrics("response_time", 95.0))).isEmpty();
    }

    @Test
    @DisplayName("the threshold can come from another metric")
    void thresholdFromField() {
        Map<String, Object> values = new HashMap<>();
        values.put("response_time", 75.5);
        values.put("golden_hour_deadline", 60);

        Optional<Violation> violation = GOLDEN_HOUR.evaluate(EventContext.of(values));

        assertThat(violation).isPresent();
        assertThat(violation.get().getMessage()).isEqualTo("[HR-T-002] Arrival 75.500 misses 60");
        assertThat(violation.get().getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("a rule whose condition does not apply never fires")
    void applicabilityGate() {
        HardRule rule = new HardRule.Builder()
                .id("HR-T-003")
                .check("capacity_coverage_rate", ComparisonOperator.LT)
                .threshold(0.8)
                .applicability(new Comparison("estimated_affected", ComparisonOperator.GT, 0))
                .action(HardRuleAction.WARN)
                .severity(Severity.CRITICAL)
                .message("Capacity coverage {value} below {threshold}")
                .build();
        Map<String, Object> values = new HashMap<>();
        values.put("capacity_coverage_rate", 0.0);
        values.put("estimated_affected", 0);

        assertThat(rule.evaluate(EventContext.of(values))).isEmpty();

        values.put("estimated_affected", 300);
        Optional<Violation> warning = rule.evaluate(EventContext.of(values));
        assertThat(warning).isPresent();
        assertThat(warning.get().getCode()).isEqualTo(Violation.HARD_RULE_WARNING);
        assertThat(warning.get().isStrict()).isFalse();
    }

    @Test
    @DisplayName("exactly one of threshold and threshold field is required")
    void thresholdIsExclusive() {
        assertThatThrownBy(() -> new HardRule.Builder()
                .id("HR-T-004")
                .check("risk", ComparisonOperator.GT)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HardRule.Builder()
                .id("HR-T-005")
                .check("risk", ComparisonOperator.GT)
                .threshold(0.1)
                .thresholdField("risk_ceiling")
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static EventContext metrics(String key, Object value) {
        Map<String, Object> values = new HashMap<>();
        values.put(key, value);
        return EventContext.of(values);
    }
}
