package org.rapidrelief.engine.domain.rule;

import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.model.Severity;
import org.rapidrelief.engine.domain.model.Violation;

import java.util.Objects;
import java.util.Optional;

/**
 * Boolean safety predicate over a solution's metrics. The check describes the
 * violating condition: when it holds, the rule fires. The message may reference
 * {@code {value}} and {@code {threshold}}.
 */
public final class HardRule {

    private final String id;
    private final String name;
    private final Comparison check;
    private final Double threshold;
    private final String thresholdField;
    private final Condition applicability;
    private final HardRuleAction action;
    private final Severity severity;
    private final String message;

    private HardRule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.check = Objects.requireNonNull(builder.check, "check must not be null");
        if ((builder.threshold == null) == (builder.thresholdField == null)) {
            throw new IllegalArgumentException("Hard rule " + builder.id
                    + " needs exactly one of threshold and threshold_field");
        }
        this.threshold = builder.threshold;
        this.thresholdField = builder.thresholdField;
        this.applicability = builder.applicability;
        this.action = Objects.requireNonNull(builder.action, "action must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.message = builder.message != null ? builder.message : this.name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public HardRuleAction getAction() {
        return action;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * Evaluates the rule against a metric map. A missing metric, or a missing
     * threshold field, lets the solution pass.
     *
     * @return the violation when the rule fires
     */
    public Optional<Violation> evaluate(EventContext metrics) {
        if (applicability != null && !applicability.evaluate(metrics)) {
            return Optional.empty();
        }
        Optional<Object> actual = metrics.resolve(check.getField());
        if (!actual.isPresent()) {
            return Optional.empty();
        }
        Object expected = threshold;
        if (thresholdField != null) {
            Optional<Object> resolved = metrics.resolve(thresholdField);
            if (!resolved.isPresent()) {
                return Optional.empty();
            }
            expected = resolved.get();
        }
        if (!check.evaluateAgainst(metrics, expected)) {
            return Optional.empty();
        }
        String code = action == HardRuleAction.REJECT ? Violation.HARD_RULE_REJECTED : Violation.HARD_RULE_WARNING;
        String text = "[" + id + "] " + message
                .replace("{value}", format(actual.get()))
                .replace("{threshold}", format(expected));
        return Optional.of(new Violation(code, text, severity, action == HardRuleAction.REJECT));
    }

    private static String format(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return String.format("%.3f", ((Number) value).doubleValue());
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return "HardRule{" + id + ", " + check.getField() + " " + check.getOperator().getSymbol() + " "
                + (thresholdField != null ? thresholdField : threshold) + " -> " + action + '}';
    }

    /**
     * Builder for HardRule.
     */
    public static final class Builder {
        private String id;
        private String name;
        private Comparison check;
        private Double threshold;
        private String thresholdField;
        private Condition applicability;
        private HardRuleAction action = HardRuleAction.REJECT;
        private Severity severity = Severity.HIGH;
        private String message;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Field and operator of the violating condition.
         */
        public Builder check(String field, ComparisonOperator operator) {
            this.check = new Comparison(field, operator, null);
            return this;
        }

        public Builder threshold(Double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder thresholdField(String thresholdField) {
            this.thresholdField = thresholdField;
            return this;
        }

        /**
         * Optional guard; the rule is only evaluated when it holds.
         */
        public Builder applicability(Condition applicability) {
            this.applicability = applicability;
            return this;
        }

        public Builder action(HardRuleAction action) {
            this.action = action;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public HardRule build() {
            return new HardRule(this);
        }
    }
}
