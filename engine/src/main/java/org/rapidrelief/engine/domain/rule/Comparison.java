package org.rapidrelief.engine.domain.rule;

import org.rapidrelief.engine.domain.model.EventContext;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Leaf condition comparing one context field against a literal value.
 */
public final class Comparison implements Condition {

    private final String field;
    private final ComparisonOperator operator;
    private final Object value;
    private final Pattern pattern;

    public Comparison(String field, ComparisonOperator operator, Object value) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = value;
        this.pattern = operator == ComparisonOperator.REGEX ? compile(value) : null;
    }

    private static Pattern compile(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("regex operator requires a pattern");
        }
        try {
            return Pattern.compile(String.valueOf(value));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex pattern: " + value, e);
        }
    }

    public String getField() {
        return field;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean evaluate(EventContext context) {
        return context.resolve(field)
                .map(actual -> operator.apply(actual, value, pattern))
                .orElse(false);
    }

    /**
     * Compares a field against a value supplied at evaluation time.
     */
    boolean evaluateAgainst(EventContext context, Object expected) {
        return context.resolve(field)
                .map(actual -> operator.apply(actual, expected, pattern))
                .orElse(false);
    }

    @Override
    public void collectMatches(EventContext context, List<String> matches) {
        if (evaluate(context)) {
            matches.add(describe());
        }
    }

    @Override
    public String describe() {
        return field + " " + operator.getSymbol() + " " + value;
    }

    @Override
    public String toString() {
        return describe();
    }
}
