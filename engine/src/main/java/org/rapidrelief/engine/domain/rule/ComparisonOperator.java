package org.rapidrelief.engine.domain.rule;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Comparison operators available to rule leaves.
 * Every operator answers false when its operands cannot be compared.
 */
public enum ComparisonOperator {
    EQ("eq", "=="),
    NE("ne", "!="),
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    IN("in", "in"),
    NOT_IN("not_in", "not in"),
    CONTAINS("contains", "contains"),
    REGEX("regex", "matches");

    private final String code;
    private final String symbol;

    ComparisonOperator(String code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public String getCode() {
        return code;
    }

    public String getSymbol() {
        return symbol;
    }

    public static ComparisonOperator fromCode(String code) {
        Objects.requireNonNull(code, "operator must not be null");
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "==":
            case "=":
                return EQ;
            case "!=":
                return NE;
            case ">":
                return GT;
            case ">=":
                return GTE;
            case "<":
                return LT;
            case "<=":
                return LTE;
            default:
                for (ComparisonOperator operator : values()) {
                    if (operator.code.equals(normalized)) {
                        return operator;
                    }
                }
                throw new IllegalArgumentException("Unknown operator: " + code);
        }
    }

    /**
     * Applies the operator to an actual value and the rule's expected value.
     *
     * @param pattern precompiled pattern for {@link #REGEX}, ignored otherwise
     */
    boolean apply(Object actual, Object expected, Pattern pattern) {
        if (actual == null) {
            return false;
        }
        switch (this) {
            case EQ:
                return valuesEqual(actual, expected);
            case NE:
                return !valuesEqual(actual, expected);
            case GT:
            case GTE:
            case LT:
            case LTE:
                return compareOrdered(actual, expected);
            case IN:
                return expected instanceof Collection && containsValue((Collection<?>) expected, actual);
            case NOT_IN:
                return expected instanceof Collection && !containsValue((Collection<?>) expected, actual);
            case CONTAINS:
                if (actual instanceof Collection) {
                    return containsValue((Collection<?>) actual, expected);
                }
                return actual instanceof String && expected != null
                        && ((String) actual).contains(String.valueOf(expected));
            case REGEX:
                return pattern != null && actual instanceof CharSequence && pattern.matcher((CharSequence) actual).find();
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    private boolean compareOrdered(Object actual, Object expected) {
        Double left = toNumber(actual);
        Double right = toNumber(expected);
        if (left == null || right == null || left.isNaN() || right.isNaN()) {
            return false;
        }
        int result = Double.compare(left, right);
        switch (this) {
            case GT:
                return result > 0;
            case GTE:
                return result >= 0;
            case LT:
                return result < 0;
            default:
                return result <= 0;
        }
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number || expected instanceof Number) {
            Double left = toNumber(actual);
            Double right = toNumber(expected);
            return left != null && left.equals(right);
        }
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
        }
        return Objects.equals(actual, expected);
    }

    private static boolean containsValue(Collection<?> values, Object candidate) {
        for (Object value : values) {
            if (value != null && valuesEqual(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
