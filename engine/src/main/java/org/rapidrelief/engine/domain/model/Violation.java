package org.rapidrelief.engine.domain.model;

import java.util.Objects;

/**
 * A constraint breach or warning attached to a decomposition, a solution or a plan.
 * Strict violations are hard failures; non-strict ones are warnings.
 */
public final class Violation {

    public static final String CAPACITY_WARNING = "INSUFFICIENT_CAPACITY";
    public static final String MISSING_STRICT_DEPENDENCY = "MISSING_STRICT_DEPENDENCY";
    public static final String MISSING_DEPENDENCY = "MISSING_DEPENDENCY";
    public static final String UNKNOWN_TASK_TYPE = "UNKNOWN_TASK_TYPE";
    public static final String UNKNOWN_SCENE = "UNKNOWN_SCENE";
    public static final String HARD_RULE_REJECTED = "HARD_RULE_REJECTED";
    public static final String HARD_RULE_WARNING = "HARD_RULE_WARNING";
    public static final String OPTIMIZER_TIMEOUT = "OPTIMIZER_TIMEOUT";
    public static final String GREEDY_RETRY = "GREEDY_RETRY";

    private final String code;
    private final String message;
    private final Severity severity;
    private final boolean strict;

    public Violation(String code, String message, Severity severity, boolean strict) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.strict = strict;
    }

    public static Violation strict(String code, String message) {
        return new Violation(code, message, Severity.CRITICAL, true);
    }

    public static Violation warning(String code, String message) {
        return new Violation(code, message, Severity.WARNING, false);
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Violation)) {
            return false;
        }
        Violation other = (Violation) o;
        return strict == other.strict
                && code.equals(other.code)
                && message.equals(other.message)
                && severity == other.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, severity, strict);
    }

    @Override
    public String toString() {
        return String.format("%s[%s%s]: %s", code, severity, strict ? ", strict" : "", message);
    }
}
