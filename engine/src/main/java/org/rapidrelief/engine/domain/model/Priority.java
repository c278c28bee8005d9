package org.rapidrelief.engine.domain.model;

import java.util.Locale;

/**
 * Urgency of a requirement or capability, most urgent first.
 */
public enum Priority {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    Priority(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Returns the more urgent of this and {@code other}.
     */
    public Priority max(Priority other) {
        return other != null && other.ordinal() < ordinal() ? other : this;
    }

    public static Priority fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return MEDIUM;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Priority priority : values()) {
            if (priority.code.equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + code);
    }
}
