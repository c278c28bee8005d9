package org.rapidrelief.engine.domain.model;

import java.util.Locale;

/**
 * Severity attached to a {@link Violation}.
 */
public enum Severity {
    INFO,
    WARNING,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Severity fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return WARNING;
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
