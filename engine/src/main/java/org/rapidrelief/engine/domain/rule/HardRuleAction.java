package org.rapidrelief.engine.domain.rule;

import java.util.Locale;

/**
 * What a failing hard rule does to a solution.
 */
public enum HardRuleAction {
    /** Remove the solution. */
    REJECT,
    /** Keep the solution and attach a violation. */
    WARN;

    public static HardRuleAction fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return REJECT;
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
