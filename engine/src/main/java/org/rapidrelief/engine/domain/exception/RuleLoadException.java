package org.rapidrelief.engine.domain.exception;

/**
 * The trigger or hard rule source could not be loaded, or loaded empty.
 */
public final class RuleLoadException extends AllocationException {

    private final String source;

    public RuleLoadException(String source, String reason) {
        super("RULE_LOAD_FAILED", "Failed to load rules from " + source + ": " + reason);
        this.source = source;
    }

    public RuleLoadException(String source, String reason, Throwable cause) {
        super("RULE_LOAD_FAILED", "Failed to load rules from " + source + ": " + reason, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
