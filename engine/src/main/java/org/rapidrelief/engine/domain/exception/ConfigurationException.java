package org.rapidrelief.engine.domain.exception;

/**
 * A configuration document is missing or malformed.
 */
public final class ConfigurationException extends AllocationException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_INVALID", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("CONFIGURATION_INVALID", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
