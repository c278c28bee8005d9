package org.rapidrelief.engine.domain.exception;

/**
 * Base class for every failure raised by the allocation engine.
 * Each subclass carries a stable error code and tells the caller whether
 * repeating the same request may succeed.
 */
public abstract class AllocationException extends RuntimeException {

    private final String errorCode;

    protected AllocationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AllocationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may retry the same request later.
     */
    public abstract boolean isRetryable();
}
