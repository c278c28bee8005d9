package org.rapidrelief.engine.domain.exception;

/**
 * The resource catalog could not be reached or answered with an error.
 */
public final class ResourceCatalogException extends AllocationException {

    public ResourceCatalogException(String message) {
        super("CATALOG_UNAVAILABLE", message);
    }

    public ResourceCatalogException(String message, Throwable cause) {
        super("CATALOG_UNAVAILABLE", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
