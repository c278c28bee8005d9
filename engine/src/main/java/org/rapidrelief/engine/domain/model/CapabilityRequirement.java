package org.rapidrelief.engine.domain.model;

import java.util.Objects;

/**
 * A capability demanded by a trigger rule action.
 */
public final class CapabilityRequirement {

    private final String code;
    private final Priority priority;
    private final int minQuantity;

    public CapabilityRequirement(String code, Priority priority, int minQuantity) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        if (minQuantity < 1) {
            throw new IllegalArgumentException("minQuantity must be at least 1");
        }
        this.minQuantity = minQuantity;
    }

    public String getCode() {
        return code;
    }

    public Priority getPriority() {
        return priority;
    }

    public int getMinQuantity() {
        return minQuantity;
    }

    @Override
    public String toString() {
        return code + "(" + priority.getCode() + ", x" + minQuantity + ")";
    }
}
