package org.rapidrelief.engine.domain.model;

import java.util.Locale;

/**
 * Availability of a rescue resource as reported by the catalog.
 */
public enum ResourceStatus {
    AVAILABLE(1.0),
    STANDBY(0.7),
    DEPLOYED(0.0),
    UNAVAILABLE(0.0);

    private final double availabilityWeight;

    ResourceStatus(double availabilityWeight) {
        this.availabilityWeight = availabilityWeight;
    }

    public double getAvailabilityWeight() {
        return availabilityWeight;
    }

    /**
     * Only available and standby resources may be allocated.
     */
    public boolean isAllocatable() {
        return availabilityWeight > 0.0;
    }

    /**
     * Maps a catalog status string, treating anything unknown as unavailable.
     */
    public static ResourceStatus fromCode(String code) {
        if (code == null) {
            return UNAVAILABLE;
        }
        switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "available":
                return AVAILABLE;
            case "standby":
            case "ready":
                return STANDBY;
            case "deployed":
            case "assigned":
            case "busy":
                return DEPLOYED;
            default:
                return UNAVAILABLE;
        }
    }
}
