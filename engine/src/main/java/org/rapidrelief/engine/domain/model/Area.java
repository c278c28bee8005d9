package org.rapidrelief.engine.domain.model;

import java.util.Objects;

/**
 * Search area for candidate resources: a center and a radius.
 */
public final class Area {

    private final GeoPoint center;
    private final double radiusKm;

    public Area(GeoPoint center, double radiusKm) {
        this.center = Objects.requireNonNull(center, "center must not be null");
        if (radiusKm <= 0.0) {
            throw new IllegalArgumentException("radiusKm must be positive");
        }
        this.radiusKm = radiusKm;
    }

    public GeoPoint getCenter() {
        return center;
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    @Override
    public String toString() {
        return "Area{center=" + center + ", radiusKm=" + radiusKm + '}';
    }
}
