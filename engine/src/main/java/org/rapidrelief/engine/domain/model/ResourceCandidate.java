package org.rapidrelief.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a rescue team or vehicle offered by the resource catalog.
 * {@code rescueCapacity} is null until it has been supplied or estimated.
 */
public final class ResourceCandidate {

    private final String id;
    private final String name;
    private final String resourceType;
    private final Set<String> capabilities;
    private final int availablePersonnel;
    private final Integer rescueCapacity;
    private final boolean capacityEstimated;
    private final GeoPoint location;
    private final ResourceStatus status;
    private final double etaMinutes;
    private final double deploymentCost;
    private final double hazardLevel;

    private ResourceCandidate(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.resourceType = builder.resourceType;
        this.capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.capabilities));
        this.availablePersonnel = builder.availablePersonnel;
        this.rescueCapacity = builder.rescueCapacity;
        this.capacityEstimated = builder.capacityEstimated;
        this.location = builder.location;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.etaMinutes = builder.etaMinutes;
        this.deploymentCost = builder.deploymentCost;
        this.hazardLevel = builder.hazardLevel;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Catalog resource type, or null when the catalog did not report one.
     */
    public String getResourceType() {
        return resourceType;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public int getAvailablePersonnel() {
        return availablePersonnel;
    }

    /**
     * People this resource can rescue within the operational window, or null when
     * the catalog did not report it and it has not been estimated yet.
     */
    public Integer getRescueCapacity() {
        return rescueCapacity;
    }

    public boolean hasRescueCapacity() {
        return rescueCapacity != null;
    }

    /**
     * Resolved capacity. Fails if the capacity was never supplied or estimated.
     */
    public int requireRescueCapacity() {
        if (rescueCapacity == null) {
            throw new IllegalStateException("Rescue capacity of " + id + " has not been resolved");
        }
        return rescueCapacity;
    }

    public boolean isCapacityEstimated() {
        return capacityEstimated;
    }

    public GeoPoint getLocation() {
        return location;
    }

    public ResourceStatus getStatus() {
        return status;
    }

    public double getEtaMinutes() {
        return etaMinutes;
    }

    public double getDeploymentCost() {
        return deploymentCost;
    }

    /**
     * Operational hazard in [0, 1] the resource is exposed to on this deployment.
     */
    public double getHazardLevel() {
        return hazardLevel;
    }

    public boolean isAllocatable() {
        return status.isAllocatable();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .resourceType(resourceType)
                .capabilities(capabilities)
                .availablePersonnel(availablePersonnel)
                .rescueCapacity(rescueCapacity)
                .capacityEstimated(capacityEstimated)
                .location(location)
                .status(status)
                .etaMinutes(etaMinutes)
                .deploymentCost(deploymentCost)
                .hazardLevel(hazardLevel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceCandidate)) {
            return false;
        }
        ResourceCandidate other = (ResourceCandidate) o;
        return id.equals(other.id)
                && availablePersonnel == other.availablePersonnel
                && Objects.equals(rescueCapacity, other.rescueCapacity)
                && status == other.status
                && capabilities.equals(other.capabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, availablePersonnel, rescueCapacity, status);
    }

    @Override
    public String toString() {
        return String.format("ResourceCandidate{id='%s', type=%s, capacity=%s%s, eta=%.1fmin, status=%s}",
                id, resourceType, rescueCapacity, capacityEstimated ? " (estimated)" : "", etaMinutes, status);
    }

    /**
     * Builder for ResourceCandidate.
     */
    public static final class Builder {
        private String id;
        private String name;
        private String resourceType;
        private Set<String> capabilities = Collections.emptySet();
        private int availablePersonnel;
        private Integer rescueCapacity;
        private boolean capacityEstimated;
        private GeoPoint location;
        private ResourceStatus status = ResourceStatus.AVAILABLE;
        private double etaMinutes;
        private double deploymentCost;
        private double hazardLevel;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = Objects.requireNonNull(capabilities, "capabilities must not be null");
            return this;
        }

        public Builder availablePersonnel(int availablePersonnel) {
            if (availablePersonnel < 0) {
                throw new IllegalArgumentException("availablePersonnel must not be negative");
            }
            this.availablePersonnel = availablePersonnel;
            return this;
        }

        public Builder rescueCapacity(Integer rescueCapacity) {
            if (rescueCapacity != null && rescueCapacity < 0) {
                throw new IllegalArgumentException("rescueCapacity must not be negative");
            }
            this.rescueCapacity = rescueCapacity;
            return this;
        }

        public Builder capacityEstimated(boolean capacityEstimated) {
            this.capacityEstimated = capacityEstimated;
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder status(ResourceStatus status) {
            this.status = status;
            return this;
        }

        public Builder etaMinutes(double etaMinutes) {
            if (etaMinutes < 0.0) {
                throw new IllegalArgumentException("etaMinutes must not be negative");
            }
            this.etaMinutes = etaMinutes;
            return this;
        }

        public Builder deploymentCost(double deploymentCost) {
            this.deploymentCost = deploymentCost;
            return this;
        }

        public Builder hazardLevel(double hazardLevel) {
            if (hazardLevel < 0.0 || hazardLevel > 1.0) {
                throw new IllegalArgumentException("hazardLevel must be within [0, 1]");
            }
            this.hazardLevel = hazardLevel;
            return this;
        }

        public ResourceCandidate build() {
            return new ResourceCandidate(this);
        }
    }
}
