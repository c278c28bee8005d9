package org.rapidrelief.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for a rescue resource returned by the catalog.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ResourceCandidateDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("resource_type")
    private String resourceType;

    @JsonProperty("capabilities")
    private List<String> capabilities;

    @JsonProperty("available_personnel")
    private int availablePersonnel;

    @JsonProperty("rescue_capacity")
    private Integer rescueCapacity;

    @JsonProperty("location")
    private LocationDto location;

    @JsonProperty("status")
    private String status;

    @JsonProperty("eta_minutes")
    private Double etaMinutes;

    @JsonProperty("deployment_cost")
    private double deploymentCost;

    @JsonProperty("hazard_level")
    private Double hazardLevel;

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getResourceType() {
        return resourceType;
    }

    public void setResourceType(String resourceType) {
        this.resourceType = resourceType;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(List<String> capabilities) {
        this.capabilities = capabilities;
    }

    public int getAvailablePersonnel() {
        return availablePersonnel;
    }

    public void setAvailablePersonnel(int availablePersonnel) {
        this.availablePersonnel = availablePersonnel;
    }

    /**
     * Null when the catalog has no recorded capacity for this resource.
     */
    public Integer getRescueCapacity() {
        return rescueCapacity;
    }

    public void setRescueCapacity(Integer rescueCapacity) {
        this.rescueCapacity = rescueCapacity;
    }

    public LocationDto getLocation() {
        return location;
    }

    public void setLocation(LocationDto location) {
        this.location = location;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    /**
     * Null when the routing service produced no ETA for this resource.
     */
    public Double getEtaMinutes() {
        return etaMinutes;
    }

    public void setEtaMinutes(Double etaMinutes) {
        this.etaMinutes = etaMinutes;
    }

    public double getDeploymentCost() {
        return deploymentCost;
    }

    public void setDeploymentCost(double deploymentCost) {
        this.deploymentCost = deploymentCost;
    }

    public Double getHazardLevel() {
        return hazardLevel;
    }

    public void setHazardLevel(Double hazardLevel) {
        this.hazardLevel = hazardLevel;
    }
}
