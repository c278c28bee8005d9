package org.rapidrelief.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request body of POST /allocations.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AllocationRequestDto {

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("context")
    private Map<String, Object> context;

    @JsonProperty("scene_codes")
    private List<String> sceneCodes;

    @JsonProperty("center")
    private LocationDto center;

    @JsonProperty("radius_km")
    private double radiusKm;

    @JsonProperty("estimated_affected")
    private int estimatedAffected;

    @JsonProperty("max_results")
    private Integer maxResults;

    @JsonProperty("mode")
    private String mode;

    @JsonProperty("allow_greedy_retry")
    private boolean allowGreedyRetry;

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public void setContext(Map<String, Object> context) {
        this.context = context;
    }

    public List<String> getSceneCodes() {
        return sceneCodes;
    }

    public void setSceneCodes(List<String> sceneCodes) {
        this.sceneCodes = sceneCodes;
    }

    public LocationDto getCenter() {
        return center;
    }

    public void setCenter(LocationDto center) {
        this.center = center;
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    public void setRadiusKm(double radiusKm) {
        this.radiusKm = radiusKm;
    }

    public int getEstimatedAffected() {
        return estimatedAffected;
    }

    public void setEstimatedAffected(int estimatedAffected) {
        this.estimatedAffected = estimatedAffected;
    }

    public Integer getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(Integer maxResults) {
        this.maxResults = maxResults;
    }

    /**
     * {@code greedy}, {@code multi_objective}, or null to let the engine choose.
     */
    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public boolean isAllowGreedyRetry() {
        return allowGreedyRetry;
    }

    public void setAllowGreedyRetry(boolean allowGreedyRetry) {
        this.allowGreedyRetry = allowGreedyRetry;
    }
}
