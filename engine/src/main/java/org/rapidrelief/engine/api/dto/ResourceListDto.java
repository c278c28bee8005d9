package org.rapidrelief.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for GET /v1/resources/candidates and GET /v1/resources.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ResourceListDto {

    @JsonProperty("resources")
    private List<ResourceCandidateDto> resources;

    @JsonProperty("truncated")
    private boolean truncated;

    public List<ResourceCandidateDto> getResources() {
        return resources;
    }

    public void setResources(List<ResourceCandidateDto> resources) {
        this.resources = resources;
    }

    /**
     * True when the catalog had more matches than {@code max_results}.
     */
    public boolean isTruncated() {
        return truncated;
    }

    public void setTruncated(boolean truncated) {
        this.truncated = truncated;
    }
}
