package org.rapidrelief.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for POST /v1/allocations: marks the resources of a committed plan as deployed.
 */
public final class AllocationCommitDto {

    @JsonProperty("run_id")
    private final String runId;

    @JsonProperty("solution_id")
    private final String solutionId;

    @JsonProperty("resource_ids")
    private final List<String> resourceIds;

    public AllocationCommitDto(String runId, String solutionId, List<String> resourceIds) {
        this.runId = runId;
        this.solutionId = solutionId;
        this.resourceIds = resourceIds;
    }

    public String getRunId() {
        return runId;
    }

    public String getSolutionId() {
        return solutionId;
    }

    public List<String> getResourceIds() {
        return resourceIds;
    }
}
