package org.rapidrelief.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body of POST /reviews/{runId}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReviewDecisionDto {

    @JsonProperty("decision")
    private String decision;

    @JsonProperty("resource_ids")
    private List<String> resourceIds;

    @JsonProperty("reviewer")
    private String reviewer;

    @JsonProperty("comment")
    private String comment;

    /**
     * {@code approve}, {@code reject} or {@code modify}.
     */
    public String getDecision() {
        return decision;
    }

    public void setDecision(String decision) {
        this.decision = decision;
    }

    /**
     * Replacement selection, required for {@code modify}.
     */
    public List<String> getResourceIds() {
        return resourceIds;
    }

    public void setResourceIds(List<String> resourceIds) {
        this.resourceIds = resourceIds;
    }

    public String getReviewer() {
        return reviewer;
    }

    public void setReviewer(String reviewer) {
        this.reviewer = reviewer;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }
}
