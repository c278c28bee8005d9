package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Input of one pipeline run.
 */
public final class AllocationRequest {

    private final String eventId;
    private final EventContext context;
    private final List<String> sceneCodes;
    private final Area area;
    private final int estimatedAffected;
    private final Integer maxResults;
    private final OptimizationMode mode;
    private final boolean allowGreedyRetry;

    private AllocationRequest(Builder builder) {
        this.eventId = Objects.requireNonNull(builder.eventId, "eventId must not be null");
        this.context = Objects.requireNonNull(builder.context, "context must not be null");
        this.sceneCodes = Collections.unmodifiableList(new ArrayList<>(builder.sceneCodes));
        this.area = Objects.requireNonNull(builder.area, "area must not be null");
        this.estimatedAffected = builder.estimatedAffected;
        this.maxResults = builder.maxResults;
        this.mode = builder.mode;
        this.allowGreedyRetry = builder.allowGreedyRetry;
    }

    public String getEventId() {
        return eventId;
    }

    public EventContext getContext() {
        return context;
    }

    public List<String> getSceneCodes() {
        return sceneCodes;
    }

    public Area getArea() {
        return area;
    }

    public int getEstimatedAffected() {
        return estimatedAffected;
    }

    /**
     * Caller override of the catalog result cap, or null for the configured default.
     */
    public Integer getMaxResults() {
        return maxResults;
    }

    /**
     * Forced optimizer mode, or null to choose by candidate count.
     */
    public OptimizationMode getMode() {
        return mode;
    }

    /**
     * Whether the caller accepts a greedy rerun when multi-objective optimization fails.
     */
    public boolean isAllowGreedyRetry() {
        return allowGreedyRetry;
    }

    @Override
    public String toString() {
        return "AllocationRequest{eventId='" + eventId + "', scenes=" + sceneCodes
                + ", affected=" + estimatedAffected + ", mode=" + mode + '}';
    }

    /**
     * Builder for AllocationRequest.
     */
    public static final class Builder {
        private String eventId;
        private EventContext context = EventContext.empty();
        private List<String> sceneCodes = Collections.emptyList();
        private Area area;
        private int estimatedAffected;
        private Integer maxResults;
        private OptimizationMode mode;
        private boolean allowGreedyRetry;

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder context(EventContext context) {
            this.context = context;
            return this;
        }

        public Builder sceneCodes(List<String> sceneCodes) {
            this.sceneCodes = Objects.requireNonNull(sceneCodes, "sceneCodes must not be null");
            return this;
        }

        public Builder area(Area area) {
            this.area = area;
            return this;
        }

        public Builder estimatedAffected(int estimatedAffected) {
            if (estimatedAffected < 0) {
                throw new IllegalArgumentException("estimatedAffected must not be negative");
            }
            this.estimatedAffected = estimatedAffected;
            return this;
        }

        public Builder maxResults(Integer maxResults) {
            if (maxResults != null && maxResults < 1) {
                throw new IllegalArgumentException("maxResults must be at least 1");
            }
            this.maxResults = maxResults;
            return this;
        }

        public Builder mode(OptimizationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder allowGreedyRetry(boolean allowGreedyRetry) {
            this.allowGreedyRetry = allowGreedyRetry;
            return this;
        }

        public AllocationRequest build() {
            return new AllocationRequest(this);
        }
    }
}
