package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Answer of a human reviewer for a solution flagged for review.
 */
public final class ReviewDecision {

    /**
     * Kind of review answer.
     */
    public enum Type {
        APPROVE,
        REJECT,
        MODIFY
    }

    private final Type type;
    private final List<String> replacementResourceIds;
    private final String reviewer;
    private final String comment;

    private ReviewDecision(Type type, List<String> replacementResourceIds, String reviewer, String comment) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.replacementResourceIds = Collections.unmodifiableList(new ArrayList<>(replacementResourceIds));
        this.reviewer = reviewer;
        this.comment = comment;
        if (type == Type.MODIFY && this.replacementResourceIds.isEmpty()) {
            throw new IllegalArgumentException("MODIFY decision requires replacement resource ids");
        }
    }

    public static ReviewDecision approve(String reviewer, String comment) {
        return new ReviewDecision(Type.APPROVE, Collections.emptyList(), reviewer, comment);
    }

    public static ReviewDecision reject(String reviewer, String comment) {
        return new ReviewDecision(Type.REJECT, Collections.emptyList(), reviewer, comment);
    }

    public static ReviewDecision modify(List<String> replacementResourceIds, String reviewer, String comment) {
        Objects.requireNonNull(replacementResourceIds, "replacementResourceIds must not be null");
        return new ReviewDecision(Type.MODIFY, replacementResourceIds, reviewer, comment);
    }

    public static ReviewDecision timedOut() {
        return new ReviewDecision(Type.REJECT, Collections.emptyList(), "system", "review timed out");
    }

    public Type getType() {
        return type;
    }

    public List<String> getReplacementResourceIds() {
        return replacementResourceIds;
    }

    public String getReviewer() {
        return reviewer;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public String toString() {
        return "ReviewDecision{" + type + ", reviewer=" + reviewer + '}';
    }
}
