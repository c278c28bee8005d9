package org.rapidrelief.engine.domain.rule;

import org.rapidrelief.engine.domain.model.EventContext;

import java.util.List;

/**
 * Node of a compiled rule condition tree: a leaf {@link Comparison} or an
 * {@link AllOf} / {@link AnyOf} combination of children.
 */
public interface Condition {

    /**
     * Evaluates the condition. Never throws for missing or mistyped fields; those evaluate to false.
     */
    boolean evaluate(EventContext context);

    /**
     * Appends the descriptions of the leaves that hold for {@code context}.
     */
    void collectMatches(EventContext context, List<String> matches);

    /**
     * Human-readable form of the condition.
     */
    String describe();
}
