package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.model.MatchedRule;

import java.util.List;

/**
 * Evaluates trigger rules against an event.
 */
public interface RuleEngine {

    /**
     * Returns every rule whose condition holds, sorted by weight descending.
     * Pure and deterministic.
     *
     * @param context the structured event description
     * @return matched rules, possibly empty
     */
    List<MatchedRule> evaluate(EventContext context);
}
