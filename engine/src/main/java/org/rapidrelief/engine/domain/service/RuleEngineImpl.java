package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.exception.RuleLoadException;
import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.model.MatchedRule;
import org.rapidrelief.engine.domain.rule.TriggerRule;
import org.rapidrelief.engine.library.RuleLibrary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Rule engine over an immutable {@link RuleLibrary}. Refuses to start without rules.
 */
public final class RuleEngineImpl implements RuleEngine {

    private static final Logger LOG = Logger.getLogger(RuleEngineImpl.class.getName());

    private final RuleLibrary library;

    public RuleEngineImpl(RuleLibrary library) {
        if (library == null || library.isEmpty()) {
            throw new RuleLoadException("rule library", "no trigger rules loaded");
        }
        this.library = library;
    }

    @Override
    public List<MatchedRule> evaluate(EventContext context) {
        Objects.requireNonNull(context, "context must not be null");

        List<MatchedRule> matches = new ArrayList<>();
        for (TriggerRule rule : library.getRules()) {
            if (rule.matches(context)) {
                MatchedRule match = rule.toMatch(context);
                LOG.fine(() -> String.format("Rule %s matched on %s", rule.getId(), match.getMatchedConditions()));
                matches.add(match);
            }
        }
        // List.sort is stable, so equal weights keep load order
        matches.sort(Comparator.comparingDouble(MatchedRule::getWeight).reversed());

        LOG.info(() -> String.format("Rule evaluation: %d of %d rules matched", matches.size(), library.size()));
        return matches;
    }
}
