package org.rapidrelief.engine.library;

import org.rapidrelief.engine.domain.rule.TriggerRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable set of trigger rules, in load order.
 */
public final class RuleLibrary {

    private final String version;
    private final List<TriggerRule> rules;

    public RuleLibrary(String version, List<TriggerRule> rules) {
        this.version = version;
        this.rules = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rules, "rules must not be null")));
    }

    public String getVersion() {
        return version;
    }

    public List<TriggerRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
