package org.rapidrelief.engine.library;

import org.rapidrelief.engine.domain.rule.HardRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable set of hard rules, in load order.
 */
public final class HardRuleLibrary {

    private final List<HardRule> rules;

    public HardRuleLibrary(List<HardRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rules, "rules must not be null")));
    }

    public List<HardRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
