package org.rapidrelief.engine.domain.rule;

import org.rapidrelief.engine.domain.model.EventContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Conjunction. An empty conjunction holds.
 */
public final class AllOf implements Condition {

    private final List<Condition> children;

    public AllOf(List<Condition> children) {
        Objects.requireNonNull(children, "children must not be null");
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public List<Condition> getChildren() {
        return children;
    }

    @Override
    public boolean evaluate(EventContext context) {
        for (Condition child : children) {
            if (!child.evaluate(context)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void collectMatches(EventContext context, List<String> matches) {
        for (Condition child : children) {
            child.collectMatches(context, matches);
        }
    }

    @Override
    public String describe() {
        return children.stream().map(Condition::describe).collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public String toString() {
        return describe();
    }
}
