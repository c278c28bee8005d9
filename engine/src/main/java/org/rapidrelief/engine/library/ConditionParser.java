package org.rapidrelief.engine.library;

import com.fasterxml.jackson.databind.JsonNode;
import org.rapidrelief.engine.domain.rule.AllOf;
import org.rapidrelief.engine.domain.rule.AnyOf;
import org.rapidrelief.engine.domain.rule.Comparison;
import org.rapidrelief.engine.domain.rule.ComparisonOperator;
import org.rapidrelief.engine.domain.rule.Condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compiles condition documents into a {@link Condition} tree.
 * <p>
 * Accepted shapes:
 * <ul>
 *   <li>{@code {logic: AND|OR, conditions: [...]}}</li>
 *   <li>{@code {all: [...]}} and {@code {any: [...]}}</li>
 *   <li>{@code {field, operator, value}}</li>
 * </ul>
 */
final class ConditionParser {

    private ConditionParser() {
    }

    static Condition parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("condition must be a mapping");
        }
        if (node.has("all")) {
            return new AllOf(parseChildren(node.get("all"), "all"));
        }
        if (node.has("any")) {
            return new AnyOf(parseChildren(node.get("any"), "any"));
        }
        if (node.has("conditions")) {
            List<Condition> children = parseChildren(node.get("conditions"), "conditions");
            String logic = Documents.text(node, "logic");
            if (logic == null || "AND".equals(logic.trim().toUpperCase(Locale.ROOT))) {
                return new AllOf(children);
            }
            if ("OR".equals(logic.trim().toUpperCase(Locale.ROOT))) {
                return new AnyOf(children);
            }
            throw new IllegalArgumentException("Unknown logic: " + logic);
        }
        return parseLeaf(node);
    }

    private static List<Condition> parseChildren(JsonNode node, String field) {
        if (node == null || !node.isArray() || node.size() == 0) {
            throw new IllegalArgumentException("'" + field + "' must be a non-empty list");
        }
        List<Condition> children = new ArrayList<>(node.size());
        for (JsonNode child : node) {
            children.add(parse(child));
        }
        return children;
    }

    private static Comparison parseLeaf(JsonNode node) {
        String field = Documents.requireText(node, "field");
        ComparisonOperator operator = ComparisonOperator.fromCode(Documents.requireText(node, "operator"));
        if (!node.has("value")) {
            throw new IllegalArgumentException("condition on '" + field + "' has no value");
        }
        return new Comparison(field, operator, Documents.value(node.get("value")));
    }
}
