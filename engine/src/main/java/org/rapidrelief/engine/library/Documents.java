package org.rapidrelief.engine.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rapidrelief.engine.domain.model.TaskDependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field accessors shared by the document loaders. All failures are
 * {@link IllegalArgumentException}s that the loaders wrap with the document location.
 */
final class Documents {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Documents() {
    }

    static JsonNode requireObject(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("'" + field + "' must be a mapping");
        }
        return node;
    }

    static String requireText(JsonNode parent, String field) {
        String value = text(parent, field);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
        return value.trim();
    }

    static String text(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new IllegalArgumentException("'" + field + "' must be a scalar");
        }
        return node.asText();
    }

    static Double number(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be numeric");
        }
        return node.asDouble();
    }

    static List<String> textList(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be a list");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isValueNode()) {
                throw new IllegalArgumentException("'" + field + "' must contain scalars only");
            }
            values.add(item.asText().trim());
        }
        return values;
    }

    /**
     * Reads {@code [{task, strict}]}; a bare task code is a strict edge.
     */
    static List<TaskDependency> dependencies(JsonNode node) {
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("dependency list must be a list");
        }
        List<TaskDependency> dependencies = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (item.isTextual()) {
                dependencies.add(new TaskDependency(item.asText().trim(), true));
            } else if (item.isObject()) {
                JsonNode strict = item.get("strict");
                dependencies.add(new TaskDependency(requireText(item, "task"),
                        strict == null || strict.asBoolean(true)));
            } else {
                throw new IllegalArgumentException("dependency must be a task code or {task, strict}");
            }
        }
        return dependencies;
    }

    /**
     * Converts a scalar or list node into plain Java values.
     */
    static Object value(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return MAPPER.convertValue(node, Object.class);
    }
}
