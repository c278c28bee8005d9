package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured description of a disaster event, evaluated by trigger rules.
 * Values may be nested maps; fields are addressed with dotted paths
 * such as {@code "building.floors"}.
 */
public final class EventContext {

    private final Map<String, Object> values;

    private EventContext(Map<String, Object> values) {
        this.values = values;
    }

    public static EventContext of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new EventContext(freezeMap(values));
    }

    public static EventContext empty() {
        return new EventContext(Collections.emptyMap());
    }

    public Map<String, Object> getValues() {
        return values;
    }

    /**
     * Resolves a dotted path through nested maps.
     *
     * @return the value, or empty when any segment is missing or null
     */
    public Optional<Object> resolve(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Object current = values;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return Optional.empty();
            }
            current = ((Map<?, ?>) current).get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map) {
            return freezeMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public String toString() {
        return "EventContext" + values;
    }
}
