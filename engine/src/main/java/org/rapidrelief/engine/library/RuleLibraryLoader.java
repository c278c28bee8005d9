package org.rapidrelief.engine.library;

import com.fasterxml.jackson.databind.JsonNode;
import org.rapidrelief.engine.config.ConfigurationLoader;
import org.rapidrelief.engine.domain.exception.ConfigurationException;
import org.rapidrelief.engine.domain.exception.RuleLoadException;
import org.rapidrelief.engine.domain.model.CapabilityRequirement;
import org.rapidrelief.engine.domain.model.Priority;
import org.rapidrelief.engine.domain.rule.TriggerRule;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads trigger rules ({@code rules: {<id>: {...}}}) into a {@link RuleLibrary}.
 * Any failure, including an empty rule set, is a {@link RuleLoadException}.
 */
public final class RuleLibraryLoader {

    private static final Logger LOG = Logger.getLogger(RuleLibraryLoader.class.getName());

    private final ConfigurationLoader configurationLoader;

    public RuleLibraryLoader(ConfigurationLoader configurationLoader) {
        this.configurationLoader = Objects.requireNonNull(configurationLoader, "configurationLoader must not be null");
    }

    public RuleLibrary load(String location) {
        JsonNode root;
        try {
            root = configurationLoader.load(location);
        } catch (ConfigurationException e) {
            throw new RuleLoadException(location, e.getMessage(), e);
        }
        JsonNode rulesNode = root.get("rules");
        if (rulesNode == null || !rulesNode.isObject() || rulesNode.size() == 0) {
            throw new RuleLoadException(location, "no rules defined");
        }

        List<TriggerRule> rules = new ArrayList<>(rulesNode.size());
        Iterator<Map.Entry<String, JsonNode>> entries = rulesNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            try {
                rules.add(parseRule(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new RuleLoadException(location, "rule " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }

        RuleLibrary library = new RuleLibrary(Documents.text(root, "version"), rules);
        LOG.info(() -> String.format("Loaded %d trigger rules from %s", library.size(), location));
        return library;
    }

    private TriggerRule parseRule(String id, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("rule body must be a mapping");
        }
        JsonNode actions = Documents.requireObject(node, "actions");
        Double weight = Documents.number(node, "weight");
        return new TriggerRule.Builder()
                .id(id)
                .name(Documents.text(node, "name"))
                .description(Documents.text(node, "description"))
                .priority(Priority.fromCode(Documents.text(node, "priority")))
                .weight(weight != null ? weight : 0.5)
                .trigger(ConditionParser.parse(node.get("trigger")))
                .taskTypes(Documents.textList(actions, "task_types"))
                .capabilityRequirements(parseCapabilities(actions.get("required_capabilities")))
                .resourceTypes(Documents.textList(actions, "resource_types"))
                .tacticalNotes(Documents.text(actions, "tactical_notes"))
                .build();
    }

    private List<CapabilityRequirement> parseCapabilities(JsonNode node) {
        List<CapabilityRequirement> requirements = new ArrayList<>();
        if (node == null || node.isNull()) {
            return requirements;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'required_capabilities' must be a list");
        }
        for (JsonNode item : node) {
            if (item.isTextual()) {
                requirements.add(new CapabilityRequirement(item.asText().trim(), Priority.MEDIUM, 1));
                continue;
            }
            Double minQuantity = Documents.number(item, "min_quantity");
            requirements.add(new CapabilityRequirement(
                    Documents.requireText(item, "code"),
                    Priority.fromCode(Documents.text(item, "priority")),
                    minQuantity != null ? minQuantity.intValue() : 1));
        }
        return requirements;
    }
}
