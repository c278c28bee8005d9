package org.rapidrelief.engine.library;

import com.fasterxml.jackson.databind.JsonNode;
import org.rapidrelief.engine.config.ConfigurationLoader;
import org.rapidrelief.engine.domain.exception.ConfigurationException;
import org.rapidrelief.engine.domain.exception.RuleLoadException;
import org.rapidrelief.engine.domain.model.Severity;
import org.rapidrelief.engine.domain.rule.ComparisonOperator;
import org.rapidrelief.engine.domain.rule.HardRule;
import org.rapidrelief.engine.domain.rule.HardRuleAction;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads hard rules ({@code hard_rules: {<id>: {...}}}) into a {@link HardRuleLibrary}.
 */
public final class HardRuleLibraryLoader {

    private static final Logger LOG = Logger.getLogger(HardRuleLibraryLoader.class.getName());

    private final ConfigurationLoader configurationLoader;

    public HardRuleLibraryLoader(ConfigurationLoader configurationLoader) {
        this.configurationLoader = Objects.requireNonNull(configurationLoader, "configurationLoader must not be null");
    }

    public HardRuleLibrary load(String location) {
        JsonNode root;
        try {
            root = configurationLoader.load(location);
        } catch (ConfigurationException e) {
            throw new RuleLoadException(location, e.getMessage(), e);
        }
        JsonNode rulesNode = root.get("hard_rules");
        if (rulesNode == null || !rulesNode.isObject() || rulesNode.size() == 0) {
            throw new RuleLoadException(location, "no hard rules defined");
        }

        List<HardRule> rules = new ArrayList<>(rulesNode.size());
        Iterator<Map.Entry<String, JsonNode>> entries = rulesNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            try {
                rules.add(parseRule(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new RuleLoadException(location, "hard rule " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        LOG.info(() -> String.format("Loaded %d hard rules from %s", rules.size(), location));
        return new HardRuleLibrary(rules);
    }

    private HardRule parseRule(String id, JsonNode node) {
        JsonNode check = Documents.requireObject(node, "check");
        HardRule.Builder builder = new HardRule.Builder()
                .id(id)
                .name(Documents.text(node, "name"))
                .check(Documents.requireText(check, "field"),
                        ComparisonOperator.fromCode(Documents.requireText(check, "operator")))
                .threshold(Documents.number(check, "threshold"))
                .thresholdField(Documents.text(check, "threshold_field"))
                .action(HardRuleAction.fromCode(Documents.text(node, "action")))
                .message(Documents.requireText(node, "message"));
        String severity = Documents.text(node, "severity");
        if (severity != null) {
            builder.severity(Severity.fromCode(severity));
        }
        JsonNode condition = node.get("condition");
        if (condition != null && !condition.isNull()) {
            builder.applicability(ConditionParser.parse(condition));
        }
        return builder.build();
    }
}
