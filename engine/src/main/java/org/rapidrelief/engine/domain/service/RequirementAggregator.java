package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.model.CapabilityRequirement;
import org.rapidrelief.engine.domain.model.MatchedRule;
import org.rapidrelief.engine.domain.model.Priority;
import org.rapidrelief.engine.domain.model.Requirement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds matched rules into one {@link Requirement} per task type.
 * <p>
 * Capabilities of a rule apply to every task type it names. When the same task type
 * comes from several rules, capability sets are merged and the most urgent priority
 * is kept. A capability marked critical makes its requirement critical. A rule that
 * names no task type contributes a requirement keyed by its rule id.
 */
public final class RequirementAggregator {

    public List<Requirement> aggregate(List<MatchedRule> matchedRules) {
        Map<String, Priority> priorities = new LinkedHashMap<>();
        Map<String, Set<String>> capabilities = new LinkedHashMap<>();

        for (MatchedRule rule : matchedRules) {
            Priority rulePriority = rule.getPriority();
            Set<String> ruleCapabilities = new LinkedHashSet<>();
            for (CapabilityRequirement capability : rule.getCapabilityRequirements()) {
                ruleCapabilities.add(capability.getCode());
                rulePriority = rulePriority.max(capability.getPriority());
            }

            List<String> taskTypes = rule.getTaskTypes().isEmpty()
                    ? List.of(rule.getRuleId())
                    : rule.getTaskTypes();
            for (String taskType : taskTypes) {
                priorities.merge(taskType, rulePriority, Priority::max);
                capabilities.computeIfAbsent(taskType, k -> new LinkedHashSet<>()).addAll(ruleCapabilities);
            }
        }

        List<Requirement> requirements = new ArrayList<>(priorities.size());
        for (Map.Entry<String, Priority> entry : priorities.entrySet()) {
            requirements.add(new Requirement(entry.getKey(), entry.getValue(), capabilities.get(entry.getKey())));
        }
        return requirements;
    }
}
