package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.model.CapabilityRequirement;
import org.rapidrelief.engine.domain.model.MatchedRule;
import org.rapidrelief.engine.domain.model.Priority;
import org.rapidrelief.engine.domain.model.Requirement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RequirementAggregatorTest {

    private final RequirementAggregator aggregator = new RequirementAggregator();

    @Test
    void mergesCapabilitiesAndKeepsMostUrgentPriorityPerTaskType() {
        MatchedRule rescue = rule("R1", Priority.HIGH, List.of("EM10", "EM14"),
                new CapabilityRequirement("structural_rescue", Priority.HIGH, 2));
        MatchedRule medical = rule("R2", Priority.MEDIUM, List.of("EM14"),
                new CapabilityRequirement("medical_triage", Priority.MEDIUM, 1));

        List<Requirement> requirements = aggregator.aggregate(List.of(rescue, medical));

        assertThat(requirements).extracting(Requirement::getTaskType).containsExactly("EM10", "EM14");
        Requirement triage = requirements.get(1);
        assertThat(triage.getPriority()).isEqualTo(Priority.HIGH);
        assertThat(triage.getRequiredCapabilities()).containsExactly("structural_rescue", "medical_triage");
    }

    @Test
    void criticalCapabilityMakesRequirementCritical() {
        MatchedRule rule = rule("R1", Priority.LOW, List.of("EM08"),
                new CapabilityRequirement("hazmat_handling", Priority.CRITICAL, 1));

        Requirement requirement = aggregator.aggregate(List.of(rule)).get(0);

        assertThat(requirement.isCritical()).isTrue();
    }

    @Test
    void ruleWithoutTaskTypesIsKeyedByRuleId() {
        MatchedRule rule = rule("TRR-X", Priority.MEDIUM, List.of(),
                new CapabilityRequirement("aerial_recon", Priority.MEDIUM, 1));

        List<Requirement> requirements = aggregator.aggregate(List.of(rule));

        assertThat(requirements).extracting(Requirement::getTaskType).containsExactly("TRR-X");
    }

    @Test
    void noMatchesMeansNoRequirements() {
        assertThat(aggregator.aggregate(List.of())).isEmpty();
    }

    private static MatchedRule rule(String id, Priority priority, List<String> taskTypes,
                                    CapabilityRequirement... capabilities) {
        return new MatchedRule.Builder()
                .ruleId(id)
                .priority(priority)
                .weight(0.5)
                .taskTypes(taskTypes)
                .capabilityRequirements(List.of(capabilities))
                .build();
    }
}
