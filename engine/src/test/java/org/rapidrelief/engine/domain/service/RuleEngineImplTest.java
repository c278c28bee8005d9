package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.ConfigurationLoader;
import org.rapidrelief.engine.domain.exception.RuleLoadException;
import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.model.MatchedRule;
import org.rapidrelief.engine.domain.model.Priority;
import org.rapidrelief.engine.library.RuleLibrary;
import org.rapidrelief.engine.library.RuleLibraryLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleEngineImplTest {

    private RuleEngine ruleEngine;

    @BeforeEach
    void setUp() {
        RuleLibrary library = new RuleLibraryLoader(new ConfigurationLoader()).load("classpath:config/trigger-rules.yaml");
        ruleEngine = new RuleEngineImpl(library);
    }

    @Test
    @DisplayName("matching rules come back sorted by weight, heaviest first")
    void sortsMatchesByWeight() {
        EventContext context = EventContext.of(Map.of(
                "disaster_type", "earthquake",
                "has_trapped", true,
                "affected_population", 250));

        List<MatchedRule> matches = ruleEngine.evaluate(context);

        assertThat(matches).extracting(MatchedRule::getRuleId)
                .containsExactly("TRR-EM-001", "TRR-EM-002", "TRR-EM-005");
        MatchedRule top = matches.get(0);
        assertThat(top.getPriority()).isEqualTo(Priority.CRITICAL);
        assertThat(top.getTaskTypes()).containsExactly("EM06", "EM10", "EM14");
        assertThat(top.getMatchedConditions()).contains("disaster_type == earthquake", "has_trapped == true");
    }

    @Test
    @DisplayName("OR triggers fire on any branch")
    void evaluatesOrConditions() {
        List<MatchedRule> matches = ruleEngine.evaluate(EventContext.of(Map.of(
                "disaster_type", "earthquake",
                "has_secondary_fire", true)));

        assertThat(matches).extracting(MatchedRule::getRuleId)
                .containsExactly("TRR-EM-003", "TRR-EM-002");
    }

    @Test
    @DisplayName("membership comparisons match list values")
    void evaluatesInOperator() {
        List<MatchedRule> matches = ruleEngine.evaluate(EventContext.of(Map.of(
                "disaster_type", "landslide",
                "has_trapped", true)));

        assertThat(matches).extracting(MatchedRule::getRuleId).containsExactly("TRR-EM-006");
    }

    @Test
    @DisplayName("an unmatched event yields no rules and missing fields never match")
    void returnsEmptyForUnmatchedContext() {
        assertThat(ruleEngine.evaluate(EventContext.of(Map.of("disaster_type", "drought")))).isEmpty();
        assertThat(ruleEngine.evaluate(EventContext.empty())).isEmpty();
    }

    @Test
    @DisplayName("evaluation is repeatable")
    void isDeterministic() {
        EventContext context = EventContext.of(Map.of("disaster_type", "earthquake", "has_hazmat_leak", true));

        List<String> first = ruleIds(ruleEngine.evaluate(context));
        List<String> second = ruleIds(ruleEngine.evaluate(context));

        assertThat(second).isEqualTo(first).containsExactly("TRR-EM-004", "TRR-EM-002");
    }

    @Test
    @DisplayName("an empty rule library refuses to start")
    void rejectsEmptyLibrary() {
        assertThatThrownBy(() -> new RuleEngineImpl(new RuleLibrary("1.0", List.of())))
                .isInstanceOf(RuleLoadException.class);
    }

    @Test
    @DisplayName("an empty or missing rule document is a load failure")
    void rejectsEmptyOrMissingRuleSource() {
        RuleLibraryLoader loader = new RuleLibraryLoader(new ConfigurationLoader());

        assertThatThrownBy(() -> loader.load("classpath:fixtures/empty-rules.yaml"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("no rules defined");
        assertThatThrownBy(() -> loader.load("classpath:fixtures/does-not-exist.yaml"))
                .isInstanceOf(RuleLoadException.class);
    }

    private static List<String> ruleIds(List<MatchedRule> matches) {
        return matches.stream().map(MatchedRule::getRuleId).collect(Collectors.toList());
    }
}
