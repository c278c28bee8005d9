package org.rapidrelief.engine.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rapidrelief.engine.domain.model.EventContext;
import org.rapidrelief.engine.domain.rule.AllOf;
import org.rapidrelief.engine.domain.rule.AnyOf;
import org.rapidrelief.engine.domain.rule.Comparison;
import org.rapidrelief.engine.domain.rule.Condition;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionParserTest {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @Test
    @DisplayName("logic/conditions defaults to AND and accepts OR")
    void logicShape() throws Exception {
        Condition and = ConditionParser.parse(yaml("conditions:\n"
                + "  - {field: disaster_type, operator: eq, value: earthquake}\n"
                + "  - {field: magnitude, operator: gte, value: 6}\n"));
        Condition or = ConditionParser.parse(yaml("logic: or\n"
                + "conditions:\n"
                + "  - {field: disaster_type, operator: eq, value: fire}\n"
                + "  - {field: has_secondary_fire, operator: eq, value: true}\n"));

        assertThat(and).isInstanceOf(AllOf.class);
        assertThat(or).isInstanceOf(AnyOf.class);
        assertThat(and.evaluate(event())).isTrue();
        assertThat(or.evaluate(event())).isTrue();
    }

    @Test
    @DisplayName("all/any nest to any depth")
    void nestedShapes() throws Exception {
        Condition condition = ConditionParser.parse(yaml("all:\n"
                + "  - {field: disaster_type, operator: in, value: [flood, earthquake]}\n"
                + "  - any:\n"
                + "      - {field: has_trapped, operator: eq, value: false}\n"
                + "      - {field: magnitude, operator: gt, value: 6.5}\n"));

        assertThat(condition.describe())
                .isEqualTo("(disaster_type in [flood, earthquake] AND (has_trapped == false OR magnitude > 6.5))");
        assertThat(condition.evaluate(event())).isTrue();
    }

    @Test
    @DisplayName("a bare leaf is a single comparison")
    void leafShape() throws Exception {
        Condition leaf = ConditionParser.parse(yaml("{field: affected_population, operator: \">=\", value: 100}"));

        assertThat(leaf).isInstanceOf(Comparison.class);
        assertThat(leaf.evaluate(event())).isTrue();
    }

    @Test
    @DisplayName("malformed conditions are rejected")
    void malformedConditions() {
        assertThatThrownBy(() -> ConditionParser.parse(yaml("logic: XOR\nconditions: [{field: a, operator: eq, value: 1}]")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("XOR");
        assertThatThrownBy(() -> ConditionParser.parse(yaml("all: []")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConditionParser.parse(yaml("{field: a, operator: eq}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no value");
        assertThatThrownBy(() -> ConditionParser.parse(yaml("- a\n- b\n")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static JsonNode yaml(String text) throws Exception {
        return YAML.readTree(text);
    }

    private static EventContext event() {
        Map<String, Object> values = new HashMap<>();
        values.put("disaster_type", "earthquake");
        values.put("magnitude", 7.1);
        values.put("affected_population", 450);
        values.put("has_trapped", true);
        values.put("has_secondary_fire", true);
        return EventContext.of(values);
    }
}
