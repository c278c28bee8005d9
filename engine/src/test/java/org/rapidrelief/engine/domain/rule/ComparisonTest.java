package org.rapidrelief.engine.domain.rule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rapidrelief.engine.domain.model.EventContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparisonTest {

    private static EventContext context() {
        Map<String, Object> location = new HashMap<>();
        location.put("district", "Wenchuan");
        Map<String, Object> values = new HashMap<>();
        values.put("disaster_type", "earthquake");
        values.put("magnitude", 6.8);
        values.put("affected_population", 1200);
        values.put("has_trapped", true);
        values.put("hazards", Arrays.asList("aftershock", "gas_leak"));
        values.put("location", location);
        return EventContext.of(values);
    }

    @Test
    @DisplayName("numbers compare across integer and decimal representations")
    void numericComparisons() {
        EventContext ctx = context();

        assertThat(new Comparison("magnitude", ComparisonOperator.GTE, 6.8).evaluate(ctx)).isTrue();
        assertThat(new Comparison("magnitude", ComparisonOperator.GT, 7).evaluate(ctx)).isFalse();
        assertThat(new Comparison("affected_population", ComparisonOperator.EQ, 1200.0).evaluate(ctx)).isTrue();
        assertThat(new Comparison("affected_population", ComparisonOperator.LT, "1500").evaluate(ctx)).isTrue();
    }

    @Test
    @DisplayName("booleans match their string form case-insensitively")
    void booleanEquality() {
        assertThat(new Comparison("has_trapped", ComparisonOperator.EQ, true).evaluate(context())).isTrue();
        assertThat(new Comparison("has_trapped", ComparisonOperator.EQ, "TRUE").evaluate(context())).isTrue();
        assertThat(new Comparison("has_trapped", ComparisonOperator.NE, false).evaluate(context())).isTrue();
    }

    @Test
    @DisplayName("membership operators work on lists in either position")
    void membership() {
        EventContext ctx = context();

        assertThat(new Comparison("disaster_type", ComparisonOperator.IN,
                Arrays.asList("flood", "earthquake")).evaluate(ctx)).isTrue();
        assertThat(new Comparison("disaster_type", ComparisonOperator.NOT_IN,
                Arrays.asList("flood", "landslide")).evaluate(ctx)).isTrue();
        assertThat(new Comparison("hazards", ComparisonOperator.CONTAINS, "gas_leak").evaluate(ctx)).isTrue();
        assertThat(new Comparison("disaster_type", ComparisonOperator.CONTAINS, "quake").evaluate(ctx)).isTrue();
    }

    @Test
    @DisplayName("dotted paths reach nested values and regex uses find semantics")
    void nestedPathAndRegex() {
        assertThat(new Comparison("location.district", ComparisonOperator.REGEX, "^Wen").evaluate(context())).isTrue();
        assertThat(new Comparison("location.city", ComparisonOperator.EQ, "Chengdu").evaluate(context())).isFalse();
    }

    @Test
    @DisplayName("missing fields and incomparable operands evaluate to false without throwing")
    void missingAndMistypedFields() {
        EventContext ctx = context();

        assertThat(new Comparison("wind_speed", ComparisonOperator.GT, 10).evaluate(ctx)).isFalse();
        assertThat(new Comparison("disaster_type", ComparisonOperator.GT, 3).evaluate(ctx)).isFalse();
        assertThat(new Comparison("disaster_type", ComparisonOperator.IN, "earthquake").evaluate(ctx)).isFalse();
        assertThat(new Comparison("magnitude", ComparisonOperator.REGEX, "6").evaluate(ctx)).isFalse();
    }

    @Test
    @DisplayName("symbolic operator codes are accepted and unknown codes are rejected")
    void operatorCodes() {
        assertThat(ComparisonOperator.fromCode(">=")).isEqualTo(ComparisonOperator.GTE);
        assertThat(ComparisonOperator.fromCode(" Not_In ")).isEqualTo(ComparisonOperator.NOT_IN);
        assertThat(ComparisonOperator.fromCode("==")).isEqualTo(ComparisonOperator.EQ);
        assertThatThrownBy(() -> ComparisonOperator.fromCode("between"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Comparison("name", ComparisonOperator.REGEX, "[unclosed"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("combinators evaluate their children and collect the leaves that matched")
    void combinators() {
        EventContext ctx = context();
        Condition quake = new Comparison("disaster_type", ComparisonOperator.EQ, "earthquake");
        Condition flood = new Comparison("disaster_type", ComparisonOperator.EQ, "flood");
        Condition trapped = new Comparison("has_trapped", ComparisonOperator.EQ, true);

        assertThat(new AllOf(Arrays.asList(quake, trapped)).evaluate(ctx)).isTrue();
        assertThat(new AllOf(Arrays.asList(quake, flood)).evaluate(ctx)).isFalse();
        assertThat(new AnyOf(Arrays.asList(flood, trapped)).evaluate(ctx)).isTrue();

        List<String> matches = new ArrayList<>();
        new AnyOf(Arrays.asList(flood, trapped, quake)).collectMatches(ctx, matches);
        assertThat(matches).containsExactly("has_trapped == true", "disaster_type == earthquake");
    }
}
