package org.rapidrelief.engine.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventContextTest {

    @Test
    @DisplayName("nested maps with non-text keys are addressable by their text form")
    void nestedKeysBecomeText() {
        Map<Object, Object> floors = new HashMap<>();
        floors.put(3, "collapsed");
        Map<String, Object> building = new HashMap<>();
        building.put("floors", floors);
        Map<String, Object> values = new HashMap<>();
        values.put("building", building);

        EventContext context = EventContext.of(values);

        assertThat(context.resolve("building.floors.3")).contains("collapsed");
        assertThat(context.resolve("building.floors.4")).isEmpty();
        assertThat(context.resolve("building.height")).isEmpty();
    }

    @Test
    @DisplayName("the context is a frozen copy of its input")
    void contextIsFrozenCopy() {
        List<Object> hazards = new ArrayList<>();
        hazards.add("gas");
        Map<String, Object> values = new HashMap<>();
        values.put("hazards", hazards);

        EventContext context = EventContext.of(values);
        hazards.add("fire");
        values.put("disaster_type", "flood");

        assertThat(context.resolve("hazards")).contains(List.of("gas"));
        assertThat(context.resolve("disaster_type")).isEmpty();
        assertThatThrownBy(() -> context.getValues().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
