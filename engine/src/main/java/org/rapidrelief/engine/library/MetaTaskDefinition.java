package org.rapidrelief.engine.library;

import org.rapidrelief.engine.domain.model.TaskDependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reusable task definition shared by scene templates.
 */
public final class MetaTaskDefinition {

    private final String code;
    private final String name;
    private final String phase;
    private final Integer goldenHourMinutes;
    private final Set<String> requiredCapabilities;
    private final List<TaskDependency> dependencies;

    public MetaTaskDefinition(String code, String name, String phase, Integer goldenHourMinutes,
                              Set<String> requiredCapabilities, List<TaskDependency> dependencies) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.name = name != null ? name : code;
        this.phase = phase;
        this.goldenHourMinutes = goldenHourMinutes;
        this.requiredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities));
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getPhase() {
        return phase;
    }

    public Integer getGoldenHourMinutes() {
        return goldenHourMinutes;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public List<TaskDependency> getDependencies() {
        return dependencies;
    }
}
