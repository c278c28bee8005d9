package org.rapidrelief.engine.library;

import org.rapidrelief.engine.domain.model.TaskDependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Task chain for one scene code: tasks in insertion order, scene-specific
 * dependency edges and parallel-group hints.
 */
public final class SceneTemplate {

    private final String sceneCode;
    private final String chainName;
    private final List<String> tasks;
    private final Map<String, List<TaskDependency>> dependencies;
    private final List<List<String>> parallelGroups;

    public SceneTemplate(String sceneCode, String chainName, List<String> tasks,
                         Map<String, List<TaskDependency>> dependencies, List<List<String>> parallelGroups) {
        this.sceneCode = Objects.requireNonNull(sceneCode, "sceneCode must not be null");
        this.chainName = chainName != null ? chainName : sceneCode;
        this.tasks = Collections.unmodifiableList(new ArrayList<>(tasks));
        Map<String, List<TaskDependency>> edges = new LinkedHashMap<>();
        for (Map.Entry<String, List<TaskDependency>> entry : dependencies.entrySet()) {
            edges.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.dependencies = Collections.unmodifiableMap(edges);
        List<List<String>> groups = new ArrayList<>();
        for (List<String> group : parallelGroups) {
            groups.add(Collections.unmodifiableList(new ArrayList<>(group)));
        }
        this.parallelGroups = Collections.unmodifiableList(groups);
    }

    public String getSceneCode() {
        return sceneCode;
    }

    public String getChainName() {
        return chainName;
    }

    public List<String> getTasks() {
        return tasks;
    }

    public Map<String, List<TaskDependency>> getDependencies() {
        return dependencies;
    }

    public List<List<String>> getParallelGroups() {
        return parallelGroups;
    }
}
