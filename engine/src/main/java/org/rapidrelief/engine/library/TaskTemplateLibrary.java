package org.rapidrelief.engine.library;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup of meta-tasks and scene templates, both in declaration order.
 */
public final class TaskTemplateLibrary {

    private final Map<String, MetaTaskDefinition> metaTasks;
    private final Map<String, SceneTemplate> scenes;

    public TaskTemplateLibrary(Map<String, MetaTaskDefinition> metaTasks, Map<String, SceneTemplate> scenes) {
        this.metaTasks = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(metaTasks, "metaTasks must not be null")));
        this.scenes = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(scenes, "scenes must not be null")));
    }

    public Optional<MetaTaskDefinition> findMetaTask(String code) {
        return Optional.ofNullable(metaTasks.get(code));
    }

    public Optional<SceneTemplate> findScene(String sceneCode) {
        return Optional.ofNullable(scenes.get(sceneCode));
    }

    public Map<String, MetaTaskDefinition> getMetaTasks() {
        return metaTasks;
    }

    public Map<String, SceneTemplate> getScenes() {
        return scenes;
    }
}
