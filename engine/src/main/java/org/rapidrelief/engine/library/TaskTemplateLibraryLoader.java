package org.rapidrelief.engine.library;

import com.fasterxml.jackson.databind.JsonNode;
import org.rapidrelief.engine.config.ConfigurationLoader;
import org.rapidrelief.engine.domain.exception.ConfigurationException;
import org.rapidrelief.engine.domain.model.TaskDependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads the task template document ({@code meta_tasks} and {@code scenes}).
 * Every task a scene lists must be a declared meta-task.
 */
public final class TaskTemplateLibraryLoader {

    private static final Logger LOG = Logger.getLogger(TaskTemplateLibraryLoader.class.getName());

    private final ConfigurationLoader configurationLoader;

    public TaskTemplateLibraryLoader(ConfigurationLoader configurationLoader) {
        this.configurationLoader = Objects.requireNonNull(configurationLoader, "configurationLoader must not be null");
    }

    public TaskTemplateLibrary load(String location) {
        JsonNode root = configurationLoader.load(location);
        try {
            Map<String, MetaTaskDefinition> metaTasks = parseMetaTasks(Documents.requireObject(root, "meta_tasks"));
            Map<String, SceneTemplate> scenes = parseScenes(Documents.requireObject(root, "scenes"), metaTasks);
            LOG.info(() -> String.format("Loaded %d meta-tasks and %d scene templates from %s",
                    metaTasks.size(), scenes.size(), location));
            return new TaskTemplateLibrary(metaTasks, scenes);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid task templates in " + location + ": " + e.getMessage(), e);
        }
    }

    private Map<String, MetaTaskDefinition> parseMetaTasks(JsonNode node) {
        Map<String, MetaTaskDefinition> metaTasks = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode body = entry.getValue();
            Double goldenHour = Documents.number(body, "golden_hour_minutes");
            metaTasks.put(entry.getKey(), new MetaTaskDefinition(
                    entry.getKey(),
                    Documents.text(body, "name"),
                    Documents.text(body, "phase"),
                    goldenHour != null ? goldenHour.intValue() : null,
                    new LinkedHashSet<>(Documents.textList(body, "required_capabilities")),
                    Documents.dependencies(body.get("depends_on"))));
        }
        return metaTasks;
    }

    private Map<String, SceneTemplate> parseScenes(JsonNode node, Map<String, MetaTaskDefinition> metaTasks) {
        Map<String, SceneTemplate> scenes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String sceneCode = entry.getKey();
            JsonNode body = entry.getValue();

            List<String> tasks = Documents.textList(body, "tasks");
            for (String task : tasks) {
                if (!metaTasks.containsKey(task)) {
                    throw new IllegalArgumentException("scene " + sceneCode + " lists unknown task " + task);
                }
            }

            Map<String, List<TaskDependency>> dependencies = new LinkedHashMap<>();
            JsonNode dependencyNode = body.get("dependencies");
            if (dependencyNode != null && !dependencyNode.isNull()) {
                Iterator<Map.Entry<String, JsonNode>> edges = dependencyNode.fields();
                while (edges.hasNext()) {
                    Map.Entry<String, JsonNode> edge = edges.next();
                    dependencies.put(edge.getKey(), Documents.dependencies(edge.getValue()));
                }
            }

            List<List<String>> groups = new ArrayList<>();
            JsonNode groupNode = body.get("parallel_groups");
            if (groupNode != null && groupNode.isArray()) {
                for (JsonNode group : groupNode) {
                    List<String> members = new ArrayList<>();
                    for (JsonNode member : group) {
                        members.add(member.asText().trim());
                    }
                    groups.add(members);
                }
            }

            scenes.put(sceneCode, new SceneTemplate(sceneCode, Documents.text(body, "chain_name"),
                    tasks, dependencies, groups.isEmpty() ? Collections.emptyList() : groups));
        }
        return scenes;
    }
}
