package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.exception.CyclicDependencyException;
import org.rapidrelief.engine.domain.exception.InvalidParallelGroupException;
import org.rapidrelief.engine.domain.model.DecompositionResult;
import org.rapidrelief.engine.domain.model.Requirement;
import org.rapidrelief.engine.domain.model.TaskDependency;
import org.rapidrelief.engine.domain.model.TaskNode;
import org.rapidrelief.engine.domain.model.Violation;
import org.rapidrelief.engine.library.MetaTaskDefinition;
import org.rapidrelief.engine.library.SceneTemplate;
import org.rapidrelief.engine.library.TaskTemplateLibrary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Template-driven task decomposition.
 * <ol>
 *   <li>Union the task sets of all scene templates, then add requirement task types
 *       that name a known meta-task.</li>
 *   <li>Merge dependency edges from meta-tasks and every scene; an edge declared twice
 *       is kept once and is strict if any declaration is.</li>
 *   <li>Edges to tasks outside the graph are dropped and reported.</li>
 *   <li>Kahn's algorithm with ties broken by insertion order; leftover nodes mean a cycle.</li>
 *   <li>Parallel groups come from scene hints, validated against the transitive
 *       dependency closure, or are derived from topological levels when no scene has hints.</li>
 * </ol>
 */
public final class TaskDecomposerImpl implements TaskDecomposer {

    private static final Logger LOG = Logger.getLogger(TaskDecomposerImpl.class.getName());

    private final TaskTemplateLibrary library;

    public TaskDecomposerImpl(TaskTemplateLibrary library) {
        this.library = Objects.requireNonNull(library, "library must not be null");
    }

    @Override
    public DecompositionResult decompose(List<Requirement> requirements, List<String> sceneCodes) {
        Objects.requireNonNull(requirements, "requirements must not be null");
        Objects.requireNonNull(sceneCodes, "sceneCodes must not be null");

        List<Violation> violations = new ArrayList<>();
        List<SceneTemplate> scenes = resolveScenes(sceneCodes, violations);
        Map<String, Integer> insertionOrder = collectTasks(scenes, requirements, violations);
        Map<String, Map<String, TaskDependency>> edges = mergeEdges(insertionOrder.keySet(), scenes);

        Map<String, List<TaskDependency>> graphEdges = new LinkedHashMap<>();
        for (String task : insertionOrder.keySet()) {
            List<TaskDependency> kept = new ArrayList<>();
            for (TaskDependency dependency : edges.getOrDefault(task, new LinkedHashMap<>()).values()) {
                if (insertionOrder.containsKey(dependency.getTaskCode())) {
                    kept.add(dependency);
                } else {
                    violations.add(missingDependency(task, dependency));
                }
            }
            graphEdges.put(task, kept);
        }

        List<String> order = topologicalSort(insertionOrder, graphEdges);
        List<TaskNode> sequence = new ArrayList<>(order.size());
        for (String task : order) {
            sequence.add(buildNode(task, graphEdges.get(task)));
        }

        List<Set<String>> parallelGroups = resolveParallelGroups(scenes, order, graphEdges);

        DecompositionResult result = new DecompositionResult(sequence, parallelGroups, violations);
        LOG.info(() -> String.format("Decomposed %d requirements over scenes %s into %d tasks, %d parallel groups, %d violations",
                requirements.size(), sceneCodes, sequence.size(), parallelGroups.size(), violations.size()));
        return result;
    }

    private List<SceneTemplate> resolveScenes(List<String> sceneCodes, List<Violation> violations) {
        List<SceneTemplate> scenes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String code : sceneCodes) {
            if (!seen.add(code)) {
                continue;
            }
            Optional<SceneTemplate> scene = library.findScene(code);
            if (scene.isPresent()) {
                scenes.add(scene.get());
            } else {
                LOG.warning(() -> "No task template for scene " + code);
                violations.add(Violation.warning(Violation.UNKNOWN_SCENE, "No task template for scene " + code));
            }
        }
        return scenes;
    }

    private Map<String, Integer> collectTasks(List<SceneTemplate> scenes, List<Requirement> requirements,
                                              List<Violation> violations) {
        Map<String, Integer> insertionOrder = new LinkedHashMap<>();
        for (SceneTemplate scene : scenes) {
            for (String task : scene.getTasks()) {
                insertionOrder.putIfAbsent(task, insertionOrder.size());
            }
        }
        for (Requirement requirement : requirements) {
            String taskType = requirement.getTaskType();
            if (insertionOrder.containsKey(taskType)) {
                continue;
            }
            if (library.findMetaTask(taskType).isPresent()) {
                insertionOrder.put(taskType, insertionOrder.size());
            } else {
                violations.add(Violation.warning(Violation.UNKNOWN_TASK_TYPE,
                        "Required task type " + taskType + " has no task template"));
            }
        }
        return insertionOrder;
    }

    private Map<String, Map<String, TaskDependency>> mergeEdges(Set<String> tasks, List<SceneTemplate> scenes) {
        Map<String, Map<String, TaskDependency>> edges = new LinkedHashMap<>();
        for (String task : tasks) {
            Map<String, TaskDependency> merged = new LinkedHashMap<>();
            library.findMetaTask(task).ifPresent(meta -> addEdges(merged, meta.getDependencies()));
            for (SceneTemplate scene : scenes) {
                List<TaskDependency> sceneEdges = scene.getDependencies().get(task);
                if (sceneEdges != null) {
                    addEdges(merged, sceneEdges);
                }
            }
            merged.remove(task);
            edges.put(task, merged);
        }
        return edges;
    }

    private static void addEdges(Map<String, TaskDependency> merged, List<TaskDependency> declared) {
        for (TaskDependency dependency : declared) {
            merged.merge(dependency.getTaskCode(), dependency, TaskDependency::merge);
        }
    }

    private static Violation missingDependency(String task, TaskDependency dependency) {
        String message = String.format("Task %s depends on %s, which is not part of the task sequence",
                task, dependency.getTaskCode());
        return dependency.isStrict()
                ? Violation.strict(Violation.MISSING_STRICT_DEPENDENCY, message)
                : Violation.warning(Violation.MISSING_DEPENDENCY, message);
    }

    private List<String> topologicalSort(Map<String, Integer> insertionOrder,
                                         Map<String, List<TaskDependency>> graphEdges) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String task : insertionOrder.keySet()) {
            inDegree.put(task, graphEdges.get(task).size());
            for (TaskDependency dependency : graphEdges.get(task)) {
                dependents.computeIfAbsent(dependency.getTaskCode(), k -> new ArrayList<>()).add(task);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(insertionOrder::get));
        for (String task : insertionOrder.keySet()) {
            if (inDegree.get(task) == 0) {
                ready.add(task);
            }
        }

        List<String> order = new ArrayList<>(insertionOrder.size());
        while (!ready.isEmpty()) {
            String task = ready.poll();
            order.add(task);
            for (String dependent : dependents.getOrDefault(task, new ArrayList<>())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != insertionOrder.size()) {
            List<String> unresolved = new ArrayList<>();
            for (String task : insertionOrder.keySet()) {
                if (!order.contains(task)) {
                    unresolved.add(task);
                }
            }
            LOG.severe(() -> "Cyclic task dependencies among " + unresolved);
            throw new CyclicDependencyException(unresolved);
        }
        return order;
    }

    private TaskNode buildNode(String task, List<TaskDependency> dependencies) {
        TaskNode.Builder builder = new TaskNode.Builder()
                .taskCode(task)
                .dependencies(dependencies);
        Optional<MetaTaskDefinition> meta = library.findMetaTask(task);
        if (meta.isPresent()) {
            builder.name(meta.get().getName())
                    .phase(meta.get().getPhase())
                    .goldenHourMinutes(meta.get().getGoldenHourMinutes())
                    .requiredCapabilities(meta.get().getRequiredCapabilities());
        }
        return builder.build();
    }

    private List<Set<String>> resolveParallelGroups(List<SceneTemplate> scenes, List<String> order,
                                                    Map<String, List<TaskDependency>> graphEdges) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i), i);
        }
        Map<String, Set<String>> ancestors = computeAncestors(order, graphEdges);

        boolean hinted = false;
        List<Set<String>> groups = new ArrayList<>();
        for (SceneTemplate scene : scenes) {
            for (List<String> hint : scene.getParallelGroups()) {
                hinted = true;
                Set<String> group = new LinkedHashSet<>();
                hint.stream()
                        .filter(position::containsKey)
                        .sorted(Comparator.comparingInt(position::get))
                        .forEach(group::add);
                if (group.size() < 2 || groups.contains(group)) {
                    continue;
                }
                validateGroup(group, ancestors);
                groups.add(group);
            }
        }
        if (hinted) {
            return groups;
        }
        return levelGroups(order, graphEdges);
    }

    private static Map<String, Set<String>> computeAncestors(List<String> order,
                                                             Map<String, List<TaskDependency>> graphEdges) {
        Map<String, Set<String>> ancestors = new HashMap<>();
        for (String task : order) {
            Set<String> all = new HashSet<>();
            for (TaskDependency dependency : graphEdges.get(task)) {
                all.add(dependency.getTaskCode());
                all.addAll(ancestors.get(dependency.getTaskCode()));
            }
            ancestors.put(task, all);
        }
        return ancestors;
    }

    private static void validateGroup(Set<String> group, Map<String, Set<String>> ancestors) {
        for (String member : group) {
            for (String other : group) {
                if (!member.equals(other) && ancestors.get(member).contains(other)) {
                    throw new InvalidParallelGroupException(group, member, other);
                }
            }
        }
    }

    private static List<Set<String>> levelGroups(List<String> order, Map<String, List<TaskDependency>> graphEdges) {
        Map<String, Integer> levels = new HashMap<>();
        Map<Integer, Set<String>> byLevel = new LinkedHashMap<>();
        for (String task : order) {
            int level = 0;
            for (TaskDependency dependency : graphEdges.get(task)) {
                level = Math.max(level, levels.get(dependency.getTaskCode()) + 1);
            }
            levels.put(task, level);
            byLevel.computeIfAbsent(level, k -> new LinkedHashSet<>()).add(task);
        }
        List<Set<String>> groups = new ArrayList<>();
        byLevel.keySet().stream().sorted().forEach(level -> {
            Set<String> group = byLevel.get(level);
            if (group.size() >= 2) {
                groups.add(group);
            }
        });
        return groups;
    }
}
