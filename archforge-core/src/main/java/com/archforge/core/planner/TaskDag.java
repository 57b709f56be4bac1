package com.archforge.core.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency graph over task ids, {@code task -> tasks it depends on}.
 *
 * <p>Insertion order of tasks and of each task's edges is preserved; the sorter
 * relies on it for its stable tie-break.
 */
public class TaskDag {

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    /**
     * Adds a task node.
     *
     * @param taskId task id
     * @return true if the task was not present
     */
    public boolean addTask(String taskId) {
        if (edges.containsKey(taskId)) {
            return false;
        }
        edges.put(taskId, new LinkedHashSet<>());
        return true;
    }

    /**
     * Adds an edge {@code from depends on to}.
     *
     * @param from dependent task
     * @param to dependency
     * @return true if the edge is new; false for unknown endpoints, self loops and duplicates
     */
    public boolean addEdge(String from, String to) {
        if (!edges.containsKey(from) || !edges.containsKey(to) || from.equals(to)) {
            return false;
        }
        return edges.get(from).add(to);
    }

    public boolean contains(String taskId) {
        return edges.containsKey(taskId);
    }

    /**
     * Returns the dependencies of a task in insertion order.
     *
     * @param taskId task id
     * @return dependencies, empty for unknown tasks
     */
    public List<String> dependenciesOf(String taskId) {
        return new ArrayList<>(edges.getOrDefault(taskId, Set.of()));
    }

    /**
     * Returns the tasks directly depending on a task.
     *
     * @param taskId task id
     * @return dependents in insertion order
     */
    public List<String> dependentsOf(String taskId) {
        List<String> dependents = new ArrayList<>();
        edges.forEach((id, deps) -> {
            if (deps.contains(taskId)) {
                dependents.add(id);
            }
        });
        return dependents;
    }

    public List<String> taskIds() {
        return new ArrayList<>(edges.keySet());
    }

    public int size() {
        return edges.size();
    }

    /**
     * Returns an immutable snapshot of the adjacency map.
     *
     * @return task id to dependency ids, insertion ordered
     */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> snapshot = new LinkedHashMap<>();
        edges.forEach((id, deps) -> snapshot.put(id, List.copyOf(deps)));
        return Collections.unmodifiableMap(snapshot);
    }
}
