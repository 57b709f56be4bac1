package com.archforge.core.planner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Output of the task planner.
 *
 * @param tasks all tasks in discovery order, with their final dependency lists
 * @param dag dependency graph snapshot
 * @param order ids in generation order; excludes cyclic and blocked tasks
 * @param cycles detected cycles
 * @param blocked tasks excluded because they depend on a cycle
 * @param warnings non-fatal planning findings such as dropped edges
 */
public record TaskPlan(
    List<Task> tasks,
    Map<String, List<String>> dag,
    List<String> order,
    List<PlanningCycle> cycles,
    Set<String> blocked,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public TaskPlan {
        Objects.requireNonNull(tasks, "tasks must not be null");
        tasks = List.copyOf(tasks);
        dag = dag == null ? Map.of() : dag;
        order = order == null ? List.of() : List.copyOf(order);
        cycles = cycles == null ? List.of() : List.copyOf(cycles);
        blocked = blocked == null ? Set.of() : Set.copyOf(blocked);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns the schedulable tasks in generation order.
     *
     * @return ordered tasks
     */
    public List<Task> orderedTasks() {
        Map<String, Task> byId = new LinkedHashMap<>();
        tasks.forEach(t -> byId.put(t.id(), t));
        return order.stream().map(byId::get).toList();
    }

    public Optional<Task> findTask(String id) {
        return tasks.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    /**
     * Counts tasks per category.
     *
     * @return category to task count, in enum order
     */
    public Map<TaskCategory, Integer> countByCategory() {
        Map<TaskCategory, Integer> counts = new LinkedHashMap<>();
        for (TaskCategory category : TaskCategory.values()) {
            counts.put(category, (int) tasks.stream().filter(t -> t.category() == category).count());
        }
        return counts;
    }
}
