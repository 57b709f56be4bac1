package com.archforge.core.planner;

import java.util.List;
import java.util.Objects;

/**
 * One unit of generation work producing exactly one artifact.
 *
 * @param id stable task id (e.g. {@code backend_service_OrderService})
 * @param kind artifact flavour; determines {@link #category()}
 * @param unitName model unit the task generates, null for project-level tasks
 * @param filePath output-root relative artifact path
 * @param dependencies ids of tasks that must be generated first
 * @param priority advisory priority, never used for ordering
 * @param description human-readable summary
 */
public record Task(
    String id,
    TaskKind kind,
    String unitName,
    String filePath,
    List<String> dependencies,
    int priority,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public Task {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (description == null) {
            description = "";
        }
    }

    public TaskCategory category() {
        return kind.category();
    }

    public boolean hasUnit() {
        return unitName != null;
    }

    /**
     * Returns a copy carrying the given dependency list.
     *
     * @param newDependencies replacement dependencies
     * @return updated task
     */
    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, kind, unitName, filePath, newDependencies, priority, description);
    }
}
