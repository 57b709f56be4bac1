package com.archforge.core.planner;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A dependency cycle found while ordering tasks.
 *
 * @param path task ids along the cycle, first and last element equal (A, B, C, A)
 */
public record PlanningCycle(List<String> path) {

    /**
     * Compact constructor with validation.
     */
    public PlanningCycle {
        if (path == null || path.size() < 2) {
            throw new IllegalArgumentException("cycle path must contain at least two entries");
        }
        path = List.copyOf(path);
    }

    /**
     * Returns the distinct tasks on the cycle.
     *
     * @return member task ids in path order
     */
    public Set<String> members() {
        return new LinkedHashSet<>(path.subList(0, path.size() - 1));
    }

    public String describe() {
        return String.join(" -> ", path);
    }
}
