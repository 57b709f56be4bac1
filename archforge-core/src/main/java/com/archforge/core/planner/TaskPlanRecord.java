package com.archforge.core.planner;

import com.archforge.core.model.MethodSpec;
import com.archforge.core.registry.MethodSignature;
import com.archforge.core.registry.SymbolRegistry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Machine-readable record of a task plan, written as {@code task-plan.json} for audit and replay.
 *
 * @param projectId project the plan belongs to
 * @param createdAt creation timestamp (ISO-8601)
 * @param summary task counts
 * @param tasks per-task details in discovery order
 * @param taskDag dependency graph
 * @param generationOrder computed order
 * @param cycles cycle paths
 * @param blocked tasks excluded because they depend on a cycle
 * @param warnings planning warnings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskPlanRecord(
    @JsonProperty("projectId") String projectId,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("summary") Summary summary,
    @JsonProperty("tasks") List<TaskEntry> tasks,
    @JsonProperty("taskDAG") Map<String, List<String>> taskDag,
    @JsonProperty("generationOrder") List<String> generationOrder,
    @JsonProperty("cycles") List<List<String>> cycles,
    @JsonProperty("blocked") List<String> blocked,
    @JsonProperty("warnings") List<String> warnings
) {
    /**
     * Plan summary.
     *
     * @param totalTasks number of planned tasks
     * @param schedulableTasks number of tasks in the generation order
     * @param tasksByCategory task count per category
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Summary(
        @JsonProperty("totalTasks") int totalTasks,
        @JsonProperty("schedulableTasks") int schedulableTasks,
        @JsonProperty("tasksByCategory") Map<String, Integer> tasksByCategory
    ) {}

    /**
     * One planned task.
     *
     * @param id task id
     * @param category task category
     * @param kind task kind
     * @param owner unit the task generates, null for project-level tasks
     * @param filePath artifact path
     * @param folderPath directory of the artifact
     * @param dependencies task dependencies
     * @param priority advisory priority
     * @param description summary
     * @param methodSignatures owner's method signatures at planning time
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskEntry(
        @JsonProperty("id") String id,
        @JsonProperty("category") String category,
        @JsonProperty("kind") String kind,
        @JsonProperty("owner") String owner,
        @JsonProperty("filePath") String filePath,
        @JsonProperty("folderPath") String folderPath,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("priority") int priority,
        @JsonProperty("description") String description,
        @JsonProperty("methodSignatures") List<String> methodSignatures
    ) {}

    /**
     * Builds the record of a plan.
     *
     * @param projectId project id
     * @param plan task plan
     * @param registry registry holding the owners' signatures
     * @return plan record
     */
    public static TaskPlanRecord of(String projectId, TaskPlan plan, SymbolRegistry registry) {
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        plan.countByCategory().forEach((category, count) -> byCategory.put(category.name().toLowerCase(Locale.ROOT), count));

        List<TaskEntry> entries = plan.tasks().stream()
            .map(task -> new TaskEntry(
                task.id(),
                task.category().name().toLowerCase(Locale.ROOT),
                task.kind().name().toLowerCase(Locale.ROOT),
                task.unitName(),
                task.filePath(),
                folderOf(task.filePath()),
                task.dependencies(),
                task.priority(),
                task.description(),
                task.hasUnit() ? signaturesOf(task.unitName(), registry) : List.of()
            ))
            .toList();

        return new TaskPlanRecord(
            projectId,
            Instant.now().toString(),
            new Summary(plan.tasks().size(), plan.order().size(), byCategory),
            entries,
            plan.dag(),
            plan.order(),
            plan.cycles().stream().map(PlanningCycle::path).toList(),
            plan.blocked().stream().sorted().toList(),
            plan.warnings()
        );
    }

    private static List<String> signaturesOf(String unitName, SymbolRegistry registry) {
        return registry.methodSignatures(unitName).stream()
            .map(MethodSignature::toMethodSpec)
            .map(MethodSpec::signature)
            .toList();
    }

    private static String folderOf(String filePath) {
        int slash = filePath.lastIndexOf('/');
        return slash < 0 ? "" : filePath.substring(0, slash);
    }
}
