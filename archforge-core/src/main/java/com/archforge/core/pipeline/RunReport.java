package com.archforge.core.pipeline;

import com.archforge.core.run.RunContext;
import com.archforge.core.run.RunIssue;
import com.archforge.core.run.RunPhase;
import com.archforge.core.run.Severity;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Final outcome of a run.
 *
 * @param runId run identifier
 * @param projectId project identifier
 * @param phase terminal phase
 * @param generationOrder task ids in the order they were scheduled
 * @param artifactPaths output-relative paths written
 * @param stubbedTasks tasks whose artifact is a stub
 * @param cycles planning cycles, described as {@code A -> B -> A}
 * @param issues every finding recorded during the run
 * @param deploymentUrl deployed URL, null when nothing was deployed
 * @param elapsed wall-clock duration
 */
public record RunReport(
    String runId,
    String projectId,
    RunPhase phase,
    List<String> generationOrder,
    List<String> artifactPaths,
    List<String> stubbedTasks,
    List<String> cycles,
    List<RunIssue> issues,
    String deploymentUrl,
    Duration elapsed
) {
    /**
     * Compact constructor with validation.
     */
    public RunReport {
        generationOrder = generationOrder == null ? List.of() : List.copyOf(generationOrder);
        artifactPaths = artifactPaths == null ? List.of() : List.copyOf(artifactPaths);
        stubbedTasks = stubbedTasks == null ? List.of() : List.copyOf(stubbedTasks);
        cycles = cycles == null ? List.of() : List.copyOf(cycles);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Builds the report from a finished run context.
     *
     * @param context run context
     * @return run report
     */
    public static RunReport from(RunContext context) {
        return new RunReport(
            context.runId(),
            context.projectId(),
            context.phase(),
            context.generationOrder(),
            context.artifactPaths(),
            context.stubbedTasks(),
            context.cycles(),
            context.issues(),
            context.deploymentUrl().orElse(null),
            context.elapsed()
        );
    }

    /**
     * A run succeeds when it reached {@link RunPhase#DONE} without recording an error.
     *
     * @return true on success
     */
    public boolean success() {
        return phase == RunPhase.DONE && errors().isEmpty();
    }

    public List<RunIssue> errors() {
        return ofSeverity(Severity.ERROR);
    }

    public List<RunIssue> warnings() {
        return ofSeverity(Severity.WARNING);
    }

    public Optional<String> deployedUrl() {
        return Optional.ofNullable(deploymentUrl);
    }

    private List<RunIssue> ofSeverity(Severity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).toList();
    }
}
