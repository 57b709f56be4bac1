package com.archforge.core.run;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-scoped handle passed to every component of one run.
 *
 * <p>Carries the run identity, its {@link RunStateMachine}, the cancellation flag, the
 * deadline, the issues recorded so far and the progress the report is built from.
 * Nothing in it is shared with other runs.
 */
public class RunContext {

    private final String runId;
    private final String projectId;
    private final Clock clock;
    private final Instant startedAt;
    private final Instant deadline;
    private final RunStateMachine stateMachine;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<RunIssue> issues = Collections.synchronizedList(new ArrayList<>());

    private volatile List<String> generationOrder = List.of();
    private volatile List<String> cycles = List.of();
    private volatile List<String> artifactPaths = List.of();
    private volatile List<String> stubbedTasks = List.of();
    private volatile String deploymentUrl;

    public RunContext(String runId, String projectId, Duration timeout) {
        this(runId, projectId, timeout, Clock.systemUTC());
    }

    public RunContext(String runId, String projectId, Duration timeout, Clock clock) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
        this.clock = clock;
        this.startedAt = clock.instant();
        this.deadline = startedAt.plus(timeout);
        this.stateMachine = new RunStateMachine(runId, clock);
    }

    public String runId() {
        return runId;
    }

    public String projectId() {
        return projectId;
    }

    public RunStateMachine stateMachine() {
        return stateMachine;
    }

    public RunPhase phase() {
        return stateMachine.current();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    /**
     * Requests cancellation. Work already written stays in place.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isTimedOut() {
        return !clock.instant().isBefore(deadline);
    }

    /**
     * Returns true when no further task should be started.
     *
     * @return true when cancelled or past the deadline
     */
    public boolean shouldStop() {
        return isCancelled() || isTimedOut();
    }

    public void record(RunIssue issue) {
        issues.add(issue);
    }

    public void recordAll(List<RunIssue> newIssues) {
        issues.addAll(newIssues);
    }

    public List<RunIssue> issues() {
        synchronized (issues) {
            return List.copyOf(issues);
        }
    }

    public boolean hasErrors() {
        synchronized (issues) {
            return issues.stream().anyMatch(issue -> issue.severity() == Severity.ERROR);
        }
    }

    public List<String> generationOrder() {
        return generationOrder;
    }

    public void setGenerationOrder(List<String> generationOrder) {
        this.generationOrder = List.copyOf(generationOrder);
    }

    public List<String> cycles() {
        return cycles;
    }

    public void setCycles(List<String> cycles) {
        this.cycles = List.copyOf(cycles);
    }

    public List<String> artifactPaths() {
        return artifactPaths;
    }

    public void setArtifactPaths(List<String> artifactPaths) {
        this.artifactPaths = List.copyOf(artifactPaths);
    }

    public List<String> stubbedTasks() {
        return stubbedTasks;
    }

    public void setStubbedTasks(List<String> stubbedTasks) {
        this.stubbedTasks = List.copyOf(stubbedTasks);
    }

    public Optional<String> deploymentUrl() {
        return Optional.ofNullable(deploymentUrl);
    }

    public void setDeploymentUrl(String deploymentUrl) {
        this.deploymentUrl = deploymentUrl;
    }
}
