package com.archforge.core.run;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a run kept in a {@link RunStore}.
 *
 * @param runId run identifier
 * @param projectId project identifier
 * @param phase phase at snapshot time
 * @param issueCount issues recorded so far
 * @param updatedAt snapshot time
 */
public record RunStatus(String runId, String projectId, RunPhase phase, int issueCount, Instant updatedAt) {

    /**
     * Compact constructor with validation.
     */
    public RunStatus {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
    }

    /**
     * Captures the current state of a run.
     *
     * @param context run context
     * @param at snapshot time
     * @return status snapshot
     */
    public static RunStatus of(RunContext context, Instant at) {
        return new RunStatus(context.runId(), context.projectId(), context.phase(), context.issues().size(), at);
    }
}
