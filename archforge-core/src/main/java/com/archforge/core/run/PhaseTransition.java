package com.archforge.core.run;

import java.time.Instant;
import java.util.Objects;

/**
 * One observed phase change.
 *
 * @param runId run identifier
 * @param from phase left
 * @param to phase entered
 * @param at transition time
 */
public record PhaseTransition(String runId, RunPhase from, RunPhase to, Instant at) {

    /**
     * Compact constructor with validation.
     */
    public PhaseTransition {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
