package com.archforge.core.run;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of one generation run.
 *
 * <p>Allowed transitions:
 * <pre>
 * QUEUED     -> PARSING
 * PARSING    -> PLANNING
 * PLANNING   -> GENERATING | DONE (dry run)
 * GENERATING -> LINKING
 * LINKING    -> VALIDATING | DEPLOYING | DONE
 * VALIDATING -> DEPLOYING | DONE
 * DEPLOYING  -> DONE
 * any non-terminal phase -> FAILED
 * </pre>
 */
public enum RunPhase {
    QUEUED,
    PARSING,
    PLANNING,
    GENERATING,
    LINKING,
    VALIDATING,
    DEPLOYING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Returns the phases reachable from this one in a single transition.
     *
     * @return allowed next phases; empty for terminal phases
     */
    public Set<RunPhase> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(PARSING, FAILED);
            case PARSING -> EnumSet.of(PLANNING, FAILED);
            case PLANNING -> EnumSet.of(GENERATING, DONE, FAILED);
            case GENERATING -> EnumSet.of(LINKING, FAILED);
            case LINKING -> EnumSet.of(VALIDATING, DEPLOYING, DONE, FAILED);
            case VALIDATING -> EnumSet.of(DEPLOYING, DONE, FAILED);
            case DEPLOYING -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(RunPhase.class);
        };
    }

    public boolean canTransitionTo(RunPhase next) {
        return allowedNext().contains(next);
    }
}
