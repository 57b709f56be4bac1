package com.archforge.core.run;

/**
 * Kinds of findings a run records.
 */
public enum IssueKind {
    /** A diagram line could not be parsed and was ignored. */
    PARSE_ANOMALY,
    /** A dependency cycle, or a task blocked by one, was excluded from the order. */
    PLANNING_CYCLE,
    /** Text generation failed for a task; a stub was substituted or nothing was produced. */
    GENERATION_FAILURE,
    /** Linking could not resolve or rewrite a file. */
    LINKING_FAILURE,
    /** A cross-layer signature mismatch was corrected. */
    CONSISTENCY_DRIFT,
    /** Build validation reported a problem. */
    BUILD_VALIDATION,
    /** Deployment reported a problem. */
    DEPLOYMENT,
    /** The run was cancelled or ran past its deadline. */
    RUN_INTERRUPTED,
    /** The run could not start or continue at all. */
    PRECONDITION
}
