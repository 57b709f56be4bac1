package com.archforge.core.run;

import java.util.Objects;

/**
 * One finding recorded during a run.
 *
 * @param kind issue kind
 * @param severity severity
 * @param subject what the issue is about (task id, file path, unit name)
 * @param message human-readable description
 */
public record RunIssue(IssueKind kind, Severity severity, String subject, String message) {

    /**
     * Compact constructor with validation.
     */
    public RunIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (subject == null) {
            subject = "";
        }
    }

    public static RunIssue info(IssueKind kind, String subject, String message) {
        return new RunIssue(kind, Severity.INFO, subject, message);
    }

    public static RunIssue warning(IssueKind kind, String subject, String message) {
        return new RunIssue(kind, Severity.WARNING, subject, message);
    }

    public static RunIssue error(IssueKind kind, String subject, String message) {
        return new RunIssue(kind, Severity.ERROR, subject, message);
    }

    /**
     * Formats the issue for console output.
     *
     * @return e.g. {@code [GENERATION_FAILURE] backend_model_Order: stub substituted}
     */
    public String describe() {
        return "[" + kind + "] " + (subject.isEmpty() ? "" : subject + ": ") + message;
    }
}
