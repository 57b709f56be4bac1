package com.archforge.core.run;

/**
 * Severity of a run issue. Only {@link #ERROR} makes a run unsuccessful.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR
}
