package com.archforge.core.external.impl;

import com.archforge.core.external.BuildValidator;
import com.archforge.core.external.ValidationReport;

import java.nio.file.Path;
import java.util.List;

/**
 * Build validator used when no validation command is configured.
 */
public class NoOpBuildValidator implements BuildValidator {

    @Override
    public String getId() {
        return "none";
    }

    @Override
    public ValidationReport validate(Path outputRoot) {
        return new ValidationReport(List.of(), List.of("Build validation skipped: no command configured"));
    }
}
