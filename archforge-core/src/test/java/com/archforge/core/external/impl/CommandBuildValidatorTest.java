package com.archforge.core.external.impl;

import com.archforge.core.external.ValidationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CommandBuildValidator}.
 */
class CommandBuildValidatorTest {

    @TempDir
    Path tempDir;

    @Test
    void classify_sortsLinesBySeverity() {
        // Given
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        // When
        CommandBuildValidator.classify("  src/a.ts(3,1): error TS2304: Cannot find name 'Order'.", errors, warnings);
        CommandBuildValidator.classify("Warning: unused variable", errors, warnings);
        CommandBuildValidator.classify("Found 1 file", errors, warnings);

        // Then
        assertThat(errors).containsExactly("src/a.ts(3,1): error TS2304: Cannot find name 'Order'.");
        assertThat(warnings).containsExactly("Warning: unused variable");
    }

    @Test
    void validate_missingWorkingDirectory_reportsError() {
        // Given
        CommandBuildValidator validator = new CommandBuildValidator("true", "backend", Duration.ofSeconds(5));

        // When
        ValidationReport report = validator.validate(tempDir);

        // Then
        assertThat(report.passed()).isFalse();
        assertThat(report.errors()).hasSize(1);
        assertThat(report.errors().get(0)).startsWith("Validation directory does not exist");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void validate_commandPrintingErrors_collectsThem() throws Exception {
        // Given
        Files.createDirectories(tempDir.resolve("backend"));
        CommandBuildValidator validator = new CommandBuildValidator(
            "echo 'a.ts: error TS1005'; echo 'warning: slow'; exit 2", "backend", Duration.ofSeconds(30));

        // When
        ValidationReport report = validator.validate(tempDir);

        // Then
        assertThat(report.errors()).containsExactly("a.ts: error TS1005");
        assertThat(report.warnings()).containsExactly("warning: slow");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void validate_silentNonZeroExit_reportsExitCode() {
        // Given
        CommandBuildValidator validator = new CommandBuildValidator("exit 3", ".", Duration.ofSeconds(30));

        // When
        ValidationReport report = validator.validate(tempDir);

        // Then
        assertThat(report.errors()).containsExactly("Validation command exited with code 3");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void validate_cleanCommand_passes() {
        // Given
        CommandBuildValidator validator = new CommandBuildValidator("echo compiled", ".", Duration.ofSeconds(30));

        // When / Then
        assertThat(validator.validate(tempDir).passed()).isTrue();
    }
}
