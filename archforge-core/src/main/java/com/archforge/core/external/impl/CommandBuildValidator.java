package com.archforge.core.external.impl;

import com.archforge.core.external.BuildValidator;
import com.archforge.core.external.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs a shell command (e.g. {@code npx tsc --noEmit}) against the composed output and
 * collects lines mentioning {@code error} or {@code warning}.
 *
 * <p>A non-zero exit code without any error line is reported as a single error.
 */
public class CommandBuildValidator implements BuildValidator {

    private static final Logger log = LoggerFactory.getLogger(CommandBuildValidator.class);

    private final String command;
    private final String workingDirectory;
    private final Duration timeout;

    public CommandBuildValidator(String command, String workingDirectory, Duration timeout) {
        this.command = command;
        this.workingDirectory = workingDirectory == null ? "." : workingDirectory;
        this.timeout = timeout;
    }

    @Override
    public String getId() {
        return "command";
    }

    @Override
    public ValidationReport validate(Path outputRoot) {
        Path directory = outputRoot.resolve(workingDirectory).normalize();
        if (!Files.isDirectory(directory)) {
            return new ValidationReport(List.of("Validation directory does not exist: " + directory), List.of());
        }

        log.info("Running build validation: {} (in {})", command, directory);
        ProcessBuilder builder = new ProcessBuilder(shell(command))
            .directory(directory.toFile())
            .redirectErrorStream(true);

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        try {
            Process process = builder.start();
            try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    classify(line, errors, warnings);
                }
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                errors.add("Validation command timed out after " + timeout.toSeconds() + "s");
            } else if (process.exitValue() != 0 && errors.isEmpty()) {
                errors.add("Validation command exited with code " + process.exitValue());
            }
        } catch (IOException e) {
            errors.add("Failed to run validation command: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Validation interrupted");
        }

        log.info("Build validation finished: {} errors, {} warnings", errors.size(), warnings.size());
        return new ValidationReport(errors, warnings);
    }

    static void classify(String line, List<String> errors, List<String> warnings) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.contains("error")) {
            errors.add(line.trim());
        } else if (lower.contains("warning")) {
            warnings.add(line.trim());
        }
    }

    private static List<String> shell(String command) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        return windows ? List.of("cmd", "/c", command) : List.of("sh", "-c", command);
    }
}
