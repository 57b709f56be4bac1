package com.archforge.core.pipeline;

import com.archforge.core.config.ProjectConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Inputs of one generation run.
 *
 * @param projectId project whose diagrams are loaded
 * @param outputRoot root the artifact tree is composed under
 * @param config project configuration
 * @param dryRun stop after planning; nothing but the plan record is written
 * @param skipValidation do not run build validation
 * @param skipDeploy do not deploy
 */
public record RunRequest(
    String projectId,
    Path outputRoot,
    ProjectConfig config,
    boolean dryRun,
    boolean skipValidation,
    boolean skipDeploy
) {
    /**
     * Compact constructor with validation.
     */
    public RunRequest {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(outputRoot, "outputRoot must not be null");
        if (projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be blank");
        }
        config = config == null ? ProjectConfig.defaults() : config;
    }

    public static RunRequest of(String projectId, Path outputRoot, ProjectConfig config) {
        return new RunRequest(projectId, outputRoot, config, false, false, false);
    }
}
