package com.archforge.cli;

import com.archforge.core.config.ConfigLoader;
import com.archforge.core.config.ProjectConfig;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * Options shared by commands that read a project's diagrams.
 *
 * <p>A project directory holds {@code archforge.yaml} and a {@code diagrams/<projectId>/}
 * directory with the Mermaid sources.
 */
public class ProjectOptions {

    static final String DIAGRAMS_DIR = "diagrams";

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: <projectDir>/archforge.yaml)"
    )
    Path configPath;

    @Option(
        names = {"--project-id"},
        description = "Project id (default: project.name from the configuration)"
    )
    String projectId;

    @Option(
        names = {"--diagrams"},
        description = "Directory holding one sub-directory of diagrams per project (default: <projectDir>/diagrams)"
    )
    Path diagramsPath;

    ProjectConfig loadConfiguration() {
        Path resolved = configPath == null || configPath.isAbsolute() ? configPath : projectPath.resolve(configPath);
        return ConfigLoader.loadFor(projectPath, resolved);
    }

    String projectId(ProjectConfig config) {
        return projectId != null && !projectId.isBlank() ? projectId : config.project().name();
    }

    Path diagramRoot() {
        return diagramsPath != null ? diagramsPath : projectPath.resolve(DIAGRAMS_DIR);
    }

    Path outputRoot(ProjectConfig config, Path override) {
        if (override != null) {
            return override.toAbsolutePath().normalize();
        }
        return projectPath.resolve(config.output().directory()).toAbsolutePath().normalize();
    }
}
