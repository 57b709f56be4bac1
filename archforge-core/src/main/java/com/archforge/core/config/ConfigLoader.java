package com.archforge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code archforge.yaml} into a {@link ProjectConfig}.
 *
 * <p>Loading never fails a run: whatever cannot be read falls back to
 * {@link ProjectConfig#defaults()}, and out-of-range run limits fall back to their defaults.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "archforge.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads a configuration file.
     *
     * <p>Never throws. A missing, unreadable, empty or malformed file is logged and replaced
     * by the defaults.
     *
     * @param configPath path to {@code archforge.yaml}
     * @return parsed configuration, or the defaults
     */
    public static ProjectConfig load(Path configPath) {
        return read(configPath)
            .map(ConfigLoader::sanitize)
            .orElseGet(ProjectConfig::defaults);
    }

    /**
     * Resolves the configuration for a project directory: an explicit path wins, otherwise
     * {@code archforge.yaml} inside the project directory.
     *
     * @param projectDir project directory
     * @param explicitPath path given on the command line, may be null
     * @return parsed configuration, or the defaults
     */
    public static ProjectConfig loadFor(Path projectDir, Path explicitPath) {
        return load(explicitPath != null ? explicitPath : projectDir.resolve(DEFAULT_FILE_NAME));
    }

    private static Optional<ProjectConfig> read(Path configPath) {
        if (Files.notExists(configPath)) {
            log.warn("No configuration at {}; running with defaults", configPath);
            return Optional.empty();
        }
        if (Files.isDirectory(configPath) || !Files.isReadable(configPath)) {
            log.warn("Cannot read configuration {}; running with defaults", configPath);
            return Optional.empty();
        }

        try {
            ProjectConfig config = MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration {} is empty; running with defaults", configPath);
                return Optional.empty();
            }
            log.info("Using configuration {}", configPath);
            return Optional.of(config);
        } catch (IOException e) {
            log.error("Invalid configuration {}: {}. Running with defaults.", configPath, e.getMessage());
            return Optional.empty();
        }
    }

    private static ProjectConfig sanitize(ProjectConfig config) {
        ProjectConfig.RunConfig run = config.run();
        if (run.timeoutSeconds() <= 0) {
            log.warn("run.timeoutSeconds must be positive, got {}; using the default", run.timeoutSeconds());
            run = new ProjectConfig.RunConfig(null);
        }

        ProjectConfig.OutputConfig output = config.output();
        if (output.planFile().isBlank()) {
            log.warn("output.planFile is blank; using the default");
            output = new ProjectConfig.OutputConfig(output.directory(), output.managedRoots(), output.preserve(), null);
        }

        if (run == config.run() && output == config.output()) {
            return config;
        }
        return new ProjectConfig(config.project(), output, config.generation(), config.linking(),
            config.validation(), run, config.infra());
    }
}
