package com.archforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for ArchForge runs.
 *
 * <p>Loaded from {@code archforge.yaml} in the project root. Every section is optional;
 * missing sections and fields fall back to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "shop"
 *
 * output:
 *   directory: "./generated"
 *   preserve: [package.json, .env]
 *
 * generation:
 *   provider: openai
 *   model: gpt-4o-mini
 *   apiKeyEnv: OPENAI_API_KEY
 *   maxAttempts: 3
 *
 * linking:
 *   aliases:
 *     "@/": "src/"
 *
 * validation:
 *   command: "npx tsc --noEmit"
 *   workingDirectory: backend
 * }</pre>
 *
 * @param project project metadata
 * @param output output configuration
 * @param generation text-generation configuration
 * @param linking linking-pass configuration
 * @param validation build-validation configuration
 * @param run run-level limits
 * @param infra free-form infrastructure settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("generation") GenerationConfig generation,
    @JsonProperty("linking") LinkingConfig linking,
    @JsonProperty("validation") ValidationConfig validation,
    @JsonProperty("run") RunConfig run,
    @JsonProperty("infra") Map<String, Object> infra
) {
    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ProjectConfig {
        project = project == null ? new ProjectInfo(null, null, null) : project;
        output = output == null ? new OutputConfig(null, null, null, null) : output;
        generation = generation == null ? GenerationConfig.defaults() : generation;
        linking = linking == null ? new LinkingConfig(null) : linking;
        validation = validation == null ? new ValidationConfig(null, null) : validation;
        run = run == null ? new RunConfig(null) : run;
        infra = infra == null ? Map.of() : infra;
    }

    /**
     * Creates a default configuration: no text-generation provider, no validation command.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name, also the default project id
     * @param version project version
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {
        public ProjectInfo {
            name = name == null ? "project" : name;
            version = version == null ? "1.0.0" : version;
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output root
     * @param managedRoots top-level directories the composer cleans before writing
     * @param preserve file and directory names never deleted during cleanup
     * @param planFile name of the task-plan record written under the output root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("managedRoots") List<String> managedRoots,
        @JsonProperty("preserve") List<String> preserve,
        @JsonProperty("planFile") String planFile
    ) {
        public static final List<String> DEFAULT_MANAGED_ROOTS = List.of("backend", "frontend", "shared", "scripts", "deploy");

        public static final List<String> DEFAULT_PRESERVE = List.of(
            "package.json",
            "package-lock.json",
            "tsconfig.json",
            ".env",
            "webpack.config.js",
            "task-plan.json",
            "node_modules",
            ".git"
        );

        public OutputConfig {
            directory = directory == null ? "./generated" : directory;
            managedRoots = managedRoots == null ? DEFAULT_MANAGED_ROOTS : List.copyOf(managedRoots);
            preserve = preserve == null ? DEFAULT_PRESERVE : List.copyOf(preserve);
            planFile = planFile == null ? "task-plan.json" : planFile;
        }
    }

    /**
     * Text-generation provider and retry settings.
     *
     * @param provider provider id ({@code openai} or {@code none})
     * @param model model name sent to the provider
     * @param endpoint base URL of an OpenAI-compatible API
     * @param apiKeyEnv environment variable holding the API key
     * @param temperature sampling temperature
     * @param timeoutSeconds per-request timeout
     * @param maxAttempts attempts per task before falling back to a stub
     * @param initialBackoffMillis delay before the first retry
     * @param maxBackoffMillis upper bound for retry delays
     * @param backoffMultiplier growth factor between retries
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerationConfig(
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("apiKeyEnv") String apiKeyEnv,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("initialBackoffMillis") Long initialBackoffMillis,
        @JsonProperty("maxBackoffMillis") Long maxBackoffMillis,
        @JsonProperty("backoffMultiplier") Double backoffMultiplier
    ) {
        public GenerationConfig {
            provider = provider == null ? "none" : provider;
            model = model == null ? "gpt-4o-mini" : model;
            endpoint = endpoint == null ? "https://api.openai.com/v1" : endpoint;
            apiKeyEnv = apiKeyEnv == null ? "OPENAI_API_KEY" : apiKeyEnv;
            temperature = temperature == null ? 0.2 : temperature;
            timeoutSeconds = timeoutSeconds == null ? 60 : timeoutSeconds;
            maxAttempts = maxAttempts == null ? 3 : Math.max(1, maxAttempts);
            initialBackoffMillis = initialBackoffMillis == null ? 500L : initialBackoffMillis;
            maxBackoffMillis = maxBackoffMillis == null ? 8_000L : maxBackoffMillis;
            backoffMultiplier = backoffMultiplier == null ? 2.0 : backoffMultiplier;
        }

        public static GenerationConfig defaults() {
            return new GenerationConfig(null, null, null, null, null, null, null, null, null, null);
        }

        /**
         * Returns true when a real provider is configured.
         *
         * @return false for {@code none}
         */
        public boolean hasProvider() {
            return !"none".equalsIgnoreCase(provider);
        }
    }

    /**
     * Linking-pass configuration.
     *
     * @param aliases import alias prefix to output-relative path prefix
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LinkingConfig(
        @JsonProperty("aliases") Map<String, String> aliases
    ) {
        public static final Map<String, String> DEFAULT_ALIASES = defaultAliases();

        public LinkingConfig {
            aliases = aliases == null ? DEFAULT_ALIASES : aliases;
        }

        private static Map<String, String> defaultAliases() {
            Map<String, String> aliases = new LinkedHashMap<>();
            aliases.put("@/", "src/");
            aliases.put("@backend/", "src/backend/");
            aliases.put("@frontend/", "src/frontend/");
            aliases.put("@shared/", "src/shared/");
            aliases.put("@types/", "src/types/");
            aliases.put("@utils/", "src/utils/");
            return Collections.unmodifiableMap(aliases);
        }
    }

    /**
     * Build-validation configuration.
     *
     * @param command shell command run after linking; blank disables validation
     * @param workingDirectory directory under the output root the command runs in
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("command") String command,
        @JsonProperty("workingDirectory") String workingDirectory
    ) {
        public ValidationConfig {
            workingDirectory = workingDirectory == null ? "." : workingDirectory;
        }

        public boolean isEnabled() {
            return command != null && !command.isBlank();
        }
    }

    /**
     * Run-level limits.
     *
     * @param timeoutSeconds wall-clock budget for one run
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RunConfig(
        @JsonProperty("timeoutSeconds") Long timeoutSeconds
    ) {
        public RunConfig {
            timeoutSeconds = timeoutSeconds == null ? 1_800L : timeoutSeconds;
        }
    }
}
