package com.archforge.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("archforge.yaml");
        Files.writeString(configFile, """
            project:
              name: "shop"
              version: "2.1.0"
              description: "Order management"

            output:
              directory: "./out"
              managedRoots: [backend, shared]
              planFile: "plan.json"

            generation:
              provider: openai
              model: gpt-4o
              maxAttempts: 5
              initialBackoffMillis: 100

            linking:
              aliases:
                "@app/": "src/app/"

            validation:
              command: "npx tsc --noEmit"
              workingDirectory: backend

            run:
              timeoutSeconds: 60

            infra:
              region: eu-west-1
              stage: prod
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("shop");
        assertThat(config.project().version()).isEqualTo("2.1.0");
        assertThat(config.project().description()).isEqualTo("Order management");
        assertThat(config.output().directory()).isEqualTo("./out");
        assertThat(config.output().managedRoots()).containsExactly("backend", "shared");
        assertThat(config.output().planFile()).isEqualTo("plan.json");
        assertThat(config.generation().hasProvider()).isTrue();
        assertThat(config.generation().model()).isEqualTo("gpt-4o");
        assertThat(config.generation().maxAttempts()).isEqualTo(5);
        assertThat(config.generation().initialBackoffMillis()).isEqualTo(100L);
        assertThat(config.linking().aliases()).containsEntry("@app/", "src/app/");
        assertThat(config.validation().isEnabled()).isTrue();
        assertThat(config.validation().workingDirectory()).isEqualTo("backend");
        assertThat(config.run().timeoutSeconds()).isEqualTo(60L);
        assertThat(config.infra()).containsEntry("region", "eu-west-1");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archforge.yaml");
        Files.writeString(configFile, """
            project:
              name: "minimal"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("minimal");
        assertThat(config.project().version()).isEqualTo("1.0.0");
        assertThat(config.output().directory()).isEqualTo("./generated");
        assertThat(config.output().managedRoots()).containsExactly("backend", "frontend", "shared", "scripts", "deploy");
        assertThat(config.generation().hasProvider()).isFalse();
        assertThat(config.generation().maxAttempts()).isEqualTo(3);
        assertThat(config.validation().isEnabled()).isFalse();
        assertThat(config.linking().aliases()).containsKey("@/");
        assertThat(config.infra()).isEmpty();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("archforge.yaml");
        Files.writeString(configFile, """
            project:
              name: "shop"
              owner: "team-a"
            dashboards:
              enabled: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("shop");
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config.project().name()).isEqualTo("project");
        assertThat(config.project().version()).isEqualTo("1.0.0");
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archforge.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("project");
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archforge.yaml");
        Files.writeString(configFile, "");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isNotNull();
        assertThat(config.output().planFile()).isEqualTo("task-plan.json");
    }

    @Test
    void load_directory_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir);

        assertThat(config.project().name()).isEqualTo("project");
    }

    @Test
    void load_nonPositiveTimeout_fallsBackToDefault() throws IOException {
        Path configFile = tempDir.resolve("archforge.yaml");
        Files.writeString(configFile, """
            project:
              name: "shop"
            run:
              timeoutSeconds: 0
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("shop");
        assertThat(config.run().timeoutSeconds()).isEqualTo(1_800L);
    }

    @Test
    void load_blankPlanFile_fallsBackToDefaultAndKeepsOtherOutputSettings() throws IOException {
        Path configFile = tempDir.resolve("archforge.yaml");
        Files.writeString(configFile, """
            output:
              directory: "./out"
              planFile: " "
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().planFile()).isEqualTo("task-plan.json");
        assertThat(config.output().directory()).isEqualTo("./out");
    }

    @Test
    void loadFor_withoutExplicitPath_readsProjectFile() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), "project:\n  name: local\n");

        ProjectConfig config = ConfigLoader.loadFor(tempDir, null);

        assertThat(config.project().name()).isEqualTo("local");
    }

    @Test
    void loadFor_explicitPath_wins() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), "project:\n  name: local\n");
        Path explicit = tempDir.resolve("other.yaml");
        Files.writeString(explicit, "project:\n  name: other\n");

        ProjectConfig config = ConfigLoader.loadFor(tempDir, explicit);

        assertThat(config.project().name()).isEqualTo("other");
    }
}
