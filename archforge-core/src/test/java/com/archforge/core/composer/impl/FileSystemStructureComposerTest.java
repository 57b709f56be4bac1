package com.archforge.core.composer.impl;

import com.archforge.core.composer.ComposeContext;
import com.archforge.core.composer.CompositionResult;
import com.archforge.core.generator.GeneratedArtifact;
import com.archforge.core.planner.TaskCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemStructureComposer}.
 */
class FileSystemStructureComposerTest {

    @TempDir
    Path tempDir;

    private FileSystemStructureComposer composer;
    private ComposeContext context;

    @BeforeEach
    void setUp() {
        composer = new FileSystemStructureComposer();
        context = new ComposeContext(tempDir, null, null);
    }

    private static GeneratedArtifact artifact(String path, String content) {
        return new GeneratedArtifact(path, path, content, TaskCategory.BACKEND, List.of(), List.of(), false);
    }

    private Path file(String relative, String content) throws IOException {
        Path path = tempDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        return path;
    }

    @Test
    void write_createsParentDirectories() throws IOException {
        // When
        Path written = composer.write(artifact("backend/src/models/Order.ts", "export class Order {}\n"), context);

        // Then
        assertThat(written).isEqualTo(tempDir.toAbsolutePath().normalize().resolve("backend/src/models/Order.ts"));
        assertThat(Files.readString(written)).isEqualTo("export class Order {}\n");
    }

    @Test
    void write_pathEscapingRoot_isRejected() {
        assertThatThrownBy(() -> composer.write(artifact("../outside.ts", "x"), context))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("escapes");
        assertThat(tempDir.getParent().resolve("outside.ts")).doesNotExist();
    }

    @Test
    void cleanup_removesStaleFilesButKeepsPreservedNames() throws IOException {
        // Given
        file("backend/src/models/Stale.ts", "export class Stale {}\n");
        Path manifest = file("backend/package.json", "{}\n");
        Path dependency = file("backend/node_modules/express/index.js", "module.exports = {};\n");
        Path notes = file("docs/notes.md", "# notes\n");

        // When
        List<String> deleted = composer.cleanup(context);

        // Then
        assertThat(deleted).containsExactly("backend/src/models/Stale.ts");
        assertThat(tempDir.resolve("backend/src")).doesNotExist();
        assertThat(manifest).exists();
        assertThat(dependency).exists();
        assertThat(notes).exists();
    }

    @Test
    void cleanup_removesStaleBuildAndDeployFilesAndPreviousRootFiles() throws IOException {
        // Given
        file("scripts/old-build.sh", "#!/bin/sh\n");
        file("deploy/old-deploy.sh", "#!/bin/sh\n");
        file("serverless.yml", "service: old\n");
        Path userFile = file("README.md", "# notes\n");
        ComposeContext withPrevious = context.withPreviousFiles(List.of("serverless.yml", "deploy/old-deploy.sh", "gone.yml"));

        // When
        List<String> deleted = composer.cleanup(withPrevious);

        // Then
        assertThat(deleted).containsExactlyInAnyOrder("scripts/old-build.sh", "deploy/old-deploy.sh", "serverless.yml");
        assertThat(tempDir.resolve("scripts")).doesNotExist();
        assertThat(tempDir.resolve("deploy")).doesNotExist();
        assertThat(tempDir.resolve("serverless.yml")).doesNotExist();
        assertThat(userFile).exists();
    }

    @Test
    void cleanup_previousFileWithPreservedName_isKept() throws IOException {
        // Given
        Path env = file(".env", "KEY=1\n");

        // When
        List<String> deleted = composer.cleanup(context.withPreviousFiles(List.of(".env")));

        // Then
        assertThat(deleted).isEmpty();
        assertThat(env).exists();
    }

    @Test
    void compose_cleansThenWritesAllArtifacts() throws IOException {
        // Given
        file("shared/src/types/Old.ts", "export type Old = string;\n");

        // When
        CompositionResult result = composer.compose(List.of(
            artifact("shared/src/types/index.ts", "export type Id = string;\n"),
            artifact("backend/src/handler.ts", "export const app = {};\n")
        ), context);

        // Then
        assertThat(result.deleted()).containsExactly("shared/src/types/Old.ts");
        assertThat(result.written()).containsExactly("shared/src/types/index.ts", "backend/src/handler.ts");
        assertThat(tempDir.resolve("shared/src/types/Old.ts")).doesNotExist();
        assertThat(tempDir.resolve("shared/src/types/index.ts")).exists();
    }

    @Test
    void load_readsScriptsUnderManagedRootsOnly() throws IOException {
        // Given
        file("backend/src/services/OrderService.ts", "export class OrderService {}\n");
        file("backend/tests/unit/OrderService.test.ts", "describe('x', () => {});\n");
        file("frontend/src/pages/OrderPage.tsx", "export function OrderPage() { return null; }\n");
        file("backend/node_modules/lib/index.js", "export const lib = 1;\n");
        file("backend/package.json", "{}\n");
        file("tools/tool.js", "export const tool = 1;\n");

        // When
        List<GeneratedArtifact> loaded = composer.load(context);

        // Then
        assertThat(loaded).extracting(GeneratedArtifact::path).containsExactly(
            "backend/src/services/OrderService.ts",
            "backend/tests/unit/OrderService.test.ts",
            "frontend/src/pages/OrderPage.tsx");
        assertThat(loaded.get(0).exports()).containsExactly("OrderService");
        assertThat(loaded).extracting(GeneratedArtifact::category)
            .containsExactly(TaskCategory.BACKEND, TaskCategory.TEST, TaskCategory.FRONTEND);
    }

    @Test
    void load_missingOutputRoot_isEmpty() {
        ComposeContext missing = new ComposeContext(tempDir.resolve("nothing"), null, null);

        assertThat(composer.load(missing)).isEmpty();
        assertThat(composer.cleanup(missing)).isEmpty();
    }
}
