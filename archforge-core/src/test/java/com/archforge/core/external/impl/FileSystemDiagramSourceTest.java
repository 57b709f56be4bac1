package com.archforge.core.external.impl;

import com.archforge.core.model.DiagramSources;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemDiagramSource}.
 */
class FileSystemDiagramSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void load_readsPresentFilesAndLeavesOthersEmpty() throws Exception {
        // Given
        Path project = Files.createDirectories(tempDir.resolve("shop"));
        Files.writeString(project.resolve(FileSystemDiagramSource.CLASS_FILE), "classDiagram\n    class Order\n");
        Files.writeString(project.resolve(FileSystemDiagramSource.SEQUENCE_FILE), "sequenceDiagram\n");

        // When
        DiagramSources sources = new FileSystemDiagramSource(tempDir).load("shop");

        // Then
        assertThat(sources.projectId()).isEqualTo("shop");
        assertThat(sources.classDiagram()).contains("class Order");
        assertThat(sources.sequenceDiagram()).isEqualTo("sequenceDiagram\n");
        assertThat(sources.backendComponentDiagram()).isEmpty();
        assertThat(sources.frontendComponentDiagram()).isEmpty();
        assertThat(sources.isBlank()).isFalse();
    }

    @Test
    void load_emptyProjectDirectory_isBlank() throws Exception {
        // Given
        Files.createDirectories(tempDir.resolve("empty"));

        // When / Then
        assertThat(new FileSystemDiagramSource(tempDir).load("empty").isBlank()).isTrue();
    }

    @Test
    void load_missingProjectDirectory_throws() {
        assertThatThrownBy(() -> new FileSystemDiagramSource(tempDir).load("ghost"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Diagram directory not found");
    }
}
