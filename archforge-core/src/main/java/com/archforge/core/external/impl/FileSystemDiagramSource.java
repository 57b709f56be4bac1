package com.archforge.core.external.impl;

import com.archforge.core.external.DiagramSource;
import com.archforge.core.model.DiagramSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads diagram blocks from {@code <root>/<projectId>/}.
 *
 * <p>Expected files: {@code class.mmd}, {@code backend.mmd}, {@code frontend.mmd} and
 * {@code sequence.mmd}. Missing files become empty blocks.
 */
public class FileSystemDiagramSource implements DiagramSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDiagramSource.class);

    public static final String CLASS_FILE = "class.mmd";
    public static final String BACKEND_FILE = "backend.mmd";
    public static final String FRONTEND_FILE = "frontend.mmd";
    public static final String SEQUENCE_FILE = "sequence.mmd";

    private final Path root;

    public FileSystemDiagramSource(Path root) {
        this.root = root;
    }

    @Override
    public DiagramSources load(String projectId) {
        Path directory = root.resolve(projectId);
        if (!Files.isDirectory(directory)) {
            throw new IllegalStateException("Diagram directory not found: " + directory);
        }
        log.debug("Loading diagrams from {}", directory);
        return new DiagramSources(
            projectId,
            read(directory.resolve(CLASS_FILE)),
            read(directory.resolve(BACKEND_FILE)),
            read(directory.resolve(FRONTEND_FILE)),
            read(directory.resolve(SEQUENCE_FILE))
        );
    }

    private static String read(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("Diagram file not present: {}", file);
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read diagram file: " + file, e);
        }
    }
}
