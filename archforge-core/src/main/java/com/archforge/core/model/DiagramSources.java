package com.archforge.core.model;

import java.util.Objects;

/**
 * The four free-text diagram blocks of one project.
 *
 * <p>Any block may be empty; a project with only a class diagram is valid.
 *
 * @param projectId project identifier
 * @param classDiagram structural/entity diagram
 * @param backendComponentDiagram backend component/boundary diagram
 * @param frontendComponentDiagram frontend component diagram
 * @param sequenceDiagram interaction/sequence diagram
 */
public record DiagramSources(
    String projectId,
    String classDiagram,
    String backendComponentDiagram,
    String frontendComponentDiagram,
    String sequenceDiagram
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramSources {
        Objects.requireNonNull(projectId, "projectId must not be null");
        classDiagram = classDiagram == null ? "" : classDiagram;
        backendComponentDiagram = backendComponentDiagram == null ? "" : backendComponentDiagram;
        frontendComponentDiagram = frontendComponentDiagram == null ? "" : frontendComponentDiagram;
        sequenceDiagram = sequenceDiagram == null ? "" : sequenceDiagram;
    }

    /**
     * Creates sources holding only a class diagram.
     *
     * @param projectId project identifier
     * @param classDiagram class diagram text
     * @return sources
     */
    public static DiagramSources ofClassDiagram(String projectId, String classDiagram) {
        return new DiagramSources(projectId, classDiagram, null, null, null);
    }

    /**
     * Returns true when every block is blank.
     *
     * @return true if there is nothing to parse
     */
    public boolean isBlank() {
        return classDiagram.isBlank()
            && backendComponentDiagram.isBlank()
            && frontendComponentDiagram.isBlank()
            && sequenceDiagram.isBlank();
    }
}
