package com.archforge.core.run;

/**
 * Thrown when the diagrams yield no usable architecture model. Ends the run as failed.
 */
public class EmptyModelException extends RuntimeException {

    private final String projectId;

    public EmptyModelException(String projectId, String message) {
        super(message);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
