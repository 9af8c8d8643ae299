package org.example.stylelock.service.style;

/**
 * Thrown when a batch is requested for a project without an approved locked style.
 */
public class MissingLockException extends StyleConfigurationException {

    private final String projectId;

    public MissingLockException(String projectId, String reason) {
        super("No approved locked style for project " + projectId + ": " + reason);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
