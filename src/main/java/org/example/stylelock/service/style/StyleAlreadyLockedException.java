package org.example.stylelock.service.style;

public class StyleAlreadyLockedException extends StyleConfigurationException {

    private final String projectId;
    private final int activeVersion;

    public StyleAlreadyLockedException(String projectId, int activeVersion) {
        super("Project " + projectId + " already has locked style version " + activeVersion
                + "; use relock to create a new version");
        this.projectId = projectId;
        this.activeVersion = activeVersion;
    }

    public String getProjectId() {
        return projectId;
    }

    public int getActiveVersion() {
        return activeVersion;
    }
}
