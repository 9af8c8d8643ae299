package org.example.stylelock.model;

import java.time.LocalDateTime;
import java.util.List;

public record LockedStyleRecord(
        String projectId,
        int version,
        LockedStyleConfig config,
        List<String> validationSamples,
        Double consistencyScore,
        boolean approved,
        boolean active,
        LocalDateTime lockedAt,
        LocalDateTime approvedAt
) {

    public LockedStyleRecord {
        validationSamples = validationSamples == null ? List.of() : List.copyOf(validationSamples);
    }

    /**
     * Reference the consistency scorer compares artifacts against: the first approved
     * validation sample, or the project's baseline key when no samples were recorded.
     */
    public String baselineRef() {
        if (!validationSamples.isEmpty()) {
            return validationSamples.get(0);
        }
        return projectId + "/baseline";
    }
}
