package org.example.stylelock.model;

import java.time.LocalDateTime;
import java.util.List;

public record BatchRun(
        String batchId,
        String projectId,
        LockedStyleConfig config,
        BatchThresholds thresholds,
        List<GenerationJob> jobs,
        double aggregateScore,
        BatchSummary summary,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        BatchStatus status,
        boolean cancelRequested
) {

    public BatchRun {
        jobs = List.copyOf(jobs);
    }
}
