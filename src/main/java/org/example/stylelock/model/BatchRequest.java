package org.example.stylelock.model;

import java.util.List;

/**
 * @param thresholds optional; the configured defaults apply when null
 * @param maxConcurrent optional per-batch concurrency, 1 to 10
 */
public record BatchRequest(String projectId, List<JobSpec> jobs, BatchThresholds thresholds, Integer maxConcurrent) {
}
