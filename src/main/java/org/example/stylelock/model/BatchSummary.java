package org.example.stylelock.model;

import java.util.Map;

/**
 * Aggregate view of a batch's jobs.
 *
 * @param progressPercent share of jobs in a terminal state, 0 to 100
 * @param meanScore mean of the accepted scores of succeeded jobs, 0 when none succeeded
 * @param minScore lowest accepted score, null when none succeeded
 */
public record BatchSummary(
        int total,
        double progressPercent,
        Map<JobStatus, Integer> countsByStatus,
        double meanScore,
        Double minScore,
        Map<AssetCategory, CategoryBreakdown> categories,
        int peakInFlight
) {

    public BatchSummary {
        countsByStatus = Map.copyOf(countsByStatus);
        categories = Map.copyOf(categories);
    }

    public int count(JobStatus status) {
        return countsByStatus.getOrDefault(status, 0);
    }
}
