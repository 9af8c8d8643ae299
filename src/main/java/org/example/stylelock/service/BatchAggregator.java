package org.example.stylelock.service;

import org.example.stylelock.model.AssetCategory;
import org.example.stylelock.model.BatchStatus;
import org.example.stylelock.model.BatchSummary;
import org.example.stylelock.model.BatchThresholds;
import org.example.stylelock.model.CategoryBreakdown;
import org.example.stylelock.model.GenerationJob;
import org.example.stylelock.model.JobStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a batch's job list into its summary and verdict. Both are pure functions of the
 * jobs, so repeated reads of a finished batch always agree.
 */
@Service
public class BatchAggregator {

    public double aggregateScore(List<GenerationJob> jobs) {
        return mean(acceptedScores(jobs));
    }

    public BatchSummary summarize(List<GenerationJob> jobs, int peakInFlight) {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        Map<AssetCategory, List<GenerationJob>> byCategory = new EnumMap<>(AssetCategory.class);
        int terminal = 0;
        for (GenerationJob job : jobs) {
            counts.merge(job.status(), 1, Integer::sum);
            if (job.isTerminal()) {
                terminal++;
            }
            byCategory.computeIfAbsent(job.category(), ignored -> new ArrayList<>()).add(job);
        }

        Map<AssetCategory, CategoryBreakdown> categories = new EnumMap<>(AssetCategory.class);
        byCategory.forEach((category, categoryJobs) -> {
            int succeeded = 0;
            int failed = 0;
            for (GenerationJob job : categoryJobs) {
                if (job.status() == JobStatus.SUCCEEDED) {
                    succeeded++;
                } else if (job.status().isFailure()) {
                    failed++;
                }
            }
            categories.put(category, new CategoryBreakdown(
                    categoryJobs.size(), succeeded, failed, aggregateScore(categoryJobs)));
        });

        List<Double> accepted = acceptedScores(jobs);
        Double minScore = accepted.stream().min(Double::compare).orElse(null);
        double progressPercent = jobs.isEmpty() ? 0.0 : terminal * 100.0 / jobs.size();
        return new BatchSummary(jobs.size(), progressPercent, counts, mean(accepted), minScore,
                categories, peakInFlight);
    }

    /**
     * Verdict for a batch whose jobs have all reached a terminal state.
     */
    public BatchStatus verdict(List<GenerationJob> jobs, BatchThresholds thresholds) {
        List<Double> accepted = acceptedScores(jobs);
        if (accepted.isEmpty() || mean(accepted) < thresholds.batch()) {
            return BatchStatus.FAILED;
        }
        boolean allSucceeded = accepted.size() == jobs.size();
        return allSucceeded ? BatchStatus.SUCCEEDED : BatchStatus.PARTIAL_FAILURE;
    }

    private List<Double> acceptedScores(List<GenerationJob> jobs) {
        List<Double> scores = new ArrayList<>();
        for (GenerationJob job : jobs) {
            if (job.status() == JobStatus.SUCCEEDED && job.latestScore() != null) {
                scores.add(job.latestScore());
            }
        }
        return scores;
    }

    private double mean(List<Double> scores) {
        if (scores.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (double score : scores) {
            total += score;
        }
        return total / scores.size();
    }
}
