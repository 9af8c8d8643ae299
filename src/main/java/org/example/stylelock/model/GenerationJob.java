package org.example.stylelock.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One requested asset inside a batch. Instances are immutable; every state change
 * produces a new record that replaces the previous one in the batch ledger.
 */
public record GenerationJob(
        String jobId,
        AssetCategory category,
        String prompt,
        LockedStyleConfig config,
        int attemptCount,
        int maxAttempts,
        JobStatus status,
        Double latestScore,
        List<ConsistencyScore> scoreHistory,
        String lastError,
        LocalDateTime updatedAt
) {

    public GenerationJob {
        scoreHistory = List.copyOf(scoreHistory);
    }

    public static GenerationJob pending(String jobId, AssetCategory category, String prompt,
                                        LockedStyleConfig config, int maxAttempts) {
        return new GenerationJob(jobId, category, prompt, config, 0, maxAttempts,
                JobStatus.PENDING, null, List.of(), null, LocalDateTime.now());
    }

    public boolean hasAttemptsRemaining() {
        return attemptCount < maxAttempts;
    }

    public boolean isTerminal() {
        return switch (status) {
            case SUCCEEDED, FAILED_PERMANENT -> true;
            case FAILED_CONSISTENCY, FAILED_TRANSIENT -> !hasAttemptsRemaining();
            default -> false;
        };
    }

    public GenerationJob startAttempt() {
        return new GenerationJob(jobId, category, prompt, config, attemptCount + 1, maxAttempts,
                JobStatus.IN_FLIGHT, latestScore, scoreHistory, lastError, LocalDateTime.now());
    }

    public GenerationJob withOutcome(JobStatus nextStatus, ConsistencyScore score, String error) {
        List<ConsistencyScore> history = scoreHistory;
        Double nextScore = latestScore;
        if (score != null) {
            history = new ArrayList<>(scoreHistory);
            history.add(score);
            nextScore = score.score();
        }
        return new GenerationJob(jobId, category, prompt, config, attemptCount, maxAttempts,
                nextStatus, nextScore, history, error, LocalDateTime.now());
    }

    /**
     * Put the job back in the queue after a failure while attempts remain.
     */
    public GenerationJob requeue() {
        return new GenerationJob(jobId, category, prompt, config, attemptCount, maxAttempts,
                JobStatus.PENDING, latestScore, scoreHistory, lastError, LocalDateTime.now());
    }
}
