package org.example.stylelock.service;

import org.example.stylelock.model.AttemptOutcome;
import org.example.stylelock.model.ConsistencyScore;
import org.example.stylelock.model.GenerationJob;
import org.example.stylelock.model.JobStatus;
import org.example.stylelock.model.RetryDecision;
import org.example.stylelock.model.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Decides the next state of a job after each attempt. Retries reuse the job's prompt and
 * locked style unchanged; only the attempt budget moves.
 */
@Service
public class RetryController {

    private final RetryPolicy retryPolicy;

    public RetryController(@Value("${generation.max-attempts:3}") int maxAttempts) {
        this.retryPolicy = new RetryPolicy(maxAttempts);
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public RetryDecision decide(GenerationJob job, AttemptOutcome outcome) {
        switch (outcome.kind()) {
            case SERVICE_FAILURE -> {
                if (outcome.isPermanentServiceFailure()) {
                    return RetryDecision.fail(JobStatus.FAILED_PERMANENT,
                            "Permanent service failure: " + outcome.error());
                }
                if (job.hasAttemptsRemaining()) {
                    return RetryDecision.retry(JobStatus.FAILED_TRANSIENT,
                            "Transient service failure: " + outcome.error());
                }
                return RetryDecision.fail(JobStatus.FAILED_PERMANENT,
                        "Transient failures exhausted " + job.maxAttempts() + " attempts: " + outcome.error());
            }
            case SCORING_EXHAUSTED -> {
                return RetryDecision.fail(JobStatus.FAILED_PERMANENT, outcome.error());
            }
            default -> {
                ConsistencyScore score = outcome.score();
                if (score.passed()) {
                    return RetryDecision.accept("Score " + score.score() + " meets " + score.thresholdUsed());
                }
                String reason = "Score " + score.score() + " below " + score.thresholdUsed();
                if (job.hasAttemptsRemaining()) {
                    return RetryDecision.retry(JobStatus.FAILED_CONSISTENCY, reason);
                }
                return RetryDecision.fail(JobStatus.FAILED_CONSISTENCY,
                        reason + " after " + job.attemptCount() + " attempts");
            }
        }
    }

    /**
     * Record an attempt on the job and return the job's next state.
     */
    public GenerationJob apply(GenerationJob job, AttemptOutcome outcome, RetryDecision decision) {
        String error = decision.nextStatus() == JobStatus.SUCCEEDED ? null : decision.reason();
        GenerationJob recorded = job.withOutcome(decision.nextStatus(), outcome.score(), error);
        return decision.retry() ? recorded.requeue() : recorded;
    }
}
