package org.example.stylelock.model;

/**
 * What happens to a job after one attempt.
 *
 * @param nextStatus status recorded for the attempt
 * @param retry whether the job goes back to the queue with unchanged inputs
 */
public record RetryDecision(JobStatus nextStatus, boolean retry, String reason) {

    public static RetryDecision accept(String reason) {
        return new RetryDecision(JobStatus.SUCCEEDED, false, reason);
    }

    public static RetryDecision retry(JobStatus failedStatus, String reason) {
        return new RetryDecision(failedStatus, true, reason);
    }

    public static RetryDecision fail(JobStatus failedStatus, String reason) {
        return new RetryDecision(failedStatus, false, reason);
    }
}
