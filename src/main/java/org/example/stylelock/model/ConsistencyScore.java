package org.example.stylelock.model;

public record ConsistencyScore(
        String jobId,
        int attempt,
        double score,
        String baselineRef,
        double thresholdUsed,
        boolean passed
) {

    public static ConsistencyScore of(String jobId, int attempt, double score,
                                      String baselineRef, double threshold) {
        double clamped = Math.max(0.0, Math.min(10.0, score));
        return new ConsistencyScore(jobId, attempt, clamped, baselineRef, threshold, clamped >= threshold);
    }
}
