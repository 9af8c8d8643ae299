package org.example.stylelock.model;

import org.example.stylelock.service.generation.FailureKind;

import java.time.Duration;

/**
 * Outcome of a single adapter attempt. {@code artifactRef} is set on success,
 * {@code error} and {@code failureKind} on failure.
 */
public record GenerationResult(
        String jobId,
        int attempt,
        String artifactRef,
        String rawServiceStatus,
        Duration duration,
        String error,
        FailureKind failureKind
) {

    public static GenerationResult success(String jobId, int attempt, String artifactRef,
                                           String rawServiceStatus, Duration duration) {
        return new GenerationResult(jobId, attempt, artifactRef, rawServiceStatus, duration, null, null);
    }

    public static GenerationResult failure(String jobId, int attempt, String rawServiceStatus,
                                           Duration duration, String error, FailureKind failureKind) {
        return new GenerationResult(jobId, attempt, null, rawServiceStatus, duration, error, failureKind);
    }

    public boolean succeeded() {
        return artifactRef != null;
    }
}
