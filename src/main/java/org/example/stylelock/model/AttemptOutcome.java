package org.example.stylelock.model;

import org.example.stylelock.service.generation.FailureKind;

/**
 * Generation result of an attempt, plus the score when the artifact reached scoring.
 */
public record AttemptOutcome(Kind kind, GenerationResult result, ConsistencyScore score, String error) {

    public enum Kind {
        SCORED,
        SERVICE_FAILURE,
        SCORING_EXHAUSTED
    }

    public static AttemptOutcome scored(GenerationResult result, ConsistencyScore score) {
        return new AttemptOutcome(Kind.SCORED, result, score, null);
    }

    public static AttemptOutcome serviceFailure(GenerationResult result) {
        return new AttemptOutcome(Kind.SERVICE_FAILURE, result, null, result.error());
    }

    public static AttemptOutcome scoringExhausted(GenerationResult result, String error) {
        return new AttemptOutcome(Kind.SCORING_EXHAUSTED, result, null, error);
    }

    public boolean isPermanentServiceFailure() {
        return kind == Kind.SERVICE_FAILURE && result.failureKind() == FailureKind.PERMANENT;
    }
}
