package org.example.stylelock.service;

import org.example.stylelock.model.ConsistencyScore;
import org.example.stylelock.model.GeneratedArtifact;
import org.example.stylelock.service.scoring.ConsistencyScorer;
import org.example.stylelock.service.scoring.ScoringUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Scores generated artifacts against the project baseline and applies the per-asset bar.
 * Scorer outages are retried here by re-scoring the same artifact; they never trigger a
 * new generation.
 */
@Service
public class ConsistencyGate {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyGate.class);

    private final ConsistencyScorer consistencyScorer;
    private final GenerationMetricsService metricsService;
    private final int maxScoringRetries;
    private final long retryDelayMs;

    public ConsistencyGate(
            ConsistencyScorer consistencyScorer,
            GenerationMetricsService metricsService,
            @Value("${scoring.max-retries:2}") int maxScoringRetries,
            @Value("${scoring.retry-delay-ms:1000}") long retryDelayMs) {
        this.consistencyScorer = consistencyScorer;
        this.metricsService = metricsService;
        this.maxScoringRetries = Math.max(0, maxScoringRetries);
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    public ConsistencyScore evaluate(String jobId, int attempt, GeneratedArtifact artifact,
                                     String baselineRef, double perAssetThreshold)
            throws ScoringExhaustedException, InterruptedException {
        ScoringUnavailableException lastFailure = null;
        for (int tryNumber = 0; tryNumber <= maxScoringRetries; tryNumber++) {
            if (tryNumber > 0) {
                metricsService.recordScoringRetry();
                log.warn("Scoring unavailable for job {} attempt {}, retry {}/{}: {}",
                        jobId, attempt, tryNumber, maxScoringRetries, lastFailure.getMessage());
                Thread.sleep(retryDelayMs);
            }
            try {
                double raw = consistencyScorer.score(artifact.artifactRef(), baselineRef);
                if (!Double.isFinite(raw)) {
                    throw new ScoringUnavailableException("Scorer returned non-finite score " + raw);
                }
                ConsistencyScore score = ConsistencyScore.of(jobId, attempt, raw, baselineRef, perAssetThreshold);
                log.debug("Job {} attempt {} scored {} (threshold {})", jobId, attempt, score.score(), perAssetThreshold);
                return score;
            } catch (ScoringUnavailableException e) {
                lastFailure = e;
            }
        }
        throw new ScoringExhaustedException("Scoring unavailable after " + (maxScoringRetries + 1)
                + " tries: " + lastFailure.getMessage(), lastFailure);
    }
}
