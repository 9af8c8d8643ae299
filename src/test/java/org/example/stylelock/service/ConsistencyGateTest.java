package org.example.stylelock.service;

import org.example.stylelock.model.ConsistencyScore;
import org.example.stylelock.model.GeneratedArtifact;
import org.example.stylelock.service.scoring.ConsistencyScorer;
import org.example.stylelock.service.scoring.ScoringUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsistencyGateTest {

    private static final GeneratedArtifact ARTIFACT =
            new GeneratedArtifact("gen-7", "cache/gen-7.png", "image/png", 2048);

    @Mock
    private ConsistencyScorer consistencyScorer;

    private GenerationMetricsService metricsService;
    private ConsistencyGate gate;

    @BeforeEach
    void setUp() {
        metricsService = new GenerationMetricsService();
        gate = new ConsistencyGate(consistencyScorer, metricsService, 2, 0);
    }

    @Test
    void evaluate_passingScore_isMarkedPassed() throws Exception {
        when(consistencyScorer.score("cache/gen-7.png", "baseline.png")).thenReturn(9.1);

        ConsistencyScore score = gate.evaluate("job-1", 1, ARTIFACT, "baseline.png", 8.5);

        assertEquals(9.1, score.score());
        assertEquals(8.5, score.thresholdUsed());
        assertEquals("baseline.png", score.baselineRef());
        assertTrue(score.passed());
    }

    @Test
    void evaluate_lowScore_isReportedNotRetried() throws Exception {
        when(consistencyScorer.score("cache/gen-7.png", "baseline.png")).thenReturn(6.2);

        ConsistencyScore score = gate.evaluate("job-1", 2, ARTIFACT, "baseline.png", 8.5);

        assertFalse(score.passed());
        assertEquals(2, score.attempt());
        verify(consistencyScorer, times(1)).score("cache/gen-7.png", "baseline.png");
    }

    @Test
    void evaluate_outOfRangeScore_isClamped() throws Exception {
        when(consistencyScorer.score("cache/gen-7.png", "baseline.png")).thenReturn(12.5);

        ConsistencyScore score = gate.evaluate("job-1", 1, ARTIFACT, "baseline.png", 8.5);

        assertEquals(10.0, score.score());
    }

    @Test
    void evaluate_scorerRecovers_rescoresSameArtifact() throws Exception {
        when(consistencyScorer.score("cache/gen-7.png", "baseline.png"))
                .thenThrow(new ScoringUnavailableException("503"))
                .thenReturn(8.9);

        ConsistencyScore score = gate.evaluate("job-1", 1, ARTIFACT, "baseline.png", 8.5);

        assertTrue(score.passed());
        verify(consistencyScorer, times(2)).score("cache/gen-7.png", "baseline.png");
        assertEquals(1L, metricsService.snapshot().get("scoringRetries"));
    }

    @Test
    void evaluate_scorerStaysDown_throwsAfterRetries() throws Exception {
        when(consistencyScorer.score("cache/gen-7.png", "baseline.png"))
                .thenThrow(new ScoringUnavailableException("connection refused"));

        ScoringExhaustedException error = assertThrows(ScoringExhaustedException.class,
                () -> gate.evaluate("job-1", 1, ARTIFACT, "baseline.png", 8.5));

        assertTrue(error.getMessage().contains("connection refused"));
        verify(consistencyScorer, times(3)).score("cache/gen-7.png", "baseline.png");
        assertEquals(2L, metricsService.snapshot().get("scoringRetries"));
    }

    @Test
    void evaluate_nonFiniteScore_isRescoredLikeAnOutage() throws Exception {
        when(consistencyScorer.score("cache/gen-7.png", "baseline.png"))
                .thenReturn(Double.NaN)
                .thenReturn(9.0);

        ConsistencyScore score = gate.evaluate("job-1", 1, ARTIFACT, "baseline.png", 8.5);

        assertEquals(9.0, score.score());
        assertTrue(score.passed());
        assertEquals(1L, metricsService.snapshot().get("scoringRetries"));
    }

    @Test
    void evaluate_scorerKeepsReturningNaN_neverPasses() throws Exception {
        when(consistencyScorer.score("cache/gen-7.png", "baseline.png")).thenReturn(Double.NaN);

        ScoringExhaustedException error = assertThrows(ScoringExhaustedException.class,
                () -> gate.evaluate("job-1", 1, ARTIFACT, "baseline.png", 8.5));

        assertTrue(error.getMessage().contains("non-finite"));
        verify(consistencyScorer, times(3)).score("cache/gen-7.png", "baseline.png");
    }
}
