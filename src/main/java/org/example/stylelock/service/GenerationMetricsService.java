package org.example.stylelock.service;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class GenerationMetricsService {

    private final LongAdder batchesSubmitted = new LongAdder();
    private final LongAdder batchesCompleted = new LongAdder();
    private final LongAdder batchesCancelled = new LongAdder();
    private final LongAdder attemptsStarted = new LongAdder();
    private final LongAdder jobsSucceeded = new LongAdder();
    private final LongAdder jobsFailed = new LongAdder();
    private final LongAdder retriesScheduled = new LongAdder();
    private final LongAdder throttledCalls = new LongAdder();
    private final LongAdder attemptTimeouts = new LongAdder();
    private final LongAdder scoringRetries = new LongAdder();
    private final AtomicLong attemptLatencyTotalMs = new AtomicLong(0);

    public void recordBatchSubmitted() {
        batchesSubmitted.increment();
    }

    public void recordBatchCompleted(boolean cancelled) {
        batchesCompleted.increment();
        if (cancelled) {
            batchesCancelled.increment();
        }
    }

    public void recordAttempt(long durationMs) {
        attemptsStarted.increment();
        if (durationMs > 0) {
            attemptLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public void recordJobSucceeded() {
        jobsSucceeded.increment();
    }

    public void recordJobFailed() {
        jobsFailed.increment();
    }

    public void recordRetryScheduled() {
        retriesScheduled.increment();
    }

    public void recordThrottled() {
        throttledCalls.increment();
    }

    public void recordAttemptTimeout() {
        attemptTimeouts.increment();
    }

    public void recordScoringRetry() {
        scoringRetries.increment();
    }

    public Map<String, Object> snapshot() {
        long attempts = attemptsStarted.sum();
        long avgLatencyMs = attempts == 0 ? 0 : attemptLatencyTotalMs.get() / attempts;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("batchesSubmitted", batchesSubmitted.sum());
        metrics.put("batchesCompleted", batchesCompleted.sum());
        metrics.put("batchesCancelled", batchesCancelled.sum());
        metrics.put("attempts", attempts);
        metrics.put("attemptAverageLatencyMs", avgLatencyMs);
        metrics.put("jobsSucceeded", jobsSucceeded.sum());
        metrics.put("jobsFailed", jobsFailed.sum());
        metrics.put("retriesScheduled", retriesScheduled.sum());
        metrics.put("throttledCalls", throttledCalls.sum());
        metrics.put("attemptTimeouts", attemptTimeouts.sum());
        metrics.put("scoringRetries", scoringRetries.sum());
        return metrics;
    }
}
