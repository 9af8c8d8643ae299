package org.example.stylelock.service;

import jakarta.annotation.PreDestroy;
import org.example.stylelock.model.AttemptOutcome;
import org.example.stylelock.model.ConsistencyScore;
import org.example.stylelock.model.GeneratedArtifact;
import org.example.stylelock.model.GenerationJob;
import org.example.stylelock.model.GenerationProgress;
import org.example.stylelock.model.GenerationRequest;
import org.example.stylelock.model.GenerationResult;
import org.example.stylelock.model.JobStatus;
import org.example.stylelock.model.RetryDecision;
import org.example.stylelock.service.generation.FailureKind;
import org.example.stylelock.service.generation.GenerationClient;
import org.example.stylelock.service.generation.GenerationServiceException;
import org.example.stylelock.service.generation.ServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Dispatches the jobs of a batch to the generation service. Each batch gets its own pool
 * of at most {@code concurrency} workers draining the batch's queue, so no more than that
 * many jobs are ever in flight. Jobs that are retried go back to the tail of the queue.
 */
@Service
public class RequestScheduler {

    private static final Logger log = LoggerFactory.getLogger(RequestScheduler.class);

    public static final int MAX_CONCURRENCY = 10;
    public static final String MDC_BATCH_ID = "batchId";
    public static final String MDC_JOB_ID = "jobId";

    private static final long MAX_POLL_INTERVAL_MS = 30_000L;
    private static final int POLLS_PER_INTERVAL_STEP = 10;

    private final GenerationClient generationClient;
    private final ConsistencyGate consistencyGate;
    private final RetryController retryController;
    private final GenerationMetricsService metricsService;
    private final int defaultConcurrency;
    private final long jobTimeoutMs;
    private final long pollIntervalMs;
    private final long backoffBaseMs;
    private final long backoffMaxMs;
    private final int maxThrottleRetries;
    private final ExecutorService attemptExecutor;

    public RequestScheduler(
            GenerationClient generationClient,
            ConsistencyGate consistencyGate,
            RetryController retryController,
            GenerationMetricsService metricsService,
            @Value("${generation.max-concurrent:5}") int defaultConcurrency,
            @Value("${generation.job-timeout-ms:300000}") long jobTimeoutMs,
            @Value("${generation.poll-interval-ms:2000}") long pollIntervalMs,
            @Value("${generation.backoff.base-ms:1000}") long backoffBaseMs,
            @Value("${generation.backoff.max-ms:30000}") long backoffMaxMs,
            @Value("${generation.backoff.max-throttle-retries:5}") int maxThrottleRetries) {
        this.generationClient = generationClient;
        this.consistencyGate = consistencyGate;
        this.retryController = retryController;
        this.metricsService = metricsService;
        this.defaultConcurrency = clampConcurrency(defaultConcurrency);
        this.jobTimeoutMs = Math.max(1, jobTimeoutMs);
        this.pollIntervalMs = Math.max(1, pollIntervalMs);
        this.backoffBaseMs = Math.max(1, backoffBaseMs);
        this.backoffMaxMs = Math.max(this.backoffBaseMs, backoffMaxMs);
        this.maxThrottleRetries = Math.max(0, maxThrottleRetries);
        this.attemptExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("style-attempt-"));
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public static int clampConcurrency(int requested) {
        return Math.max(1, Math.min(MAX_CONCURRENCY, requested));
    }

    /**
     * Start dispatching a batch and return immediately. {@code onFinished} runs once, on the
     * last worker thread, after every job is terminal or the batch was cancelled and drained.
     */
    public void start(BatchExecution execution, Consumer<BatchExecution> onFinished) {
        int workerCount = Math.min(execution.getConcurrency(), execution.getJobCount());
        if (workerCount <= 0) {
            execution.markFinished();
            onFinished.accept(execution);
            return;
        }

        ExecutorService workers = Executors.newFixedThreadPool(workerCount,
                new NamedThreadFactory("style-batch-" + shortId(execution.getBatchId()) + "-"));
        execution.attachWorkers(workers);
        AtomicInteger activeWorkers = new AtomicInteger(workerCount);
        log.info("Dispatching batch {} with {} jobs on {} workers",
                execution.getBatchId(), execution.getJobCount(), workerCount);
        for (int i = 0; i < workerCount; i++) {
            workers.submit(() -> runWorker(execution, activeWorkers, onFinished));
        }
        workers.shutdown();
    }

    @PreDestroy
    public void shutdown() {
        attemptExecutor.shutdownNow();
    }

    private void runWorker(BatchExecution execution, AtomicInteger activeWorkers,
                           Consumer<BatchExecution> onFinished) {
        MDC.put(MDC_BATCH_ID, execution.getBatchId());
        try {
            // a retried job is queued again by its own worker before that worker polls,
            // so an empty queue means every unfinished job is held by a live worker
            String jobId;
            while (!execution.isCancelRequested() && (jobId = execution.nextQueuedJob()) != null) {
                processJob(execution, jobId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker for batch {} interrupted", execution.getBatchId());
        } finally {
            MDC.remove(MDC_BATCH_ID);
            if (activeWorkers.decrementAndGet() == 0) {
                execution.markFinished();
                try {
                    onFinished.accept(execution);
                } catch (RuntimeException e) {
                    log.error("Batch {} completion handler failed", execution.getBatchId(), e);
                }
            }
        }
    }

    private void processJob(BatchExecution execution, String jobId) throws InterruptedException {
        GenerationJob queued = execution.getJob(jobId);
        GenerationJob job = queued.startAttempt();
        execution.updateJob(job);
        execution.markInFlight();
        MDC.put(MDC_JOB_ID, jobId);
        long startedAt = System.currentTimeMillis();
        try {
            AttemptOutcome outcome = runAttemptWithTimeout(execution, job);
            RetryDecision decision = retryController.decide(job, outcome);
            GenerationJob next = retryController.apply(job, outcome, decision);
            execution.updateJob(next);
            recordDecision(job, decision);
            if (decision.retry()) {
                execution.enqueue(jobId);
            }
        } catch (InterruptedException e) {
            // the attempt never finished; leave the job as it was before dispatch
            execution.updateJob(queued);
            throw e;
        } finally {
            execution.markLanded();
            metricsService.recordAttempt(System.currentTimeMillis() - startedAt);
            MDC.remove(MDC_JOB_ID);
        }
    }

    private void recordDecision(GenerationJob job, RetryDecision decision) {
        if (decision.retry()) {
            metricsService.recordRetryScheduled();
            log.warn("Job {} attempt {}/{} will be retried: {}",
                    job.jobId(), job.attemptCount(), job.maxAttempts(), decision.reason());
        } else if (decision.nextStatus() == JobStatus.SUCCEEDED) {
            metricsService.recordJobSucceeded();
            log.info("Job {} accepted on attempt {}: {}", job.jobId(), job.attemptCount(), decision.reason());
        } else {
            metricsService.recordJobFailed();
            log.warn("Job {} finished as {} after {} attempt(s): {}",
                    job.jobId(), decision.nextStatus(), job.attemptCount(), decision.reason());
        }
    }

    private AttemptOutcome runAttemptWithTimeout(BatchExecution execution, GenerationJob job)
            throws InterruptedException {
        Map<String, String> context = MDC.getCopyOfContextMap();
        Future<AttemptOutcome> future = attemptExecutor.submit(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return runAttempt(execution, job);
            } finally {
                MDC.clear();
            }
        });

        try {
            return future.get(jobTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metricsService.recordAttemptTimeout();
            return AttemptOutcome.serviceFailure(GenerationResult.failure(
                    job.jobId(), job.attemptCount(), "timeout", Duration.ofMillis(jobTimeoutMs),
                    "Attempt timed out after " + jobTimeoutMs + "ms", FailureKind.TRANSIENT));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Unexpected failure in job {} attempt {}", job.jobId(), job.attemptCount(), cause);
            return AttemptOutcome.serviceFailure(GenerationResult.failure(
                    job.jobId(), job.attemptCount(), "error", Duration.ZERO,
                    safeErrorMessage(cause), FailureKind.TRANSIENT));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private AttemptOutcome runAttempt(BatchExecution execution, GenerationJob job) throws InterruptedException {
        long started = System.nanoTime();
        GenerationRequest request = GenerationRequest.of(job.jobId(), job.prompt(), job.config());
        try {
            String handle = callWithBackoff(job, "Submit", () -> generationClient.submit(request));
            GenerationProgress progress = awaitTerminalProgress(job, handle);
            if (progress.state() == GenerationProgress.State.FAILED) {
                return AttemptOutcome.serviceFailure(GenerationResult.failure(
                        job.jobId(), job.attemptCount(), progress.state().name(), elapsed(started),
                        firstNonBlank(progress.errorMessage(), "Generation failed on the service"),
                        FailureKind.TRANSIENT));
            }

            GeneratedArtifact artifact = callWithBackoff(job, "Fetch", () -> generationClient.fetch(handle));
            GenerationResult result = GenerationResult.success(
                    job.jobId(), job.attemptCount(), artifact.artifactRef(), progress.state().name(), elapsed(started));
            try {
                ConsistencyScore score = consistencyGate.evaluate(job.jobId(), job.attemptCount(), artifact,
                        execution.getBaselineRef(), execution.getThresholds().perAsset());
                return AttemptOutcome.scored(result, score);
            } catch (ScoringExhaustedException e) {
                return AttemptOutcome.scoringExhausted(result, e.getMessage());
            }
        } catch (GenerationServiceException e) {
            return AttemptOutcome.serviceFailure(GenerationResult.failure(
                    job.jobId(), job.attemptCount(), e.getClass().getSimpleName(), elapsed(started),
                    safeErrorMessage(e), e.getFailureKind()));
        }
    }

    /**
     * Run one service call, backing off and repeating it while the service reports it is
     * throttled or unavailable. The generation handle is kept, so a busy poll never costs
     * the job an attempt.
     */
    private <T> T callWithBackoff(GenerationJob job, String operation, ServiceCall<T> call)
            throws GenerationServiceException, InterruptedException {
        int throttles = 0;
        while (true) {
            try {
                return call.execute();
            } catch (ServiceUnavailableException e) {
                if (throttles >= maxThrottleRetries) {
                    throw e;
                }
                throttles++;
                long delay = backoffDelayMs(throttles, e.getRetryAfter());
                metricsService.recordThrottled();
                log.warn("{} for job {} throttled ({}), backing off {}ms [{}/{}]",
                        operation, job.jobId(), e.getMessage(), delay, throttles, maxThrottleRetries);
                Thread.sleep(delay);
            }
        }
    }

    private GenerationProgress awaitTerminalProgress(GenerationJob job, String handle)
            throws GenerationServiceException, InterruptedException {
        long interval = pollIntervalMs;
        int polls = 0;
        while (true) {
            GenerationProgress progress = callWithBackoff(job, "Poll", () -> generationClient.poll(handle));
            if (progress.state() == GenerationProgress.State.COMPLETED
                    || progress.state() == GenerationProgress.State.FAILED) {
                return progress;
            }
            polls++;
            if (polls % POLLS_PER_INTERVAL_STEP == 0) {
                interval = Math.min((long) (interval * 1.2), Math.max(pollIntervalMs, MAX_POLL_INTERVAL_MS));
            }
            Thread.sleep(interval);
        }
    }

    /**
     * Exponential delay for the n-th throttled call, capped at the configured maximum.
     * A longer server-suggested wait wins, within the same cap.
     */
    long backoffDelayMs(int throttleNumber, Duration retryAfter) {
        long exponential = backoffBaseMs;
        for (int i = 1; i < throttleNumber && exponential < backoffMaxMs; i++) {
            exponential *= 2;
        }
        long delay = Math.min(exponential, backoffMaxMs);
        if (retryAfter != null) {
            delay = Math.max(delay, Math.min(retryAfter.toMillis(), backoffMaxMs));
        }
        return delay;
    }

    private Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static String shortId(String batchId) {
        return batchId.length() > 8 ? batchId.substring(0, 8) : batchId;
    }

    private String safeErrorMessage(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    private String firstNonBlank(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    @FunctionalInterface
    private interface ServiceCall<T> {
        T execute() throws GenerationServiceException;
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
