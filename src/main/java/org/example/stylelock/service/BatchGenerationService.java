package org.example.stylelock.service;

import jakarta.annotation.PreDestroy;
import org.example.stylelock.model.AssetCategory;
import org.example.stylelock.model.BatchRequest;
import org.example.stylelock.model.BatchRun;
import org.example.stylelock.model.BatchStatus;
import org.example.stylelock.model.BatchSummary;
import org.example.stylelock.model.BatchThresholds;
import org.example.stylelock.model.GenerationJob;
import org.example.stylelock.model.JobSpec;
import org.example.stylelock.model.JobStatus;
import org.example.stylelock.model.LockedStyleRecord;
import org.example.stylelock.service.style.InvalidParameterException;
import org.example.stylelock.service.style.LockedStyleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for batch runs: validates the request, pins the project's approved locked
 * style to the batch, hands the jobs to the {@link RequestScheduler} and serves reports.
 */
@Service
public class BatchGenerationService {

    private static final Logger log = LoggerFactory.getLogger(BatchGenerationService.class);

    public static final int MAX_JOBS_PER_BATCH = 200;
    public static final int MAX_PROMPT_LENGTH = 2000;

    private final LockedStyleService lockedStyleService;
    private final RequestScheduler requestScheduler;
    private final RetryController retryController;
    private final BatchAggregator batchAggregator;
    private final GenerationMetricsService metricsService;
    private final BatchThresholds defaultThresholds;
    private final ConcurrentHashMap<String, BatchExecution> batches = new ConcurrentHashMap<>();

    public BatchGenerationService(
            LockedStyleService lockedStyleService,
            RequestScheduler requestScheduler,
            RetryController retryController,
            BatchAggregator batchAggregator,
            GenerationMetricsService metricsService,
            @Value("${batch.thresholds.per-asset:8.5}") double perAssetThreshold,
            @Value("${batch.thresholds.batch:9.0}") double batchThreshold) {
        this.lockedStyleService = lockedStyleService;
        this.requestScheduler = requestScheduler;
        this.retryController = retryController;
        this.batchAggregator = batchAggregator;
        this.metricsService = metricsService;
        this.defaultThresholds = new BatchThresholds(perAssetThreshold, batchThreshold);
    }

    /**
     * Validate and start a batch.
     *
     * @return the batch in {@link BatchStatus#RUNNING} state
     * @throws org.example.stylelock.service.style.MissingLockException when the project has no
     *         approved locked style; no jobs are created in that case
     * @throws InvalidParameterException when the request is malformed
     */
    public BatchRun submitBatch(BatchRequest request) {
        if (request == null) {
            throw new InvalidParameterException("request", "is required");
        }
        List<ValidatedJob> validatedJobs = validateJobs(request.jobs());
        BatchThresholds thresholds = request.thresholds() != null ? request.thresholds() : defaultThresholds;
        int concurrency = resolveConcurrency(request.maxConcurrent());

        LockedStyleRecord style = lockedStyleService.requireApproved(request.projectId());

        String batchId = UUID.randomUUID().toString();
        int maxAttempts = retryController.getRetryPolicy().maxAttempts();
        List<GenerationJob> jobs = new ArrayList<>(validatedJobs.size());
        for (ValidatedJob validated : validatedJobs) {
            jobs.add(GenerationJob.pending(UUID.randomUUID().toString(), validated.category(),
                    validated.prompt(), style.config(), maxAttempts));
        }

        BatchExecution execution = new BatchExecution(batchId, style.projectId(), style.config(),
                style.baselineRef(), thresholds, concurrency, jobs);
        batches.put(batchId, execution);
        metricsService.recordBatchSubmitted();
        log.info("Batch {} submitted for project {}: {} jobs, style v{}, concurrency {}, thresholds {}/{}",
                batchId, style.projectId(), jobs.size(), style.version(), concurrency,
                thresholds.perAsset(), thresholds.batch());

        BatchRun started = toBatchRun(execution);
        requestScheduler.start(execution, this::onBatchFinished);
        return started;
    }

    public Optional<BatchRun> getBatchReport(String batchId) {
        BatchExecution execution = batchId == null ? null : batches.get(batchId);
        if (execution == null) {
            return Optional.empty();
        }
        return Optional.of(toBatchRun(execution));
    }

    public List<BatchRun> listBatches(String projectId) {
        return batches.values().stream()
                .filter(execution -> projectId == null || projectId.isBlank()
                        || execution.getProjectId().equals(projectId.trim()))
                .sorted(Comparator.comparing(BatchExecution::getStartedAt).reversed())
                .map(this::toBatchRun)
                .toList();
    }

    /**
     * Block until the batch finishes or the timeout elapses, then return its report.
     */
    public Optional<BatchRun> awaitCompletion(String batchId, Duration timeout) throws InterruptedException {
        BatchExecution execution = batchId == null ? null : batches.get(batchId);
        if (execution == null) {
            return Optional.empty();
        }
        if (!execution.awaitFinished(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.debug("Batch {} still running after {}", batchId, timeout);
        }
        return Optional.of(toBatchRun(execution));
    }

    /**
     * Stop dispatching new jobs. In-flight attempts finish; queued jobs stay pending.
     */
    public Optional<BatchRun> cancelBatch(String batchId) {
        BatchExecution execution = batchId == null ? null : batches.get(batchId);
        if (execution == null) {
            return Optional.empty();
        }
        if (!execution.isFinished() && execution.requestCancel()) {
            log.info("Cancellation requested for batch {} ({} in flight)", batchId, execution.getInFlight());
        }
        return Optional.of(toBatchRun(execution));
    }

    @PreDestroy
    public void shutdown() {
        batches.values().forEach(BatchExecution::shutdownNow);
    }

    private void onBatchFinished(BatchExecution execution) {
        BatchRun report = toBatchRun(execution);
        metricsService.recordBatchCompleted(report.status() == BatchStatus.CANCELLED);
        BatchSummary summary = report.summary();
        log.info("Batch {} finished as {}: {} succeeded, {} failed consistency, {} failed permanently, "
                        + "{} pending, aggregate score {}, peak in flight {}",
                report.batchId(), report.status(),
                summary.count(JobStatus.SUCCEEDED),
                summary.count(JobStatus.FAILED_CONSISTENCY),
                summary.count(JobStatus.FAILED_PERMANENT),
                summary.count(JobStatus.PENDING),
                String.format("%.2f", report.aggregateScore()),
                summary.peakInFlight());
    }

    private BatchRun toBatchRun(BatchExecution execution) {
        // finished is read before the snapshot: job updates happen before the finish latch opens
        boolean finished = execution.isFinished();
        boolean cancelRequested = execution.isCancelRequested();
        List<GenerationJob> jobs = execution.snapshotJobs();
        BatchSummary summary = batchAggregator.summarize(jobs, execution.getPeakInFlight());
        return new BatchRun(
                execution.getBatchId(),
                execution.getProjectId(),
                execution.getConfig(),
                execution.getThresholds(),
                jobs,
                batchAggregator.aggregateScore(jobs),
                summary,
                execution.getStartedAt(),
                finished ? execution.getCompletedAt() : null,
                resolveStatus(finished, cancelRequested, jobs, execution.getThresholds()),
                cancelRequested
        );
    }

    private BatchStatus resolveStatus(boolean finished, boolean cancelRequested,
                                      List<GenerationJob> jobs, BatchThresholds thresholds) {
        if (!finished) {
            return BatchStatus.RUNNING;
        }
        boolean allTerminal = jobs.stream().allMatch(GenerationJob::isTerminal);
        if (cancelRequested && !allTerminal) {
            return BatchStatus.CANCELLED;
        }
        return batchAggregator.verdict(jobs, thresholds);
    }

    private int resolveConcurrency(Integer requested) {
        if (requested == null) {
            return requestScheduler.getDefaultConcurrency();
        }
        if (requested < 1 || requested > RequestScheduler.MAX_CONCURRENCY) {
            throw new InvalidParameterException("maxConcurrent",
                    "must be between 1 and " + RequestScheduler.MAX_CONCURRENCY);
        }
        return requested;
    }

    private List<ValidatedJob> validateJobs(List<JobSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new InvalidParameterException("jobs", "at least one job is required");
        }
        if (specs.size() > MAX_JOBS_PER_BATCH) {
            throw new InvalidParameterException("jobs", "at most " + MAX_JOBS_PER_BATCH + " jobs per batch");
        }
        List<ValidatedJob> validated = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            JobSpec spec = specs.get(i);
            String field = "jobs[" + i + "]";
            if (spec == null) {
                throw new InvalidParameterException(field, "is required");
            }
            AssetCategory category = AssetCategory.fromLabel(spec.category())
                    .orElseThrow(() -> new InvalidParameterException(field + ".category",
                            "unknown category '" + spec.category() + "'"));
            String prompt = spec.prompt() == null ? "" : spec.prompt().trim();
            if (prompt.isEmpty()) {
                throw new InvalidParameterException(field + ".prompt", "is required");
            }
            if (prompt.length() > MAX_PROMPT_LENGTH) {
                throw new InvalidParameterException(field + ".prompt",
                        "must be at most " + MAX_PROMPT_LENGTH + " characters");
            }
            validated.add(new ValidatedJob(category, prompt));
        }
        return validated;
    }

    private record ValidatedJob(AssetCategory category, String prompt) {}
}
