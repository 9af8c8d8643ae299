package org.example.stylelock.service;

import org.example.stylelock.model.AssetCategory;
import org.example.stylelock.model.BatchStatus;
import org.example.stylelock.model.BatchThresholds;
import org.example.stylelock.model.GenerationJob;
import org.example.stylelock.model.GenerationRequest;
import org.example.stylelock.model.JobStatus;
import org.example.stylelock.model.LockedStyleConfig;
import org.example.stylelock.service.generation.InvalidRequestException;
import org.example.stylelock.service.generation.ServiceUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class RequestSchedulerTest {

    private static final LockedStyleConfig CONFIG = new LockedStyleConfig(
            "falcon-run", 1, "model_pixel_v2", 30, 7.0, 42L, 512, 512,
            "pixel art, warm desert palette", LocalDateTime.of(2026, 3, 1, 12, 0));

    private final BatchAggregator aggregator = new BatchAggregator();
    private final GenerationMetricsService metricsService = new GenerationMetricsService();
    private final List<RequestScheduler> schedulers = new ArrayList<>();

    @AfterEach
    void tearDown() {
        schedulers.forEach(RequestScheduler::shutdown);
    }

    @Test
    void start_allJobsPassFirstAttempt_batchSucceedsWithinConcurrency() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient().defaultScore(9.0).workMillis(20);
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(2, 3, "knight", "archer", "mage", "rogue");

        runToCompletion(scheduler, execution);

        List<GenerationJob> jobs = execution.snapshotJobs();
        for (GenerationJob job : jobs) {
            assertEquals(JobStatus.SUCCEEDED, job.status());
            assertEquals(1, job.attemptCount());
        }
        assertTrue(execution.getPeakInFlight() <= 2);
        assertTrue(client.peakActive() <= 2);
        assertEquals(9.0, aggregator.aggregateScore(jobs), 1e-9);
        assertEquals(BatchStatus.SUCCEEDED, aggregator.verdict(jobs, BatchThresholds.defaults()));
    }

    @Test
    void start_lowScoreThenPass_retriesWithIdenticalParameters() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient().scores("knight", 7.0, 9.2);
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(2, 3, "knight");

        runToCompletion(scheduler, execution);

        GenerationJob job = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.SUCCEEDED, job.status());
        assertEquals(2, job.attemptCount());
        assertEquals(9.2, job.latestScore(), 1e-9);
        assertEquals(2, job.scoreHistory().size());
        assertSame(CONFIG, job.config());

        List<GenerationRequest> submissions = client.submissionsFor("knight");
        assertEquals(2, submissions.size());
        assertEquals(submissions.get(0), submissions.get(1));
        assertEquals("knight, pixel art, warm desert palette", submissions.get(0).prompt());
        assertEquals(42L, submissions.get(0).seed());
    }

    @Test
    void start_lowScoreOnEveryAttempt_failsConsistencyAndBlocksSuccessVerdict() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient()
                .defaultScore(9.5)
                .scores("goblin", 7.0, 7.0, 7.0);
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(2, 3, "goblin", "oasis", "palm");

        runToCompletion(scheduler, execution);

        GenerationJob goblin = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.FAILED_CONSISTENCY, goblin.status());
        assertEquals(3, goblin.attemptCount());
        assertEquals(3, client.submissionsFor("goblin").size());
        assertNotEquals(BatchStatus.SUCCEEDED, aggregator.verdict(execution.snapshotJobs(), BatchThresholds.defaults()));
    }

    @Test
    void start_permanentRejection_failsAfterOneAttempt() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient()
                .failSubmit("banner", new InvalidRequestException("unsupported model", 400));
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(1, 3, "banner", "shield");

        runToCompletion(scheduler, execution);

        GenerationJob banner = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.FAILED_PERMANENT, banner.status());
        assertEquals(1, banner.attemptCount());
        assertEquals(1, client.submissionsFor("banner").size());
        assertEquals(JobStatus.SUCCEEDED, execution.snapshotJobs().get(1).status());
        assertEquals(BatchStatus.PARTIAL_FAILURE,
                aggregator.verdict(execution.snapshotJobs(), new BatchThresholds(8.5, 9.0)));
    }

    @Test
    void start_throttledSubmits_backOffWithoutConsumingAttempts() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient()
                .failSubmit("castle",
                        new ServiceUnavailableException("429", true, Duration.ofSeconds(60)),
                        new ServiceUnavailableException("503", false, null));
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(1, 3, "castle");

        runToCompletion(scheduler, execution);

        GenerationJob castle = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.SUCCEEDED, castle.status());
        assertEquals(1, castle.attemptCount());
        assertEquals(3, client.submissionsFor("castle").size());
        assertEquals(2L, metricsService.snapshot().get("throttledCalls"));
    }

    @Test
    void start_throttledPoll_keepsHandleWithoutConsumingAttempts() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient()
                .defaultScore(9.5)
                .failPoll("tower",
                        new ServiceUnavailableException("429", true, Duration.ofMillis(1)),
                        new ServiceUnavailableException("502", false, null));
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(1, 3, "tower");

        runToCompletion(scheduler, execution);

        GenerationJob tower = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.SUCCEEDED, tower.status());
        assertEquals(1, tower.attemptCount());
        assertEquals(1, client.submissionsFor("tower").size());
        assertEquals(2L, metricsService.snapshot().get("throttledCalls"));
    }

    @Test
    void start_pollThrottledBeyondRetries_failsAttemptAsTransient() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient()
                .defaultScore(9.5)
                .failPoll("tower",
                        new ServiceUnavailableException("503", false, null),
                        new ServiceUnavailableException("503", false, null));
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 1);
        BatchExecution execution = execution(1, 3, "tower");

        runToCompletion(scheduler, execution);

        GenerationJob tower = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.SUCCEEDED, tower.status());
        assertEquals(2, tower.attemptCount());
        assertEquals(2, client.submissionsFor("tower").size());
    }

    @Test
    void start_transientFailuresBeyondBudget_failPermanently() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient()
                .failSubmit("tower",
                        new ServiceUnavailableException("503", false, null),
                        new ServiceUnavailableException("503", false, null),
                        new ServiceUnavailableException("503", false, null));
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 0);
        BatchExecution execution = execution(1, 3, "tower");

        runToCompletion(scheduler, execution);

        GenerationJob tower = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.FAILED_PERMANENT, tower.status());
        assertEquals(3, tower.attemptCount());
    }

    @Test
    void start_transientFailureThenSuccess_succeedsOnLaterAttempt() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient()
                .failSubmit("bridge", new ServiceUnavailableException("503", false, null));
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 0);
        BatchExecution execution = execution(1, 3, "bridge");

        runToCompletion(scheduler, execution);

        GenerationJob bridge = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.SUCCEEDED, bridge.status());
        assertEquals(2, bridge.attemptCount());
    }

    @Test
    void start_scorerOutageWithinBudget_rescoresWithoutRegenerating() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient().failScoring("lantern", 2);
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(1, 3, "lantern");

        runToCompletion(scheduler, execution);

        GenerationJob lantern = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.SUCCEEDED, lantern.status());
        assertEquals(1, lantern.attemptCount());
        assertEquals(1, client.submissionsFor("lantern").size());
    }

    @Test
    void start_scorerOutageBeyondBudget_failsPermanently() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient().failScoring("lantern", 3);
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(1, 3, "lantern");

        runToCompletion(scheduler, execution);

        GenerationJob lantern = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.FAILED_PERMANENT, lantern.status());
        assertEquals(1, lantern.attemptCount());
    }

    @Test
    void start_attemptExceedsTimeout_countsAsTransientFailure() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient().workMillis(1_000);
        RequestScheduler scheduler = scheduler(client, 2, 50L, 3);
        BatchExecution execution = execution(1, 2, "dune");

        runToCompletion(scheduler, execution);

        GenerationJob dune = execution.snapshotJobs().get(0);
        assertEquals(JobStatus.FAILED_PERMANENT, dune.status());
        assertEquals(2, dune.attemptCount());
        assertTrue(dune.lastError().contains("timed out"));
    }

    @Test
    void start_manyJobs_neverExceedConcurrency() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient().workMillis(10);
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        String[] descriptions = new String[12];
        for (int i = 0; i < descriptions.length; i++) {
            descriptions[i] = "crate " + i;
        }
        BatchExecution execution = execution(3, 3, descriptions);

        runToCompletion(scheduler, execution);

        assertTrue(execution.getPeakInFlight() <= 3, "peak " + execution.getPeakInFlight());
        assertTrue(client.peakActive() <= 3, "client peak " + client.peakActive());
        assertEquals(0, execution.getInFlight());
        assertTrue(execution.snapshotJobs().stream().allMatch(job -> job.status() == JobStatus.SUCCEEDED));
    }

    @Test
    void start_retriesOfSeveralJobs_runInParallel() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient()
                .workMillis(60)
                .scores("ember", 7.0, 9.5)
                .scores("frost", 7.0, 9.5);
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(2, 3, "ember", "frost");

        runToCompletion(scheduler, execution);

        assertTrue(execution.snapshotJobs().stream()
                .allMatch(job -> job.status() == JobStatus.SUCCEEDED && job.attemptCount() == 2));
        assertEquals(2, client.peakActiveOnResubmit());
    }

    @Test
    void start_cancelledBatch_stopsDispatchAndLeavesQueuedJobsPending() throws Exception {
        ScriptedGenerationClient client = new ScriptedGenerationClient().workMillis(200);
        RequestScheduler scheduler = scheduler(client, 3, 5_000L, 3);
        BatchExecution execution = execution(1, 3, "a1", "a2", "a3", "a4", "a5");
        AtomicInteger finishedCalls = new AtomicInteger();

        scheduler.start(execution, finished -> finishedCalls.incrementAndGet());
        waitForInFlight(execution, 2_000L);
        execution.requestCancel();

        assertTrue(execution.awaitFinished(5, TimeUnit.SECONDS));
        long pending = execution.snapshotJobs().stream()
                .filter(job -> job.status() == JobStatus.PENDING && job.attemptCount() == 0)
                .count();
        assertTrue(pending >= 3, "pending " + pending);
        assertTrue(client.submissions().size() <= 2);
        waitForCount(finishedCalls, 1, 2_000L);
        assertEquals(1, finishedCalls.get());
    }

    @Test
    void backoffDelayMs_growsExponentiallyAndRespectsCap() {
        RequestScheduler scheduler = new RequestScheduler(new ScriptedGenerationClient(),
                new ConsistencyGate(new ScriptedGenerationClient().scorer(), metricsService, 0, 0),
                new RetryController(3), metricsService, 5, 1_000L, 1L, 100L, 1_000L, 5);
        schedulers.add(scheduler);

        assertEquals(100L, scheduler.backoffDelayMs(1, null));
        assertEquals(200L, scheduler.backoffDelayMs(2, null));
        assertEquals(800L, scheduler.backoffDelayMs(4, null));
        assertEquals(1_000L, scheduler.backoffDelayMs(5, null));
        assertEquals(300L, scheduler.backoffDelayMs(1, Duration.ofMillis(300)));
        assertEquals(1_000L, scheduler.backoffDelayMs(1, Duration.ofSeconds(60)));
    }

    private RequestScheduler scheduler(ScriptedGenerationClient client, int maxAttempts,
                                       long jobTimeoutMs, int maxThrottleRetries) {
        ConsistencyGate gate = new ConsistencyGate(client.scorer(), metricsService, 2, 1L);
        RequestScheduler scheduler = new RequestScheduler(client, gate, new RetryController(maxAttempts),
                metricsService, 5, jobTimeoutMs, 1L, 1L, 5L, maxThrottleRetries);
        schedulers.add(scheduler);
        return scheduler;
    }

    private BatchExecution execution(int concurrency, int maxAttempts, String... descriptions) {
        List<GenerationJob> jobs = new ArrayList<>();
        for (int i = 0; i < descriptions.length; i++) {
            jobs.add(GenerationJob.pending("job-" + i, AssetCategory.CHARACTER, descriptions[i], CONFIG, maxAttempts));
        }
        return new BatchExecution("batch-1", CONFIG.projectId(), CONFIG, "falcon-run/baseline",
                BatchThresholds.defaults(), concurrency, jobs);
    }

    private void runToCompletion(RequestScheduler scheduler, BatchExecution execution) throws InterruptedException {
        scheduler.start(execution, finished -> { });
        assertTrue(execution.awaitFinished(10, TimeUnit.SECONDS), "batch did not finish");
    }

    private void waitForCount(AtomicInteger counter, int expected, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (counter.get() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(5L);
        }
    }

    private void waitForInFlight(BatchExecution execution, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (execution.getInFlight() > 0) {
                return;
            }
            Thread.sleep(5L);
        }
        fail("No job went in flight within " + timeoutMs + "ms");
    }
}
