package org.example.stylelock.service;

import org.example.stylelock.model.BatchThresholds;
import org.example.stylelock.model.GenerationJob;
import org.example.stylelock.model.LockedStyleConfig;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live state of one batch run: the job ledger, the work queue and the in-flight counters.
 * Each job key is written by one worker at a time; readers take snapshots.
 */
public final class BatchExecution {

    private final String batchId;
    private final String projectId;
    private final LockedStyleConfig config;
    private final String baselineRef;
    private final BatchThresholds thresholds;
    private final int concurrency;
    private final LocalDateTime startedAt;
    private final List<String> jobOrder;
    private final ConcurrentHashMap<String, GenerationJob> jobs = new ConcurrentHashMap<>();
    private final LinkedBlockingQueue<String> workQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile LocalDateTime completedAt;
    private volatile ExecutorService workers;

    public BatchExecution(String batchId, String projectId, LockedStyleConfig config, String baselineRef,
                          BatchThresholds thresholds, int concurrency, List<GenerationJob> initialJobs) {
        this.batchId = batchId;
        this.projectId = projectId;
        this.config = config;
        this.baselineRef = baselineRef;
        this.thresholds = thresholds;
        this.concurrency = concurrency;
        this.startedAt = LocalDateTime.now();
        List<String> order = new ArrayList<>();
        for (GenerationJob job : initialJobs) {
            order.add(job.jobId());
            jobs.put(job.jobId(), job);
            workQueue.add(job.jobId());
        }
        this.jobOrder = List.copyOf(order);
    }

    public String getBatchId() {
        return batchId;
    }

    public String getProjectId() {
        return projectId;
    }

    public LockedStyleConfig getConfig() {
        return config;
    }

    public String getBaselineRef() {
        return baselineRef;
    }

    public BatchThresholds getThresholds() {
        return thresholds;
    }

    /**
     * Upper bound on jobs in flight at once for this batch.
     */
    public int getConcurrency() {
        return concurrency;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public int getJobCount() {
        return jobOrder.size();
    }

    /**
     * Jobs in submission order.
     */
    public List<GenerationJob> snapshotJobs() {
        List<GenerationJob> snapshot = new ArrayList<>(jobOrder.size());
        for (String jobId : jobOrder) {
            snapshot.add(jobs.get(jobId));
        }
        return snapshot;
    }

    public GenerationJob getJob(String jobId) {
        return jobs.get(jobId);
    }

    void updateJob(GenerationJob job) {
        jobs.put(job.jobId(), job);
    }

    String nextQueuedJob() {
        return workQueue.poll();
    }

    void enqueue(String jobId) {
        workQueue.add(jobId);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * @return true if this call flipped the flag
     */
    boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    void markInFlight() {
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
    }

    void markLanded() {
        inFlight.decrementAndGet();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getPeakInFlight() {
        return peakInFlight.get();
    }

    void attachWorkers(ExecutorService workers) {
        this.workers = workers;
    }

    void markFinished() {
        this.completedAt = LocalDateTime.now();
        finished.countDown();
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    void shutdownNow() {
        ExecutorService current = workers;
        if (current != null) {
            current.shutdownNow();
        }
    }
}
