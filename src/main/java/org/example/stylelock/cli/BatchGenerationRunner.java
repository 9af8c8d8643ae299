package org.example.stylelock.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.stylelock.model.BatchRequest;
import org.example.stylelock.model.BatchRun;
import org.example.stylelock.model.BatchStatus;
import org.example.stylelock.model.CategoryBreakdown;
import org.example.stylelock.model.GenerationJob;
import org.example.stylelock.model.JobStatus;
import org.example.stylelock.service.BatchGenerationService;
import org.example.stylelock.service.style.StyleConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Command-line runner that generates one batch from a JSON request file and waits for it.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=style-batch -Dspring-boot.run.arguments=--style-batch.input=batch.json
 * Or: java -jar target/style-lock.jar --spring.profiles.active=style-batch --style-batch.input=batch.json
 *
 * Exit code 0 when the batch succeeds, 1 on partial failure, 2 on failure or a rejected request.
 */
@Component
@Profile("style-batch")
public class BatchGenerationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchGenerationRunner.class);

    static final int EXIT_SUCCEEDED = 0;
    static final int EXIT_PARTIAL_FAILURE = 1;
    static final int EXIT_FAILED = 2;

    private final BatchGenerationService batchGenerationService;
    private final ApplicationContext applicationContext;
    private final String inputPath;
    private final Duration awaitTimeout;
    private final boolean exitOnComplete;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public BatchGenerationRunner(
            BatchGenerationService batchGenerationService,
            ApplicationContext applicationContext,
            @Value("${style-batch.input:batch.json}") String inputPath,
            @Value("${style-batch.await-timeout-minutes:120}") long awaitTimeoutMinutes,
            @Value("${style-batch.exit-on-complete:true}") boolean exitOnComplete) {
        this.batchGenerationService = batchGenerationService;
        this.applicationContext = applicationContext;
        this.inputPath = inputPath;
        this.awaitTimeout = Duration.ofMinutes(Math.max(1, awaitTimeoutMinutes));
        this.exitOnComplete = exitOnComplete;
    }

    @Override
    public void run(String... args) throws Exception {
        int exitCode = runBatch(Paths.get(inputPath));
        if (exitOnComplete) {
            System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
        }
    }

    int runBatch(Path input) throws IOException, InterruptedException {
        log.info("========================================");
        log.info("Locked-Style Batch Runner");
        log.info("========================================");
        if (!Files.exists(input)) {
            log.error("Batch request file not found: {}", input.toAbsolutePath());
            return EXIT_FAILED;
        }

        BatchRequest request = objectMapper.readValue(input.toFile(), BatchRequest.class);
        BatchRun submitted;
        try {
            submitted = batchGenerationService.submitBatch(request);
        } catch (StyleConfigurationException e) {
            log.error("Batch rejected: {}", e.getMessage());
            return EXIT_FAILED;
        }
        log.info("Batch {} started for project {} ({} jobs, style v{})",
                submitted.batchId(), submitted.projectId(), submitted.jobs().size(), submitted.config().version());

        BatchRun finished = batchGenerationService.awaitCompletion(submitted.batchId(), awaitTimeout)
                .orElseThrow(() -> new IllegalStateException("Batch disappeared: " + submitted.batchId()));
        if (finished.status() == BatchStatus.RUNNING) {
            log.warn("Batch {} still running after {}; cancelling", finished.batchId(), awaitTimeout);
            batchGenerationService.cancelBatch(finished.batchId());
            finished = batchGenerationService.awaitCompletion(finished.batchId(), Duration.ofMinutes(10))
                    .orElse(finished);
        }

        logSummary(finished);
        return exitCodeFor(finished.status());
    }

    static int exitCodeFor(BatchStatus status) {
        return switch (status) {
            case SUCCEEDED -> EXIT_SUCCEEDED;
            case PARTIAL_FAILURE -> EXIT_PARTIAL_FAILURE;
            default -> EXIT_FAILED;
        };
    }

    private void logSummary(BatchRun batch) {
        log.info("");
        log.info("========================================");
        log.info("BATCH COMPLETE - SUMMARY");
        log.info("========================================");
        for (GenerationJob job : batch.jobs()) {
            String status = job.status() == JobStatus.SUCCEEDED ? "OK" : job.status().name();
            log.info("[{}] {} '{}' - {} attempt(s), score {}",
                    status, job.category(), abbreviate(job.prompt()), job.attemptCount(),
                    job.latestScore() == null ? "-" : String.format("%.2f", job.latestScore()));
        }
        log.info("----------------------------------------");
        batch.summary().categories().forEach((category, breakdown) -> logCategory(category.name(), breakdown));
        log.info("Aggregate score: {} (batch threshold {})",
                String.format("%.2f", batch.aggregateScore()), batch.thresholds().batch());
        log.info("Verdict: {}", batch.status());
        log.info("========================================");
    }

    private void logCategory(String category, CategoryBreakdown breakdown) {
        log.info("{}: {}/{} succeeded, {} failed, mean score {}",
                category, breakdown.succeeded(), breakdown.total(), breakdown.failed(),
                String.format("%.2f", breakdown.meanScore()));
    }

    private String abbreviate(String prompt) {
        return prompt.length() <= 50 ? prompt : prompt.substring(0, 47) + "...";
    }
}
