package org.example.stylelock.controller;

import org.example.stylelock.config.RequestCorrelation;
import org.example.stylelock.model.ApiError;
import org.example.stylelock.model.BatchRequest;
import org.example.stylelock.model.BatchRun;
import org.example.stylelock.service.BatchGenerationService;
import org.example.stylelock.service.style.InvalidParameterException;
import org.example.stylelock.service.style.MissingLockException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST endpoints for locked-style generation batches. Submission is asynchronous: the
 * response carries the batch id to poll.
 */
@RestController
@RequestMapping("/api/batches")
public class BatchController {

    private final BatchGenerationService batchGenerationService;

    public BatchController(BatchGenerationService batchGenerationService) {
        this.batchGenerationService = batchGenerationService;
    }

    @PostMapping
    public ResponseEntity<?> submitBatch(@RequestBody BatchRequest request) {
        try {
            BatchRun batch = batchGenerationService.submitBatch(request);
            return ResponseEntity.accepted().body(batch);
        } catch (MissingLockException e) {
            return ResponseEntity.status(HttpStatus.PRECONDITION_FAILED)
                    .body(new ApiError("missing_lock", null, e.getMessage(), RequestCorrelation.currentRequestId()));
        } catch (InvalidParameterException e) {
            return ResponseEntity.badRequest()
                    .body(new ApiError("invalid_parameter", e.getField(), e.getMessage(),
                            RequestCorrelation.currentRequestId()));
        }
    }

    @GetMapping
    public List<BatchRun> listBatches(@RequestParam(required = false) String projectId) {
        return batchGenerationService.listBatches(projectId);
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<BatchRun> getBatch(@PathVariable String batchId) {
        return batchGenerationService.getBatchReport(batchId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{batchId}/cancel")
    public ResponseEntity<BatchRun> cancelBatch(@PathVariable String batchId) {
        return cancelBatchInternal(batchId);
    }

    @DeleteMapping("/{batchId}")
    public ResponseEntity<BatchRun> cancelBatchDelete(@PathVariable String batchId) {
        return cancelBatchInternal(batchId);
    }

    private ResponseEntity<BatchRun> cancelBatchInternal(String batchId) {
        return batchGenerationService.cancelBatch(batchId)
                .map(batch -> ResponseEntity.accepted().body(batch))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
