package org.example.stylelock.controller;

import org.example.stylelock.config.RequestCorrelation;
import org.example.stylelock.model.ApiError;
import org.example.stylelock.model.LockedStyleRecord;
import org.example.stylelock.model.LockedStyleRequest;
import org.example.stylelock.service.style.InvalidParameterException;
import org.example.stylelock.service.style.LockedStyleService;
import org.example.stylelock.service.style.MissingLockException;
import org.example.stylelock.service.style.StyleAlreadyLockedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Lock, relock and approve the style parameters a project's batches must use.
 */
@RestController
@RequestMapping("/api/projects/{projectId}/style")
public class LockedStyleController {

    private final LockedStyleService lockedStyleService;

    public LockedStyleController(LockedStyleService lockedStyleService) {
        this.lockedStyleService = lockedStyleService;
    }

    @GetMapping
    public ResponseEntity<LockedStyleRecord> getActiveStyle(@PathVariable String projectId) {
        return lockedStyleService.findActive(projectId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/history")
    public List<LockedStyleRecord> getHistory(@PathVariable String projectId) {
        return lockedStyleService.history(projectId);
    }

    @PutMapping
    public ResponseEntity<?> lockStyle(@PathVariable String projectId, @RequestBody LockedStyleRequest request) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(lockedStyleService.lock(projectId, request));
        } catch (StyleAlreadyLockedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new ApiError("style_already_locked", null, e.getMessage(), RequestCorrelation.currentRequestId()));
        } catch (InvalidParameterException e) {
            return invalid(e);
        }
    }

    /**
     * Explicitly replace the active style with a new, unapproved version.
     */
    @PostMapping("/relock")
    public ResponseEntity<?> relockStyle(@PathVariable String projectId, @RequestBody LockedStyleRequest request) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(lockedStyleService.relock(projectId, request));
        } catch (InvalidParameterException e) {
            return invalid(e);
        }
    }

    @PostMapping("/approve")
    public ResponseEntity<?> approveStyle(@PathVariable String projectId) {
        try {
            return ResponseEntity.ok(lockedStyleService.approve(projectId));
        } catch (MissingLockException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ApiError("missing_lock", null, e.getMessage(), RequestCorrelation.currentRequestId()));
        } catch (InvalidParameterException e) {
            return invalid(e);
        }
    }

    private ResponseEntity<ApiError> invalid(InvalidParameterException e) {
        return ResponseEntity.badRequest()
                .body(new ApiError("invalid_parameter", e.getField(), e.getMessage(), RequestCorrelation.currentRequestId()));
    }
}
