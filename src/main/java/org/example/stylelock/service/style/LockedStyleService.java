package org.example.stylelock.service.style;

import org.example.stylelock.entity.LockedStyleEntity;
import org.example.stylelock.model.LockedStyleConfig;
import org.example.stylelock.model.LockedStyleRecord;
import org.example.stylelock.model.LockedStyleRequest;
import org.example.stylelock.repository.LockedStyleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Stores the locked style of each project. A project has at most one active record;
 * changing parameters always goes through {@link #relock}, which supersedes the active
 * record with a new version.
 */
@Service
public class LockedStyleService {

    private static final Logger log = LoggerFactory.getLogger(LockedStyleService.class);

    private final LockedStyleRepository lockedStyleRepository;
    private final double approvalMinScore;

    public LockedStyleService(
            LockedStyleRepository lockedStyleRepository,
            @Value("${style.approval.min-score:8.5}") double approvalMinScore) {
        this.lockedStyleRepository = lockedStyleRepository;
        this.approvalMinScore = approvalMinScore;
    }

    @Transactional
    public LockedStyleRecord lock(String projectId, LockedStyleRequest request) {
        String normalizedProjectId = requireProjectId(projectId);
        Optional<LockedStyleEntity> active = lockedStyleRepository.findByProjectIdAndActiveTrue(normalizedProjectId);
        if (active.isPresent()) {
            throw new StyleAlreadyLockedException(normalizedProjectId, active.get().getVersion());
        }
        LockedStyleEntity saved = createVersion(normalizedProjectId, request);
        log.info("Locked style v{} for project {} (model {})", saved.getVersion(), normalizedProjectId, saved.getModelId());
        return toRecord(saved);
    }

    /**
     * Replace the active locked style with a new version. The new version starts unapproved.
     */
    @Transactional
    public LockedStyleRecord relock(String projectId, LockedStyleRequest request) {
        String normalizedProjectId = requireProjectId(projectId);
        LockedStyleEntity previous = lockedStyleRepository.findByProjectIdAndActiveTrue(normalizedProjectId)
                .orElse(null);
        // validate before touching the active record
        toConfig(normalizedProjectId, 1, request, LocalDateTime.now());
        if (previous != null) {
            previous.setActive(false);
            previous.setSupersededAt(LocalDateTime.now());
            lockedStyleRepository.saveAndFlush(previous);
        }
        LockedStyleEntity saved = createVersion(normalizedProjectId, request);
        log.info("Relocked project {} style: v{} -> v{}", normalizedProjectId,
                previous == null ? 0 : previous.getVersion(), saved.getVersion());
        return toRecord(saved);
    }

    @Transactional
    public LockedStyleRecord approve(String projectId) {
        String normalizedProjectId = requireProjectId(projectId);
        LockedStyleEntity entity = lockedStyleRepository.findByProjectIdAndActiveTrue(normalizedProjectId)
                .orElseThrow(() -> new MissingLockException(normalizedProjectId, "no locked style found"));
        if (entity.isApproved()) {
            return toRecord(entity);
        }
        Double score = entity.getConsistencyScore();
        if (score == null || score < approvalMinScore) {
            throw new InvalidParameterException("consistencyScore",
                    "validation score " + score + " is below the approval minimum " + approvalMinScore);
        }
        entity.setApproved(true);
        entity.setApprovedAt(LocalDateTime.now());
        LockedStyleEntity saved = lockedStyleRepository.save(entity);
        log.info("Approved locked style v{} for project {}", saved.getVersion(), normalizedProjectId);
        return toRecord(saved);
    }

    /**
     * Load the active, approved locked style of a project.
     *
     * @throws MissingLockException when there is no active record or it is not approved
     */
    @Transactional(readOnly = true)
    public LockedStyleRecord requireApproved(String projectId) {
        String normalizedProjectId = requireProjectId(projectId);
        LockedStyleEntity entity = lockedStyleRepository.findByProjectIdAndActiveTrue(normalizedProjectId)
                .orElseThrow(() -> new MissingLockException(normalizedProjectId, "no locked style found"));
        if (!entity.isApproved()) {
            throw new MissingLockException(normalizedProjectId,
                    "locked style v" + entity.getVersion() + " is not approved");
        }
        return toRecord(entity);
    }

    @Transactional(readOnly = true)
    public Optional<LockedStyleRecord> findActive(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return Optional.empty();
        }
        return lockedStyleRepository.findByProjectIdAndActiveTrue(projectId.trim()).map(this::toRecord);
    }

    @Transactional(readOnly = true)
    public List<LockedStyleRecord> history(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return List.of();
        }
        return lockedStyleRepository.findByProjectIdOrderByVersionDesc(projectId.trim()).stream()
                .map(this::toRecord)
                .toList();
    }

    private LockedStyleEntity createVersion(String projectId, LockedStyleRequest request) {
        int version = lockedStyleRepository.findLatestVersion(projectId) + 1;
        LockedStyleEntity entity = new LockedStyleEntity(projectId, version);
        LockedStyleConfig config = toConfig(projectId, version, request, entity.getLockedAt());
        entity.setModelId(config.modelId());
        entity.setSteps(config.steps());
        entity.setCfgScale(config.cfgScale());
        entity.setSeedBase(config.seedBase());
        entity.setWidth(config.width());
        entity.setHeight(config.height());
        entity.setPromptSuffix(config.promptSuffix());
        entity.setValidationSamples(joinSamples(request.validationSamples()));
        entity.setConsistencyScore(validateScore(request.consistencyScore()));
        return lockedStyleRepository.save(entity);
    }

    static LockedStyleConfig toConfig(String projectId, int version, LockedStyleRequest request,
                                      LocalDateTime createdAt) {
        if (request == null) {
            throw new InvalidParameterException("request", "is required");
        }
        return new LockedStyleConfig(
                projectId,
                version,
                request.modelId() == null ? null : request.modelId().trim(),
                request.steps() != null ? request.steps() : LockedStyleRequest.DEFAULT_STEPS,
                request.cfgScale() != null ? request.cfgScale() : LockedStyleRequest.DEFAULT_CFG_SCALE,
                request.seedBase() != null ? request.seedBase() : LockedStyleRequest.DEFAULT_SEED_BASE,
                request.width() != null ? request.width() : LockedStyleRequest.DEFAULT_DIMENSION,
                request.height() != null ? request.height() : LockedStyleRequest.DEFAULT_DIMENSION,
                request.promptSuffix() == null ? null : request.promptSuffix().trim(),
                createdAt
        );
    }

    private LockedStyleRecord toRecord(LockedStyleEntity entity) {
        LockedStyleConfig config = new LockedStyleConfig(
                entity.getProjectId(),
                entity.getVersion(),
                entity.getModelId(),
                entity.getSteps(),
                entity.getCfgScale(),
                entity.getSeedBase(),
                entity.getWidth(),
                entity.getHeight(),
                entity.getPromptSuffix(),
                entity.getLockedAt()
        );
        return new LockedStyleRecord(
                entity.getProjectId(),
                entity.getVersion(),
                config,
                splitSamples(entity.getValidationSamples()),
                entity.getConsistencyScore(),
                entity.isApproved(),
                entity.isActive(),
                entity.getLockedAt(),
                entity.getApprovedAt()
        );
    }

    private Double validateScore(Double score) {
        if (score != null && (score.isNaN() || score < 0.0 || score > 10.0)) {
            throw new InvalidParameterException("consistencyScore", "must be between 0 and 10");
        }
        return score;
    }

    private String requireProjectId(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new InvalidParameterException("projectId", "is required");
        }
        String trimmed = projectId.trim();
        if (trimmed.length() > 120) {
            throw new InvalidParameterException("projectId", "must be at most 120 characters");
        }
        return trimmed;
    }

    private String joinSamples(List<String> samples) {
        if (samples == null || samples.isEmpty()) {
            return null;
        }
        List<String> cleaned = new ArrayList<>();
        for (String sample : samples) {
            if (sample != null && !sample.isBlank()) {
                cleaned.add(sample.trim());
            }
        }
        return cleaned.isEmpty() ? null : String.join("\n", cleaned);
    }

    private List<String> splitSamples(String samples) {
        if (samples == null || samples.isBlank()) {
            return List.of();
        }
        return Arrays.stream(samples.split("\n"))
                .filter(sample -> !sample.isBlank())
                .toList();
    }
}
