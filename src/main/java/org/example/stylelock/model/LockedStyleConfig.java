package org.example.stylelock.model;

import org.example.stylelock.service.style.InvalidParameterException;

import java.time.LocalDateTime;

/**
 * Immutable generation parameters shared by every job of a batch.
 * A change of any field is a new version, created through an explicit relock.
 */
public record LockedStyleConfig(
        String projectId,
        int version,
        String modelId,
        int steps,
        double cfgScale,
        long seedBase,
        int width,
        int height,
        String promptSuffix,
        LocalDateTime createdAt
) {

    public static final int MIN_DIMENSION = 64;
    public static final int MAX_DIMENSION = 2048;
    public static final int MAX_STEPS = 150;
    public static final double MIN_CFG_SCALE = 0.1;
    public static final double MAX_CFG_SCALE = 30.0;
    public static final int MAX_PROMPT_SUFFIX_LENGTH = 1000;

    public LockedStyleConfig {
        requireNonBlank("projectId", projectId);
        requireNonBlank("modelId", modelId);
        requireNonBlank("promptSuffix", promptSuffix);
        if (version < 1) {
            throw new InvalidParameterException("version", "must be at least 1");
        }
        if (steps < 1 || steps > MAX_STEPS) {
            throw new InvalidParameterException("steps", "must be between 1 and " + MAX_STEPS);
        }
        if (Double.isNaN(cfgScale) || cfgScale < MIN_CFG_SCALE || cfgScale > MAX_CFG_SCALE) {
            throw new InvalidParameterException("cfgScale",
                    "must be between " + MIN_CFG_SCALE + " and " + MAX_CFG_SCALE);
        }
        if (seedBase < 0) {
            throw new InvalidParameterException("seedBase", "must not be negative");
        }
        requireDimension("width", width);
        requireDimension("height", height);
        if (promptSuffix.length() > MAX_PROMPT_SUFFIX_LENGTH) {
            throw new InvalidParameterException("promptSuffix",
                    "must be at most " + MAX_PROMPT_SUFFIX_LENGTH + " characters");
        }
        if (createdAt == null) {
            throw new InvalidParameterException("createdAt", "is required");
        }
    }

    /**
     * Prompt sent to the generation service for a job description.
     */
    public String fullPrompt(String description) {
        return description.trim() + ", " + promptSuffix;
    }

    private static void requireNonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidParameterException(field, "is required");
        }
    }

    private static void requireDimension(String field, int value) {
        if (value < MIN_DIMENSION || value > MAX_DIMENSION) {
            throw new InvalidParameterException(field,
                    "must be between " + MIN_DIMENSION + " and " + MAX_DIMENSION);
        }
        if (value % 64 != 0) {
            throw new InvalidParameterException(field, "must be a multiple of 64");
        }
    }
}
