package org.example.stylelock.model;

import org.example.stylelock.service.style.InvalidParameterException;

/**
 * Consistency-score bars applied to one batch: {@code perAsset} gates each job,
 * {@code batch} gates the mean of accepted scores.
 */
public record BatchThresholds(double perAsset, double batch) {

    public static final double DEFAULT_PER_ASSET = 8.5;
    public static final double DEFAULT_BATCH = 9.0;

    public BatchThresholds {
        requireScore("perAsset", perAsset);
        requireScore("batch", batch);
        if (batch < perAsset) {
            throw new InvalidParameterException("batch", "must not be lower than the per-asset threshold");
        }
    }

    public static BatchThresholds defaults() {
        return new BatchThresholds(DEFAULT_PER_ASSET, DEFAULT_BATCH);
    }

    private static void requireScore(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 10.0) {
            throw new InvalidParameterException(field, "must be between 0 and 10");
        }
    }
}
