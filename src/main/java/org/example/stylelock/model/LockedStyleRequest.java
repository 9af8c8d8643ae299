package org.example.stylelock.model;

import java.util.List;

/**
 * Parameters submitted when locking or relocking a project style. Unset numeric fields fall
 * back to the defaults used by the art direction review.
 */
public record LockedStyleRequest(
        String modelId,
        Integer steps,
        Double cfgScale,
        Long seedBase,
        Integer width,
        Integer height,
        String promptSuffix,
        List<String> validationSamples,
        Double consistencyScore
) {

    public static final int DEFAULT_STEPS = 30;
    public static final double DEFAULT_CFG_SCALE = 7.0;
    public static final long DEFAULT_SEED_BASE = 42L;
    public static final int DEFAULT_DIMENSION = 512;
}
