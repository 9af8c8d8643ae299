package org.example.stylelock.model;

/**
 * Payload for one submission to the generation service. Built only from a job prompt and
 * the batch's locked style, so every attempt of a job submits identical parameters.
 */
public record GenerationRequest(
        String jobId,
        String prompt,
        String modelId,
        int steps,
        double cfgScale,
        long seed,
        int width,
        int height
) {

    public static GenerationRequest of(String jobId, String description, LockedStyleConfig config) {
        return new GenerationRequest(
                jobId,
                config.fullPrompt(description),
                config.modelId(),
                config.steps(),
                config.cfgScale(),
                config.seedBase(),
                config.width(),
                config.height()
        );
    }
}
