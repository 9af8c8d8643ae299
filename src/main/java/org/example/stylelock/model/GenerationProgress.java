package org.example.stylelock.model;

import java.util.List;

public record GenerationProgress(
        String handle,
        State state,
        double progress,
        List<String> assetUrls,
        String errorMessage
) {

    public enum State {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED
    }

    public GenerationProgress {
        assetUrls = assetUrls == null ? List.of() : List.copyOf(assetUrls);
    }
}
