package org.example.stylelock.model;

import org.example.stylelock.service.style.InvalidParameterException;

public record RetryPolicy(int maxAttempts) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new InvalidParameterException("maxAttempts", "must be at least 1");
        }
    }
}
