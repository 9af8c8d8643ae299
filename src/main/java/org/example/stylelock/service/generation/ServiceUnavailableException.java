package org.example.stylelock.service.generation;

import java.time.Duration;

/**
 * The service refused or could not take the request right now (HTTP 429, 5xx, I/O).
 */
public class ServiceUnavailableException extends GenerationServiceException {

    private final boolean rateLimited;
    private final Duration retryAfter;

    public ServiceUnavailableException(String message, boolean rateLimited, Duration retryAfter) {
        super(message);
        this.rateLimited = rateLimited;
        this.retryAfter = retryAfter;
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.rateLimited = false;
        this.retryAfter = null;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    /**
     * Server-suggested wait, or null when none was given.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.TRANSIENT;
    }
}
