package org.example.stylelock.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

/**
 * Request id handling shared by the correlation filter and API error bodies.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String UNKNOWN = "unknown";
    static final int MAX_REQUEST_ID_LENGTH = 80;

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request != null && request.getAttribute(ATTRIBUTE_NAME) instanceof String value && !value.isBlank()) {
            return value;
        }
        return currentRequestId();
    }

    /**
     * Request id bound to the current thread, or {@link #UNKNOWN} outside a request.
     */
    public static String currentRequestId() {
        String value = MDC.get(ATTRIBUTE_NAME);
        return value == null || value.isBlank() ? UNKNOWN : value;
    }

    static String normalize(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        String trimmed = headerValue.trim();
        return trimmed.length() > MAX_REQUEST_ID_LENGTH ? trimmed.substring(0, MAX_REQUEST_ID_LENGTH) : trimmed;
    }
}
