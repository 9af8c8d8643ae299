package org.example.stylelock.model;

/**
 * Error body returned by the REST endpoints.
 */
public record ApiError(String error, String field, String message, String requestId) {
}
