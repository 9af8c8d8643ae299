package org.example.stylelock.model;

/**
 * Caller-facing description of one asset to generate.
 */
public record JobSpec(String category, String prompt) {
}
