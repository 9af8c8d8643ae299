package org.example.stylelock.model;

public record GeneratedArtifact(String handle, String artifactRef, String contentType, long sizeBytes) {
}
