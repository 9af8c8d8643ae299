package org.example.stylelock.model;

public enum BatchStatus {
    RUNNING,
    CANCELLED,
    SUCCEEDED,
    PARTIAL_FAILURE,
    FAILED
}
