package org.example.stylelock.model;

public enum JobStatus {
    PENDING,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED_TRANSIENT,
    FAILED_PERMANENT,
    FAILED_CONSISTENCY;

    public boolean isFailure() {
        return this == FAILED_TRANSIENT || this == FAILED_PERMANENT || this == FAILED_CONSISTENCY;
    }
}
