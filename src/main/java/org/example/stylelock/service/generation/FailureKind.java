package org.example.stylelock.service.generation;

public enum FailureKind {
    /** Expected to succeed when retried with the same inputs. */
    TRANSIENT,
    /** Deterministic for the same inputs; never retried. */
    PERMANENT
}
