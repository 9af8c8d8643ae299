package org.example.stylelock.service;

/**
 * The scorer stayed unavailable for every scoring retry of one artifact.
 */
public class ScoringExhaustedException extends Exception {

    public ScoringExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
