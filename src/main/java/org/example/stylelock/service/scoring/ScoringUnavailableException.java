package org.example.stylelock.service.scoring;

public class ScoringUnavailableException extends Exception {

    public ScoringUnavailableException(String message) {
        super(message);
    }

    public ScoringUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
