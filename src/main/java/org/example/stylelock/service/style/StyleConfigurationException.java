package org.example.stylelock.service.style;

/**
 * Base type for locked-style configuration errors. These are caller mistakes and are
 * never retried.
 */
public class StyleConfigurationException extends RuntimeException {

    public StyleConfigurationException(String message) {
        super(message);
    }
}
