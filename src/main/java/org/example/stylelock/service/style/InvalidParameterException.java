package org.example.stylelock.service.style;

public class InvalidParameterException extends StyleConfigurationException {

    private final String field;

    public InvalidParameterException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
