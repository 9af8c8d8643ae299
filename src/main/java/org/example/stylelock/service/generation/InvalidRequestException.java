package org.example.stylelock.service.generation;

public class InvalidRequestException extends GenerationServiceException {

    private final int statusCode;

    public InvalidRequestException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.PERMANENT;
    }
}
