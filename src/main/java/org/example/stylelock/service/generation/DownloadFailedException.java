package org.example.stylelock.service.generation;

public class DownloadFailedException extends GenerationServiceException {

    public DownloadFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.TRANSIENT;
    }
}
