package org.example.stylelock.service.generation;

public class ArtifactNotReadyException extends GenerationServiceException {

    public ArtifactNotReadyException(String message) {
        super(message);
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.TRANSIENT;
    }
}
