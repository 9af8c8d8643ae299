package org.example.stylelock.service.generation;

import org.example.stylelock.model.GeneratedArtifact;
import org.example.stylelock.model.GenerationProgress;
import org.example.stylelock.model.GenerationRequest;

/**
 * Boundary to the external image generation service.
 */
public interface GenerationClient {

    /**
     * Submit a generation request.
     *
     * @return the service handle used for polling and fetching
     * @throws ServiceUnavailableException when the service is throttling or down
     * @throws InvalidRequestException when the service rejects the parameters
     */
    String submit(GenerationRequest request) throws GenerationServiceException;

    GenerationProgress poll(String handle) throws GenerationServiceException;

    /**
     * Download the first produced asset of a completed generation.
     *
     * @throws ArtifactNotReadyException when the generation has no asset yet
     * @throws DownloadFailedException when the asset cannot be stored locally
     */
    GeneratedArtifact fetch(String handle) throws GenerationServiceException;

    boolean isAvailable();
}
