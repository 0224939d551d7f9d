package com.taskloom.core.generation;

/**
 * The external AI coding assistant.
 */
public interface GenerationService {

    /**
     * Issues a streamed request.
     *
     * @throws GenerationException if the request could not be started
     */
    GenerationStream open(GenerationRequest request) throws GenerationException;
}
