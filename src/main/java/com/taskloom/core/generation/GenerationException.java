package com.taskloom.core.generation;

/**
 * Raised by the generation service when a request cannot be started or fails mid-stream.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
