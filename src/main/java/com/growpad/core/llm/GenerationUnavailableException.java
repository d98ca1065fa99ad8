package com.growpad.core.llm;

/**
 * Thrown when the generation provider is not configured or a call to it fails.
 */
public class GenerationUnavailableException extends RuntimeException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
