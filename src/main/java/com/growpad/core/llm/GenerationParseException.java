package com.growpad.core.llm;

/**
 * Thrown when a generation response cannot be parsed as JSON.
 */
public class GenerationParseException extends RuntimeException {

    public GenerationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
