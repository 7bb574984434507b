package com.colloquy.core.llm;

/**
 * Thrown when a structured model response cannot be mapped onto the requested type.
 */
public class LlmParseException extends RuntimeException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
