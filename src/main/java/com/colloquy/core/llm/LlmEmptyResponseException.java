package com.colloquy.core.llm;

/**
 * Thrown when the model returns blank content where structured output was expected.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
