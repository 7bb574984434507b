package com.colloquy.core.generation;

/**
 * The model call behind an agent reply failed. Aborts the conversation run.
 */
public class GenerationFailureException extends RuntimeException {

    private final String agentId;

    public GenerationFailureException(String agentId, Throwable cause) {
        super("Generation failed for agent " + agentId + ": " + cause.getMessage(), cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
