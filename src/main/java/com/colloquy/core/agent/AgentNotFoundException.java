package com.colloquy.core.agent;

/**
 * Thrown when an agent id has no entry in the run's {@link AgentRegistry}
 * or cannot be resolved by the {@link AgentDirectory}.
 */
public class AgentNotFoundException extends RuntimeException {

    private final String agentId;

    public AgentNotFoundException(String agentId) {
        super("Agent " + agentId + " not found");
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
