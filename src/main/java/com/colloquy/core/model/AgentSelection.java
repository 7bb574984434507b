package com.colloquy.core.model;

import java.io.Serializable;

/**
 * Supervisor's choice of the next speaker.
 *
 * @param agentId   selected agent
 * @param reasoning informational only
 * @param turns     consecutive turns for the agent; 0 pauses the conversation, null means 1
 */
public record AgentSelection(
    String agentId,
    String reasoning,
    Integer turns
) implements Serializable {

    public int turnsOrDefault() {
        return turns != null ? turns : 1;
    }

    public boolean isPause() {
        return turnsOrDefault() == 0;
    }
}
