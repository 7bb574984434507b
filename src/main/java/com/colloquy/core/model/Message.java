package com.colloquy.core.model;

import java.io.Serializable;

/**
 * One entry in a conversation transcript.
 *
 * @param role      who authored the message
 * @param content   message text
 * @param speaker   display name shown next to the message
 * @param agentId   id of the authoring agent, null for user and system messages
 * @param timestamp epoch milliseconds
 */
public record Message(
    MessageRole role,
    String content,
    String speaker,
    String agentId,
    long timestamp
) implements Serializable {

    public static Message user(String content) {
        return new Message(MessageRole.USER, content, "User", null, System.currentTimeMillis());
    }

    public static Message assistant(Agent agent, String content) {
        return new Message(MessageRole.ASSISTANT, content, agent.name(), agent.agentId(), System.currentTimeMillis());
    }

    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }
}
