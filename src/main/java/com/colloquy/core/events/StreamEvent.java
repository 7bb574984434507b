package com.colloquy.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A conversation event in its wire shape, published on the {@link EventBus} for SSE and CLI consumers.
 *
 * @param type           wire tag, e.g. "status", "agent_response", "credit_update"
 * @param conversationId the conversation this event belongs to
 * @param data           tag-specific payload
 * @param timestamp      when the event occurred
 */
public record StreamEvent(
    String type,
    String conversationId,
    Map<String, Object> data,
    Instant timestamp
) implements Serializable {

    public boolean isTerminal() {
        return "conversation_complete".equals(type) || "conversation_paused".equals(type) || "error".equals(type);
    }
}
