package com.colloquy.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for a direct exchange with one agent.
 *
 * @param conversationId transcript to continue; nullable to start a new one
 */
public record AgentChatRequest(
    @JsonProperty("user_id") String userId,
    @JsonProperty("message") String message,
    @JsonProperty("conversation_id") String conversationId
) {}
