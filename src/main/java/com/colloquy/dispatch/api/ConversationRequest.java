package com.colloquy.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for starting or continuing a conversation.
 *
 * @param userId   user to charge; nullable for an unmetered conversation
 * @param message  the user's message, also accepted as {@code initial_message}
 * @param agentIds participating agents, first one is the fallback speaker
 * @param maxTurns ceiling on agent replies; nullable, defaults to the configured value
 */
public record ConversationRequest(
    @JsonProperty("user_id") String userId,
    @JsonProperty("message") @JsonAlias("initial_message") String message,
    @JsonProperty("agent_ids") List<String> agentIds,
    @JsonProperty("max_turns") Integer maxTurns
) {}
