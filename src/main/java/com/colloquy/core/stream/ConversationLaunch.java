package com.colloquy.core.stream;

import java.util.List;

/**
 * Caller input for starting or resuming a conversation.
 *
 * @param userId   owner charged for replies, null for an unmetered conversation
 * @param message  the user's message that opens this run
 * @param agentIds participating agents in priority order
 * @param maxTurns ceiling on agent replies, null for the configured default
 */
public record ConversationLaunch(
    String userId,
    String message,
    List<String> agentIds,
    Integer maxTurns
) {}
