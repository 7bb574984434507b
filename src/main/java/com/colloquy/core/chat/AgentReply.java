package com.colloquy.core.chat;

/**
 * Result of one direct exchange with a single agent.
 *
 * @param conversationId   transcript the exchange was appended to
 * @param agentId          replying agent
 * @param agentName        replying agent's display name
 * @param content          reply text
 * @param creditsUsed      credits charged, zero for an unmetered exchange
 * @param remainingCredits balance after the charge, null for an unmetered exchange
 * @param timestamp        epoch milliseconds of the reply
 */
public record AgentReply(
    String conversationId,
    String agentId,
    String agentName,
    String content,
    long creditsUsed,
    Long remainingCredits,
    long timestamp
) {}
