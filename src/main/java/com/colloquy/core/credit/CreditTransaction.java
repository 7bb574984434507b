package com.colloquy.core.credit;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One row of a user's credit history.
 *
 * @param amount       signed change, negative for usage
 * @param metadata     free-form context such as conversationId, agentId and model
 * @param balanceAfter balance once the change was applied
 */
public record CreditTransaction(
    String userId,
    long amount,
    TransactionType type,
    String reason,
    Map<String, String> metadata,
    long balanceAfter,
    Instant createdAt
) implements Serializable {}
