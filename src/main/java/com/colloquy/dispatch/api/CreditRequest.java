package com.colloquy.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/credits/{userId}.
 *
 * @param type PURCHASE, REFILL or BONUS; nullable, defaults to PURCHASE
 */
public record CreditRequest(
    long amount,
    String type,
    String reason
) {}
