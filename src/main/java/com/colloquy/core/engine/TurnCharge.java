package com.colloquy.core.engine;

/**
 * What one generated reply cost.
 *
 * @param credits          credits debited for the reply
 * @param remainingCredits balance after the debit
 */
public record TurnCharge(long credits, long remainingCredits) {}
