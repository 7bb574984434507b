package com.colloquy.core.credit;

public enum TransactionType {
    USAGE,
    PURCHASE,
    REFILL,
    BONUS
}
