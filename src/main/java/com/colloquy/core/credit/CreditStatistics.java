package com.colloquy.core.credit;

public record CreditStatistics(
    String userId,
    long balance,
    long totalUsed,
    long totalAdded,
    int transactionCount
) {}
