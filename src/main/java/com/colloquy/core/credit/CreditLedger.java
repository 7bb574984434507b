package com.colloquy.core.credit;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Balance storage. Every change reads the balance, checks it, writes the new balance and
 * records a transaction as one atomic unit per user, and a balance never drops below zero.
 */
public interface CreditLedger {

    Optional<Long> balance(String userId);

    /**
     * Creates an account with a zero balance.
     *
     * @return false when the account already exists
     */
    boolean openAccount(String userId);

    /**
     * Applies a signed change.
     *
     * @return {@code INSUFFICIENT_FUNDS} when a debit would take the balance below zero,
     *         {@code ACCOUNT_NOT_FOUND} for an unknown user
     */
    TransactionResult apply(String userId, long delta, TransactionType type, String reason,
                            Map<String, String> metadata);

    /** Most recent first. */
    List<CreditTransaction> history(String userId, int limit);

    Optional<CreditStatistics> statistics(String userId);
}
