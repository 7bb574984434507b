package com.colloquy.core.credit;

/**
 * Outcome of a balance change. Refusals are values, not exceptions.
 *
 * @param balance     balance after the change, or the untouched balance when refused
 * @param transaction the recorded row, null when refused
 * @param message     human-readable explanation of a refusal
 */
public record TransactionResult(
    Outcome outcome,
    long balance,
    CreditTransaction transaction,
    String message
) {

    public enum Outcome {
        SUCCESS,
        INSUFFICIENT_FUNDS,
        ACCOUNT_NOT_FOUND
    }

    public static TransactionResult success(CreditTransaction transaction) {
        return new TransactionResult(Outcome.SUCCESS, transaction.balanceAfter(), transaction, null);
    }

    public static TransactionResult insufficient(long required, long available) {
        return new TransactionResult(Outcome.INSUFFICIENT_FUNDS, available, null,
                "Insufficient credits. Required: " + required + ", Available: " + available);
    }

    public static TransactionResult accountNotFound(String userId) {
        return new TransactionResult(Outcome.ACCOUNT_NOT_FOUND, 0, null, "User " + userId + " not found");
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCESS;
    }
}
