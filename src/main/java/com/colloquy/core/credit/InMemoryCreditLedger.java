package com.colloquy.core.credit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CreditLedger} held in memory. Changes for one user serialize on that user's account.
 */
public class InMemoryCreditLedger implements CreditLedger {

    private final ConcurrentHashMap<String, Account> accounts = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCreditLedger() {
        this(Clock.systemUTC());
    }

    InMemoryCreditLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Long> balance(String userId) {
        Account account = accounts.get(userId);
        if (account == null) {
            return Optional.empty();
        }
        synchronized (account) {
            return Optional.of(account.balance);
        }
    }

    @Override
    public boolean openAccount(String userId) {
        return accounts.putIfAbsent(userId, new Account()) == null;
    }

    @Override
    public TransactionResult apply(String userId, long delta, TransactionType type, String reason,
                                   Map<String, String> metadata) {
        Account account = accounts.get(userId);
        if (account == null) {
            return TransactionResult.accountNotFound(userId);
        }
        synchronized (account) {
            long next = account.balance + delta;
            if (next < 0) {
                return TransactionResult.insufficient(-delta, account.balance);
            }
            account.balance = next;
            var tx = new CreditTransaction(userId, delta, type, reason,
                    metadata != null ? Map.copyOf(metadata) : Map.of(), next, clock.instant());
            account.transactions.add(tx);
            return TransactionResult.success(tx);
        }
    }

    @Override
    public List<CreditTransaction> history(String userId, int limit) {
        Account account = accounts.get(userId);
        if (account == null) {
            return List.of();
        }
        synchronized (account) {
            List<CreditTransaction> newestFirst = new ArrayList<>(account.transactions);
            Collections.reverse(newestFirst);
            return List.copyOf(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
        }
    }

    @Override
    public Optional<CreditStatistics> statistics(String userId) {
        Account account = accounts.get(userId);
        if (account == null) {
            return Optional.empty();
        }
        synchronized (account) {
            long used = 0;
            long added = 0;
            for (CreditTransaction tx : account.transactions) {
                if (tx.amount() < 0) {
                    used += -tx.amount();
                } else {
                    added += tx.amount();
                }
            }
            return Optional.of(new CreditStatistics(userId, account.balance, used, added, account.transactions.size()));
        }
    }

    private static final class Account {
        private long balance;
        private final List<CreditTransaction> transactions = new ArrayList<>();
    }
}
