package com.flagship.token_ledger.transaction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of committed ledger operations.
 *
 * Appends come from the ledger writer only; readers get an immutable copy
 * published through a volatile reference, so they never observe a
 * half-appended list.
 */
public class TransactionLog {

    private volatile List<LedgerTransaction> entries;

    public TransactionLog(List<LedgerTransaction> initial) {
        this.entries = List.copyOf(initial);
    }

    public static TransactionLog empty() {
        return new TransactionLog(List.of());
    }

    public void append(LedgerTransaction transaction) {
        List<LedgerTransaction> next = new ArrayList<>(entries.size() + 1);
        next.addAll(entries);
        next.add(transaction);
        entries = List.copyOf(next);
    }

    public List<LedgerTransaction> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Replays the signed amounts in log order.
     * The result must equal the current primary balance.
     */
    public BigDecimal replayPrimaryBalance() {
        BigDecimal balance = BigDecimal.ZERO;
        for (LedgerTransaction transaction : entries) {
            balance = balance.add(transaction.getSignedAmount());
        }
        return balance;
    }

    /**
     * Drops every entry. Only {@code reset} may call this.
     */
    public void clear() {
        entries = List.of();
    }
}
