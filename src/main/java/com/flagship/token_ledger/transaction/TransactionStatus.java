package com.flagship.token_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Confirmation status of a transaction. Only committed operations reach the
 * log, so logged entries are CONFIRMED.
 */
public enum TransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
