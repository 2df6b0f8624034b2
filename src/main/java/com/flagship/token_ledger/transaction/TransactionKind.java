package com.flagship.token_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a ledger transaction, tagged with the sign it applies to the
 * primary balance. Replaying {@code sign × amount} over the log in order
 * reproduces the primary balance.
 */
public enum TransactionKind {
    INITIAL_GRANT(1),
    CLAIM_REWARD(1),
    RECEIVE(1),
    UNSTAKE_TOKENS(1),
    CONTRIBUTE(-1),
    TRANSFER(-1),
    STAKE_TOKENS(-1),
    CHECK_IN(0),
    VALIDATION(0);

    private final int sign;

    TransactionKind(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    public boolean affectsBalance() {
        return sign != 0;
    }

    /**
     * Journal-only kinds that record user activity without moving tokens.
     */
    public boolean isActivity() {
        return this == CHECK_IN || this == VALIDATION;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
