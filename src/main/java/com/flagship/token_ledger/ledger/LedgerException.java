package com.flagship.token_ledger.ledger;

import lombok.Getter;

/**
 * Domain failure raised by a ledger operation.
 * Thrown before any mutation, so the ledger is never left partially updated.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorKind kind;

    public LedgerException(LedgerErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LedgerException(LedgerErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static LedgerException invalidAmount(Object amount) {
        return new LedgerException(LedgerErrorKind.INVALID_AMOUNT,
            String.format("Amount must be greater than zero: %s", amount));
    }

    public static LedgerException insufficientBalance(Object requested, Object available) {
        return new LedgerException(LedgerErrorKind.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance: requested=%s, available=%s", requested, available));
    }

    public static LedgerException notFound(String what, String id) {
        return new LedgerException(LedgerErrorKind.NOT_FOUND,
            String.format("%s not found: %s", what, id));
    }
}
