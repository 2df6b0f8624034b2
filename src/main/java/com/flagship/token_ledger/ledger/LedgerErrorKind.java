package com.flagship.token_ledger.ledger;

/**
 * Stable, machine-checkable kinds of ledger failures.
 *
 * All kinds are recoverable by the caller. Validation kinds are raised before
 * any state is touched; {@link #PERSISTENCE_FAILURE} is only ever logged.
 */
public enum LedgerErrorKind {
    /** Amount is zero or negative where a positive amount is required. */
    INVALID_AMOUNT,
    /** Requested amount exceeds the current primary balance. */
    INSUFFICIENT_BALANCE,
    /** Destination address fails basic format validation. */
    INVALID_ADDRESS,
    /** Reward id unknown, or stake id unknown or no longer active. */
    NOT_FOUND,
    /** Reward has not been unlocked yet. */
    NOT_UNLOCKED,
    /** Reward has already been claimed. */
    ALREADY_CLAIMED,
    /** Snapshot or log could not be written or read. Never surfaced to callers. */
    PERSISTENCE_FAILURE
}
