package com.flagship.token_ledger.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Named notification channels.
 */
public enum LedgerEventChannel {
    /** After every committed mutation; payload is the new {@code LedgerState}. */
    STATE_CHANGED,
    /** After any balance mutation; payload is the new {@code Balance}. */
    BALANCE_UPDATED,
    /** Payload is a {@link RewardClaimedEvent}. */
    REWARD_CLAIMED,
    /** Payload is a {@link ContributionMadeEvent}. */
    CONTRIBUTION_MADE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
