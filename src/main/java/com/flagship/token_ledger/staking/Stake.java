package com.flagship.token_ledger.staking;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A principal amount set aside to accrue interest until it is closed.
 *
 * Created active with zero accrued rewards; closed exactly once, at which
 * point the accrued rewards are computed and frozen.
 */
@Value
public class Stake {
    String id;
    BigDecimal principal;
    Instant openedAt;
    Instant closedAt;
    boolean active;
    BigDecimal accruedRewards;
    String referenceHash;

    public static Stake open(String id, BigDecimal principal, Instant openedAt, String referenceHash) {
        return new Stake(id, principal, openedAt, null, true, BigDecimal.ZERO, referenceHash);
    }

    /**
     * @throws IllegalStateException if the stake is already closed
     */
    public Stake close(Instant at, BigDecimal rewards) {
        if (!active) {
            throw new IllegalStateException("Stake already closed: " + id);
        }
        return new Stake(id, principal, openedAt, at, false, rewards, referenceHash);
    }
}
