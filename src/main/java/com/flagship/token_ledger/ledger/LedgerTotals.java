package com.flagship.token_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Running aggregates maintained incrementally with every commit.
 */
@Value
public class LedgerTotals {
    BigDecimal totalEarned;
    BigDecimal totalContributed;
    BigDecimal totalStaked;
    BigDecimal totalStakingRewards;

    public static LedgerTotals zero() {
        return new LedgerTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public LedgerTotals addEarned(BigDecimal amount) {
        return new LedgerTotals(totalEarned.add(amount), totalContributed, totalStaked, totalStakingRewards);
    }

    public LedgerTotals addContributed(BigDecimal amount) {
        return new LedgerTotals(totalEarned, totalContributed.add(amount), totalStaked, totalStakingRewards);
    }

    public LedgerTotals addStaked(BigDecimal amount) {
        return new LedgerTotals(totalEarned, totalContributed, totalStaked.add(amount), totalStakingRewards);
    }

    public LedgerTotals releaseStake(BigDecimal principal, BigDecimal stakingRewards) {
        return new LedgerTotals(
            totalEarned.add(stakingRewards),
            totalContributed,
            totalStaked.subtract(principal),
            totalStakingRewards.add(stakingRewards)
        );
    }
}
