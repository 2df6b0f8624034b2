package com.flagship.token_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.token_ledger.reward.Reward;
import com.flagship.token_ledger.staking.Stake;
import com.flagship.token_ledger.transfer.Contribution;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of everything the ledger owns.
 *
 * Every commit produces a new snapshot; the previous one stays valid for
 * readers that still hold it. Collections are unmodifiable copies, so a
 * snapshot handed to a caller can never be used to mutate the ledger.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LedgerState {

    boolean initialized;

    String accountId;

    @Builder.Default
    Balance balance = Balance.zero();

    @Builder.Default
    List<Reward> rewards = List.of();

    @Builder.Default
    List<Stake> stakes = List.of();

    @Builder.Default
    List<Contribution> contributions = List.of();

    @Builder.Default
    LedgerTotals totals = LedgerTotals.zero();

    /**
     * Default state: uninitialized, zero balance, empty catalogue.
     */
    public static LedgerState empty() {
        return LedgerState.builder().build();
    }

    /**
     * Whether every mandatory part survived deserialization.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return balance != null && rewards != null && stakes != null
            && contributions != null && totals != null
            && totals.getTotalEarned() != null && totals.getTotalContributed() != null
            && totals.getTotalStaked() != null && totals.getTotalStakingRewards() != null;
    }

    public Optional<Reward> findReward(String rewardId) {
        return rewards.stream().filter(r -> r.getId().equals(rewardId)).findFirst();
    }

    public Optional<Stake> findActiveStake(String stakeId) {
        return stakes.stream().filter(s -> s.isActive() && s.getId().equals(stakeId)).findFirst();
    }

    public List<Reward> claimableRewards() {
        return rewards.stream().filter(Reward::isClaimable).toList();
    }

    public List<Stake> activeStakes() {
        return stakes.stream().filter(Stake::isActive).toList();
    }

    public LedgerState replaceReward(Reward updated) {
        List<Reward> next = new ArrayList<>(rewards.size());
        for (Reward reward : rewards) {
            next.add(reward.getId().equals(updated.getId()) ? updated : reward);
        }
        return toBuilder().rewards(List.copyOf(next)).build();
    }

    public LedgerState addStake(Stake stake) {
        List<Stake> next = new ArrayList<>(stakes);
        next.add(stake);
        return toBuilder().stakes(List.copyOf(next)).build();
    }

    public LedgerState replaceStake(Stake updated) {
        List<Stake> next = new ArrayList<>(stakes.size());
        for (Stake stake : stakes) {
            next.add(stake.getId().equals(updated.getId()) ? updated : stake);
        }
        return toBuilder().stakes(List.copyOf(next)).build();
    }

    public LedgerState addContribution(Contribution contribution) {
        List<Contribution> next = new ArrayList<>(contributions);
        next.add(contribution);
        return toBuilder().contributions(List.copyOf(next)).build();
    }
}
