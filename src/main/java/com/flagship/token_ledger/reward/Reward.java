package com.flagship.token_ledger.reward;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A milestone-tied, claimable token grant.
 *
 * Key principles:
 * - Status transitions are explicit and validated (see {@link RewardStatus})
 * - Invalid transitions are rejected with {@link IllegalStateException}
 * - Rewards are immutable; a transition returns a new instance
 */
@Value
@JsonIgnoreProperties(value = {"unlocked", "claimed"}, allowGetters = true)
public class Reward {
    String id;
    RewardCategory category;
    BigDecimal amount;
    String description;
    RewardStatus status;
    Integer unlockDay;         // challenge day that unlocks it, null for bonus rewards
    Instant unlockedAt;
    Instant claimedAt;

    /**
     * Creates a catalogue entry in LOCKED status.
     */
    public static Reward locked(String id, RewardCategory category, BigDecimal amount,
                                String description, Integer unlockDay) {
        return new Reward(id, category, amount, description, RewardStatus.LOCKED, unlockDay, null, null);
    }

    /**
     * Transitions the reward to UNLOCKED.
     *
     * @throws IllegalStateException if the reward is not LOCKED
     */
    public Reward unlock(Instant at) {
        requireTransition(RewardStatus.UNLOCKED);
        return new Reward(id, category, amount, description, RewardStatus.UNLOCKED, unlockDay, at, null);
    }

    /**
     * Transitions the reward to CLAIMED.
     *
     * @throws IllegalStateException if the reward is not UNLOCKED
     */
    public Reward claim(Instant at) {
        requireTransition(RewardStatus.CLAIMED);
        return new Reward(id, category, amount, description, RewardStatus.CLAIMED, unlockDay, unlockedAt, at);
    }

    public boolean isUnlocked() {
        return status != RewardStatus.LOCKED;
    }

    public boolean isClaimed() {
        return status == RewardStatus.CLAIMED;
    }

    @JsonIgnore
    public boolean isClaimable() {
        return status == RewardStatus.UNLOCKED;
    }

    /**
     * Whether challenge progress up to {@code currentDay} unlocks this reward.
     */
    public boolean isReachedBy(int currentDay) {
        return status == RewardStatus.LOCKED && unlockDay != null && unlockDay <= currentDay;
    }

    private void requireTransition(RewardStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move reward %s from %s to %s", id, status, target));
        }
    }
}
