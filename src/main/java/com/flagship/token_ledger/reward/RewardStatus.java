package com.flagship.token_ledger.reward;

/**
 * Lifecycle of a reward.
 *
 * Transitions are strictly forward: LOCKED → UNLOCKED → CLAIMED.
 * A reward can never be re-locked or un-claimed.
 */
public enum RewardStatus {
    /**
     * Milestone not reached yet. Initial state of every catalogue entry.
     */
    LOCKED,

    /**
     * Milestone reached; the reward can be claimed.
     */
    UNLOCKED,

    /**
     * Reward paid out. Terminal state.
     */
    CLAIMED;

    public boolean canTransitionTo(RewardStatus target) {
        return switch (this) {
            case LOCKED -> target == UNLOCKED;
            case UNLOCKED -> target == CLAIMED;
            case CLAIMED -> false;
        };
    }
}
