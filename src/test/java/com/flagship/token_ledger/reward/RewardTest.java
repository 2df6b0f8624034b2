package com.flagship.token_ledger.reward;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reward state machine.
 *
 * These tests verify that:
 * - LOCKED → UNLOCKED → CLAIMED is the only path
 * - invalid transitions are rejected
 * - the catalogue only accepts LOCKED entries
 */
class RewardTest {

    private static final Instant UNLOCKED_AT = Instant.parse("2024-03-08T09:00:00Z");
    private static final Instant CLAIMED_AT = Instant.parse("2024-03-08T10:00:00Z");

    private final Reward locked = Reward.locked("day_7_milestone", RewardCategory.MILESTONE,
        new BigDecimal("5"), "Completed 7 vegan days", 7);

    @Test
    @DisplayName("Unlock then claim stamps both timestamps")
    void testForwardTransitions() {
        Reward unlocked = locked.unlock(UNLOCKED_AT);
        Reward claimed = unlocked.claim(CLAIMED_AT);

        assertEquals(RewardStatus.UNLOCKED, unlocked.getStatus());
        assertTrue(unlocked.isUnlocked());
        assertTrue(unlocked.isClaimable());
        assertFalse(unlocked.isClaimed());

        assertEquals(RewardStatus.CLAIMED, claimed.getStatus());
        assertEquals(UNLOCKED_AT, claimed.getUnlockedAt());
        assertEquals(CLAIMED_AT, claimed.getClaimedAt());
        assertTrue(claimed.isUnlocked());
        assertFalse(claimed.isClaimable());
    }

    @Test
    @DisplayName("Claiming a locked reward is rejected")
    void testClaimLocked() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> locked.claim(CLAIMED_AT));
        assertTrue(e.getMessage().contains("LOCKED"));
    }

    @Test
    @DisplayName("Claimed is terminal")
    void testClaimedIsTerminal() {
        Reward claimed = locked.unlock(UNLOCKED_AT).claim(CLAIMED_AT);

        assertThrows(IllegalStateException.class, () -> claimed.claim(CLAIMED_AT));
        assertThrows(IllegalStateException.class, () -> claimed.unlock(UNLOCKED_AT));
        assertFalse(RewardStatus.CLAIMED.canTransitionTo(RewardStatus.LOCKED));
        assertFalse(RewardStatus.UNLOCKED.canTransitionTo(RewardStatus.LOCKED));
    }

    @Test
    @DisplayName("Only locked milestones at or before the current day are reached")
    void testReachedBy() {
        Reward bonus = Reward.locked("community_champion", RewardCategory.BONUS,
            new BigDecimal("25"), "Contributed to the vegan community", null);

        assertFalse(locked.isReachedBy(6));
        assertTrue(locked.isReachedBy(7));
        assertFalse(locked.unlock(UNLOCKED_AT).isReachedBy(30));
        assertFalse(bonus.isReachedBy(365));
    }

    @Test
    @DisplayName("Standard catalogue holds the four challenge rewards")
    void testStandardCatalogue() {
        List<Reward> rewards = RewardCatalog.standard().defaultRewards();

        assertEquals(4, rewards.size());
        assertEquals(0, new BigDecimal("60").compareTo(rewards.stream()
            .map(Reward::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)));
        assertThrows(IllegalArgumentException.class,
            () -> new RewardCatalog(List.of(locked.unlock(UNLOCKED_AT))));
    }
}
