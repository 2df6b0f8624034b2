package com.flagship.token_ledger.reward;

import java.math.BigDecimal;
import java.util.List;

/**
 * Fixed milestone schedule used to seed an empty reward catalogue.
 */
public class RewardCatalog {

    private final List<Reward> defaults;

    public RewardCatalog(List<Reward> defaults) {
        for (Reward reward : defaults) {
            if (reward.getStatus() != RewardStatus.LOCKED) {
                throw new IllegalArgumentException("Catalogue rewards must start LOCKED: " + reward.getId());
            }
        }
        this.defaults = List.copyOf(defaults);
    }

    /**
     * The 21-day challenge schedule.
     */
    public static RewardCatalog standard() {
        return new RewardCatalog(List.of(
            Reward.locked("day_7_milestone", RewardCategory.MILESTONE, new BigDecimal("5"),
                "Completed 7 vegan days", 7),
            Reward.locked("day_14_milestone", RewardCategory.MILESTONE, new BigDecimal("10"),
                "Two weeks of vegan commitment", 14),
            Reward.locked("day_21_milestone", RewardCategory.MILESTONE, new BigDecimal("20"),
                "Completed the 21-day challenge", 21),
            Reward.locked("community_champion", RewardCategory.BONUS, new BigDecimal("25"),
                "Contributed to the vegan community", null)
        ));
    }

    public List<Reward> defaultRewards() {
        return defaults;
    }
}
