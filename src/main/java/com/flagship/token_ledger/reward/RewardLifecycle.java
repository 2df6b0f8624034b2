package com.flagship.token_ledger.reward;

import com.flagship.token_ledger.event.LedgerEventChannel;
import com.flagship.token_ledger.event.RewardClaimedEvent;
import com.flagship.token_ledger.ledger.LedgerCommit;
import com.flagship.token_ledger.ledger.LedgerErrorKind;
import com.flagship.token_ledger.ledger.LedgerException;
import com.flagship.token_ledger.ledger.LedgerState;
import com.flagship.token_ledger.ledger.ReferenceGenerator;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import com.flagship.token_ledger.transaction.TransactionKind;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reward state machine: LOCKED → UNLOCKED → CLAIMED.
 *
 * The ledger does not decide when milestones happen; it records the unlock
 * signal it is given and pays out claims. Methods validate against the
 * snapshot passed in and return a commit without touching live state.
 */
@Component
public class RewardLifecycle {

    private final Clock clock;
    private final ReferenceGenerator references;

    public RewardLifecycle(Clock clock, ReferenceGenerator references) {
        this.clock = clock;
        this.references = references;
    }

    /**
     * Seeds the catalogue when the snapshot has no rewards yet.
     */
    public Optional<LedgerState> seedCatalogue(LedgerState state, RewardCatalog catalog) {
        if (!state.getRewards().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(state.toBuilder().rewards(catalog.defaultRewards()).build());
    }

    /**
     * Unlocks a LOCKED reward. Empty when the id is unknown or the reward is
     * already unlocked, in which case nothing may be logged or published.
     */
    public Optional<LedgerCommit> unlock(LedgerState state, String rewardId) {
        return state.findReward(rewardId)
            .filter(reward -> reward.getStatus() == RewardStatus.LOCKED)
            .map(reward -> {
                LedgerState next = state.replaceReward(reward.unlock(Instant.now(clock)));
                return LedgerCommit.of(next, null).stateChanged();
            });
    }

    /**
     * Ids of LOCKED rewards whose unlock day has been reached, in catalogue order.
     */
    public List<String> reachedBy(LedgerState state, int currentDay) {
        if (currentDay < 0) {
            throw new LedgerException(LedgerErrorKind.INVALID_AMOUNT,
                "Challenge day cannot be negative: " + currentDay);
        }
        return state.getRewards().stream()
            .filter(reward -> reward.isReachedBy(currentDay))
            .map(Reward::getId)
            .toList();
    }

    /**
     * Unlocks the given LOCKED rewards in one commit with a single
     * {@code state_changed}. Empty when none of them changes.
     */
    public Optional<LedgerCommit> unlockAll(LedgerState state, List<String> rewardIds) {
        LedgerState next = state;
        Instant now = Instant.now(clock);
        for (String rewardId : rewardIds) {
            Optional<Reward> locked = next.findReward(rewardId)
                .filter(reward -> reward.getStatus() == RewardStatus.LOCKED);
            if (locked.isPresent()) {
                next = next.replaceReward(locked.get().unlock(now));
            }
        }
        return next == state ? Optional.empty() : Optional.of(LedgerCommit.of(next, null).stateChanged());
    }

    /**
     * Pays out an UNLOCKED reward.
     *
     * @throws LedgerException NOT_FOUND, NOT_UNLOCKED or ALREADY_CLAIMED
     */
    public LedgerCommit claim(LedgerState state, String rewardId) {
        Reward reward = state.findReward(rewardId)
            .orElseThrow(() -> LedgerException.notFound("Reward", rewardId));

        if (reward.getStatus() == RewardStatus.LOCKED) {
            throw new LedgerException(LedgerErrorKind.NOT_UNLOCKED, "Reward not unlocked yet: " + rewardId);
        }
        if (reward.getStatus() == RewardStatus.CLAIMED) {
            throw new LedgerException(LedgerErrorKind.ALREADY_CLAIMED, "Reward already claimed: " + rewardId);
        }

        Instant now = Instant.now(clock);
        Reward claimed = reward.claim(now);

        LedgerState next = state.replaceReward(claimed).toBuilder()
            .balance(state.getBalance().credit(reward.getAmount()))
            .totals(state.getTotals().addEarned(reward.getAmount()))
            .build();

        LedgerTransaction transaction = LedgerTransaction.confirmed(
            references.newId("claim"),
            TransactionKind.CLAIM_REWARD,
            reward.getAmount(),
            now,
            references.newHash(),
            null,
            Map.of("rewardId", rewardId, "description", reward.getDescription())
        );

        return LedgerCommit.of(next, transaction)
            .balanceUpdated()
            .publish(LedgerEventChannel.REWARD_CLAIMED, new RewardClaimedEvent(claimed, transaction))
            .stateChanged();
    }
}
