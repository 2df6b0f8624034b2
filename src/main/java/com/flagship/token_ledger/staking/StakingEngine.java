package com.flagship.token_ledger.staking;

import com.flagship.token_ledger.ledger.LedgerCommit;
import com.flagship.token_ledger.ledger.LedgerException;
import com.flagship.token_ledger.ledger.LedgerState;
import com.flagship.token_ledger.ledger.ReferenceGenerator;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import com.flagship.token_ledger.transaction.TransactionKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Opens and closes stake positions.
 *
 * Interest is computed once, when the stake closes, from the real elapsed
 * time on the injected clock.
 */
@Component
public class StakingEngine {

    private final Clock clock;
    private final ReferenceGenerator references;
    private final InterestCalculator interest;

    public StakingEngine(Clock clock, ReferenceGenerator references, InterestCalculator interest) {
        this.clock = clock;
        this.references = references;
        this.interest = interest;
    }

    /**
     * @throws LedgerException INVALID_AMOUNT or INSUFFICIENT_BALANCE
     */
    public LedgerCommit stake(LedgerState state, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw LedgerException.invalidAmount(amount);
        }
        if (!state.getBalance().covers(amount)) {
            throw LedgerException.insufficientBalance(amount, state.getBalance().getPrimary());
        }

        Instant now = Instant.now(clock);
        String hash = references.newHash();
        Stake stake = Stake.open(references.newId("stake"), amount, now, hash);

        LedgerState next = state.addStake(stake).toBuilder()
            .balance(state.getBalance().debit(amount))
            .totals(state.getTotals().addStaked(amount))
            .build();

        LedgerTransaction transaction = LedgerTransaction.confirmed(
            references.newId("stake_tx"),
            TransactionKind.STAKE_TOKENS,
            amount,
            now,
            hash,
            null,
            Map.of("stakeId", stake.getId())
        );

        return LedgerCommit.of(next, transaction).balanceUpdated().stateChanged();
    }

    /**
     * Closes an active stake and returns principal plus accrued interest.
     *
     * @throws LedgerException NOT_FOUND if no active stake has this id
     */
    public LedgerCommit unstake(LedgerState state, String stakeId) {
        Stake stake = state.findActiveStake(stakeId)
            .orElseThrow(() -> LedgerException.notFound("Active stake", stakeId));

        Instant now = Instant.now(clock);
        BigDecimal rewards = interest.accrued(stake.getPrincipal(), Duration.between(stake.getOpenedAt(), now));
        BigDecimal returned = stake.getPrincipal().add(rewards);

        LedgerState next = state.replaceStake(stake.close(now, rewards)).toBuilder()
            .balance(state.getBalance().credit(returned))
            .totals(state.getTotals().releaseStake(stake.getPrincipal(), rewards))
            .build();

        LedgerTransaction transaction = LedgerTransaction.confirmed(
            references.newId("unstake_tx"),
            TransactionKind.UNSTAKE_TOKENS,
            returned,
            now,
            references.newHash(),
            null,
            Map.of(
                "stakeId", stakeId,
                "principal", stake.getPrincipal().toPlainString(),
                "rewards", rewards.toPlainString()
            )
        );

        return LedgerCommit.of(next, transaction).balanceUpdated().stateChanged();
    }
}
