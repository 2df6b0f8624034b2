package com.flagship.token_ledger.transfer;

import com.flagship.token_ledger.event.ContributionMadeEvent;
import com.flagship.token_ledger.event.LedgerEventChannel;
import com.flagship.token_ledger.ledger.LedgerCommit;
import com.flagship.token_ledger.ledger.LedgerErrorKind;
import com.flagship.token_ledger.ledger.LedgerException;
import com.flagship.token_ledger.ledger.LedgerSettings;
import com.flagship.token_ledger.ledger.LedgerState;
import com.flagship.token_ledger.ledger.ReferenceGenerator;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import com.flagship.token_ledger.transaction.TransactionKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Balance-changing operations that are not rewards or stakes:
 * the starting grant, contributions, outbound transfers, inbound receipts
 * and journal-only activity entries.
 */
@Component
public class TransferEngine {

    private final Clock clock;
    private final ReferenceGenerator references;
    private final LedgerSettings settings;

    public TransferEngine(Clock clock, ReferenceGenerator references, LedgerSettings settings) {
        this.clock = clock;
        this.references = references;
        this.settings = settings;
    }

    /**
     * Seeds the starting balance of a fresh account.
     * The primary grant is logged so the log replays to the balance.
     */
    public LedgerCommit grantStartingBalance(LedgerState state, String accountId) {
        Instant now = Instant.now(clock);
        LedgerState next = state.toBuilder()
            .initialized(true)
            .accountId(accountId)
            .balance(state.getBalance()
                .credit(settings.getStartingPrimary())
                .creditSecondary(settings.getStartingSecondary()))
            .build();

        LedgerTransaction transaction = LedgerTransaction.confirmed(
            references.newId("grant"),
            TransactionKind.INITIAL_GRANT,
            settings.getStartingPrimary(),
            now,
            references.newHash(),
            null,
            Map.of("accountId", accountId, "secondary", settings.getStartingSecondary().toPlainString())
        );

        return LedgerCommit.of(next, transaction).balanceUpdated().stateChanged();
    }

    /**
     * @throws LedgerException INVALID_AMOUNT or INSUFFICIENT_BALANCE
     */
    public LedgerCommit contribute(LedgerState state, String causeId, BigDecimal amount) {
        requireSpendable(state, amount);

        Instant now = Instant.now(clock);
        String hash = references.newHash();
        Contribution contribution = new Contribution(references.newId("contrib"), causeId, amount, now, hash);

        LedgerState next = state.addContribution(contribution).toBuilder()
            .balance(state.getBalance().debit(amount))
            .totals(state.getTotals().addContributed(amount))
            .build();

        LedgerTransaction transaction = LedgerTransaction.confirmed(
            references.newId("contrib_tx"),
            TransactionKind.CONTRIBUTE,
            amount,
            now,
            hash,
            null,
            Map.of("causeId", causeId, "contributionId", contribution.getId())
        );

        return LedgerCommit.of(next, transaction)
            .balanceUpdated()
            .publish(LedgerEventChannel.CONTRIBUTION_MADE, new ContributionMadeEvent(contribution, transaction))
            .stateChanged();
    }

    /**
     * @throws LedgerException INVALID_AMOUNT, INSUFFICIENT_BALANCE or INVALID_ADDRESS
     */
    public LedgerCommit transfer(LedgerState state, String toAddress, BigDecimal amount, String note) {
        requireSpendable(state, amount);
        if (toAddress == null || toAddress.isBlank() || toAddress.trim().length() < settings.getMinAddressLength()) {
            throw new LedgerException(LedgerErrorKind.INVALID_ADDRESS,
                String.format("Invalid destination address: %s (minimum %d characters)",
                    toAddress, settings.getMinAddressLength()));
        }

        LedgerState next = state.toBuilder()
            .balance(state.getBalance().debit(amount))
            .build();

        LedgerTransaction transaction = LedgerTransaction.confirmed(
            references.newId("transfer"),
            TransactionKind.TRANSFER,
            amount,
            Instant.now(clock),
            references.newHash(),
            toAddress.trim(),
            noteMetadata(note)
        );

        return LedgerCommit.of(next, transaction).balanceUpdated().stateChanged();
    }

    /**
     * Reflects an inbound transfer. Only a negative amount is rejected.
     */
    public LedgerCommit receive(LedgerState state, String fromAddress, BigDecimal amount, String note) {
        if (amount == null || amount.signum() < 0) {
            throw new LedgerException(LedgerErrorKind.INVALID_AMOUNT,
                "Received amount cannot be negative: " + amount);
        }

        LedgerState next = state.toBuilder()
            .balance(state.getBalance().credit(amount))
            .totals(state.getTotals().addEarned(amount))
            .build();

        LedgerTransaction transaction = LedgerTransaction.confirmed(
            references.newId("receive"),
            TransactionKind.RECEIVE,
            amount,
            Instant.now(clock),
            references.newHash(),
            fromAddress,
            noteMetadata(note)
        );

        return LedgerCommit.of(next, transaction).balanceUpdated().stateChanged();
    }

    /**
     * Journals a check-in or community validation. Balances are untouched.
     */
    public LedgerCommit recordActivity(LedgerState state, TransactionKind kind, BigDecimal amount, String description) {
        if (kind == null || !kind.isActivity()) {
            throw new LedgerException(LedgerErrorKind.INVALID_AMOUNT,
                "Not an activity kind: " + kind);
        }
        if (amount == null || amount.signum() < 0) {
            throw new LedgerException(LedgerErrorKind.INVALID_AMOUNT,
                "Activity amount cannot be negative: " + amount);
        }

        LedgerTransaction transaction = LedgerTransaction.confirmed(
            references.newId(kind.wireName()),
            kind,
            amount,
            Instant.now(clock),
            references.newHash(),
            null,
            description == null ? Map.of() : Map.of("description", description)
        );

        return LedgerCommit.of(state, transaction).stateChanged();
    }

    private void requireSpendable(LedgerState state, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw LedgerException.invalidAmount(amount);
        }
        if (!state.getBalance().covers(amount)) {
            throw LedgerException.insufficientBalance(amount, state.getBalance().getPrimary());
        }
    }

    private Map<String, String> noteMetadata(String note) {
        Map<String, String> metadata = new HashMap<>();
        if (note != null && !note.isBlank()) {
            metadata.put("note", note);
        }
        return metadata;
    }
}
