package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.event.LedgerEventChannel;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validated operation, built off to the side of the live state.
 *
 * Nothing is visible to readers until the writer applies the commit: the new
 * snapshot, the log entry (if any) and the events to publish, in order.
 */
@Value
public class LedgerCommit {
    LedgerState state;
    LedgerTransaction transaction;    // null for operations that do not log
    List<Notification> notifications;

    public static Builder of(LedgerState state, LedgerTransaction transaction) {
        return new Builder(state, transaction);
    }

    @Value
    public static class Notification {
        LedgerEventChannel channel;
        Object payload;
    }

    public static final class Builder {
        private final LedgerState state;
        private final LedgerTransaction transaction;
        private final List<Notification> notifications = new ArrayList<>();

        private Builder(LedgerState state, LedgerTransaction transaction) {
            this.state = state;
            this.transaction = transaction;
        }

        public Builder publish(LedgerEventChannel channel, Object payload) {
            notifications.add(new Notification(channel, payload));
            return this;
        }

        /**
         * Adds {@code balance_updated} with the new balance.
         */
        public Builder balanceUpdated() {
            return publish(LedgerEventChannel.BALANCE_UPDATED, state.getBalance());
        }

        /**
         * Adds {@code state_changed} with the new snapshot. Always published last.
         */
        public LedgerCommit stateChanged() {
            notifications.add(new Notification(LedgerEventChannel.STATE_CHANGED, state));
            return new LedgerCommit(state, transaction, List.copyOf(notifications));
        }
    }
}
