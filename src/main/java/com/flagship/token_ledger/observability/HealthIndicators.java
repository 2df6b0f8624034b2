package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.ledger.TokenLedgerService;
import com.flagship.token_ledger.persistence.KeyValueStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the token ledger.
 */
public class HealthIndicators {

    /**
     * Health of the key-value store the ledger persists into.
     * The ledger keeps working in memory while the store is down, so an
     * unreachable store reports DEGRADED rather than DOWN.
     */
    @Component("ledgerStoreHealth")
    public static class LedgerStoreHealthIndicator implements HealthIndicator {

        private final KeyValueStore store;

        public LedgerStoreHealthIndicator(KeyValueStore store) {
            this.store = store;
        }

        @Override
        public Health health() {
            try {
                if (store.ping()) {
                    return Health.up()
                            .withDetail("store", store.name())
                            .build();
                }
                return Health.status("DEGRADED")
                        .withDetail("store", store.name())
                        .withDetail("error", "No answer to ping")
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("store", store.name())
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Ledger keeps serving from memory; writes are retried on the next commit")
                        .build();
            }
        }
    }

    /**
     * Summary of the in-memory ledger.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final TokenLedgerService ledger;

        public LedgerHealthIndicator(TokenLedgerService ledger) {
            this.ledger = ledger;
        }

        @Override
        public Health health() {
            var state = ledger.getState();
            return Health.up()
                    .withDetail("initialized", state.isInitialized())
                    .withDetail("transactions", ledger.getTransactions().size())
                    .withDetail("activeStakes", state.activeStakes().size())
                    .build();
        }
    }
}
