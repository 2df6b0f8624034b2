package com.flagship.token_ledger.persistence;

import com.flagship.token_ledger.config.JacksonConfig;
import com.flagship.token_ledger.ledger.Balance;
import com.flagship.token_ledger.ledger.LedgerState;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.persistence.LedgerPersistenceAdapter.PersistedLedger;
import com.flagship.token_ledger.persistence.LedgerPersistenceAdapter.StorageKeys;
import com.flagship.token_ledger.reward.RewardCatalog;
import com.flagship.token_ledger.staking.Stake;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import com.flagship.token_ledger.transaction.TransactionKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Snapshot and log persistence.
 *
 * These tests verify that:
 * - timestamps and amounts round-trip exactly
 * - absent, corrupt or incomplete data loads as defaults
 * - store failures are absorbed and counted
 */
class LedgerPersistenceAdapterTest {

    private static final Instant OPENED_AT = Instant.parse("2024-03-01T09:15:30.123456789Z");

    private InMemoryKeyValueStore store;
    private SimpleMeterRegistry registry;
    private LedgerPersistenceAdapter adapter;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        registry = new SimpleMeterRegistry();
        adapter = adapterOver(store);
    }

    private LedgerPersistenceAdapter adapterOver(KeyValueStore backing) {
        return new LedgerPersistenceAdapter(backing, JacksonConfig.ledgerObjectMapper(),
            new LedgerMetrics(registry), StorageKeys.defaults());
    }

    private LedgerState sampleState() {
        return LedgerState.builder()
            .initialized(true)
            .accountId("0xA11CE00000000000000000000000000000000001")
            .balance(new Balance(new BigDecimal("50.123456789"), new BigDecimal("0.5")))
            .rewards(RewardCatalog.standard().defaultRewards())
            .stakes(List.of(Stake.open("stake_1", new BigDecimal("100"), OPENED_AT, "0xabc")))
            .build();
    }

    @Test
    @DisplayName("Saved snapshot and log load back unchanged")
    void testRoundTrip() {
        LedgerState state = sampleState();
        LedgerTransaction transaction = LedgerTransaction.confirmed("stake_tx_1", TransactionKind.STAKE_TOKENS,
            new BigDecimal("100"), OPENED_AT, "0xabc", null, Map.of("stakeId", "stake_1"));

        adapter.save(state);
        adapter.saveLog(List.of(transaction));
        PersistedLedger loaded = adapter.load();

        assertEquals(state, loaded.getState());
        assertEquals(OPENED_AT, loaded.getState().getStakes().get(0).getOpenedAt());
        assertEquals(List.of(transaction), loaded.getTransactions());
        assertTrue(store.get("token-ledger:state").orElseThrow().contains("2024-03-01T09:15:30.123456789Z"));
        assertTrue(store.get("token-ledger:transactions").orElseThrow().contains("\"stake_tokens\""));
    }

    @Test
    @DisplayName("Loaded collections cannot be modified")
    void testLoadedStateIsImmutable() {
        adapter.save(sampleState());

        LedgerState loaded = adapter.load().getState();

        assertThrows(UnsupportedOperationException.class, () -> loaded.getRewards().clear());
        assertThrows(UnsupportedOperationException.class, () -> loaded.getStakes().clear());
    }

    @Test
    @DisplayName("Loaded transaction metadata cannot be modified")
    void testLoadedMetadataIsImmutable() {
        store.put("token-ledger:transactions", "[{\"id\": \"transfer_1\", \"kind\": \"transfer\", "
            + "\"amount\": 10, \"status\": \"confirmed\", \"timestamp\": \"2024-03-01T09:15:30Z\", "
            + "\"referenceHash\": \"0xabc\", \"counterpartAddress\": \"0xB0B0000000000000000000000000000000000002\", "
            + "\"metadata\": {\"note\": \"lunch\"}}]");

        LedgerTransaction loaded = adapter.load().getTransactions().get(0);

        assertEquals(Map.of("note", "lunch"), loaded.getMetadata());
        assertThrows(UnsupportedOperationException.class, () -> loaded.getMetadata().put("note", "rewritten"));
    }

    @Test
    @DisplayName("Absent data loads as the default state")
    void testAbsentData() {
        PersistedLedger loaded = adapter.load();

        assertEquals(LedgerState.empty(), loaded.getState());
        assertTrue(loaded.getTransactions().isEmpty());
    }

    @Test
    @DisplayName("Unparsable or incomplete blobs load as defaults")
    void testCorruptData() {
        store.put("token-ledger:state", "{not json");
        store.put("token-ledger:transactions", "[{\"id\": 42, \"kind\": \"no_such_kind\"}]");

        PersistedLedger loaded = assertDoesNotThrow(adapter::load);
        assertEquals(LedgerState.empty(), loaded.getState());
        assertTrue(loaded.getTransactions().isEmpty());

        store.put("token-ledger:state", "{\"initialized\": true, \"balance\": null}");
        assertFalse(adapter.load().getState().isInitialized());

        store.put("token-ledger:state", "{\"balance\": {\"primary\": -5, \"secondary\": 0}}");
        assertEquals(LedgerState.empty(), adapter.load().getState());
    }

    @Test
    @DisplayName("Store failures are logged, counted and never thrown")
    void testStoreFailures() {
        KeyValueStore broken = new KeyValueStore() {
            @Override
            public Optional<String> get(String key) {
                throw new IllegalStateException("connection refused");
            }

            @Override
            public void put(String key, String value) {
                throw new IllegalStateException("connection refused");
            }

            @Override
            public void delete(String key) {
                throw new IllegalStateException("connection refused");
            }

            @Override
            public boolean ping() {
                return false;
            }

            @Override
            public String name() {
                return "broken";
            }
        };
        LedgerPersistenceAdapter failing = adapterOver(broken);

        assertDoesNotThrow(() -> failing.save(sampleState()));
        assertDoesNotThrow(() -> failing.saveLog(List.of()));
        assertDoesNotThrow(failing::clear);
        assertEquals(LedgerState.empty(), failing.load().getState());

        assertEquals(2.0, registry.get("ledger.persistence.failures").tag("target", "state").counter().count());
        assertEquals(2.0, registry.get("ledger.persistence.failures").tag("target", "transactions").counter().count());
        assertEquals(2.0, registry.get("ledger.persistence.failures").tag("target", "clear").counter().count());
    }

    @Test
    @DisplayName("Clear removes both blobs")
    void testClear() {
        adapter.save(sampleState());
        adapter.saveLog(List.of());

        adapter.clear();

        assertTrue(store.get("token-ledger:state").isEmpty());
        assertTrue(store.get("token-ledger:transactions").isEmpty());
    }
}
