package com.flagship.token_ledger.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.ledger.LedgerState;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Loads and saves the ledger snapshot and transaction log as two
 * independent JSON blobs.
 *
 * Failure handling:
 * - {@link #load()} never throws; absent, unreadable or malformed data
 *   yields the default state and an empty log
 * - writes are best effort; a failure is logged and counted, and the
 *   in-memory commit that triggered it stands
 */
@Component
@Slf4j
public class LedgerPersistenceAdapter {

    private static final TypeReference<List<LedgerTransaction>> TRANSACTION_LIST = new TypeReference<>() { };

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;
    private final StorageKeys keys;

    public LedgerPersistenceAdapter(KeyValueStore store, ObjectMapper objectMapper,
                                    LedgerMetrics metrics, StorageKeys keys) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.keys = keys;
    }

    @Value
    public static class StorageKeys {
        String stateKey;
        String transactionsKey;

        public static StorageKeys defaults() {
            return new StorageKeys("token-ledger:state", "token-ledger:transactions");
        }
    }

    @Value
    public static class PersistedLedger {
        LedgerState state;
        List<LedgerTransaction> transactions;
    }

    public PersistedLedger load() {
        LedgerState state = read(keys.getStateKey(), "state")
            .flatMap(this::parseState)
            .orElseGet(LedgerState::empty);
        List<LedgerTransaction> transactions = read(keys.getTransactionsKey(), "transactions")
            .flatMap(this::parseTransactions)
            .orElseGet(List::of);

        log.info("Loaded ledger from {} store: initialized={}, rewards={}, transactions={}",
            store.name(), state.isInitialized(), state.getRewards().size(), transactions.size());
        return new PersistedLedger(state, transactions);
    }

    public void save(LedgerState state) {
        write(keys.getStateKey(), "state", state);
    }

    public void saveLog(List<LedgerTransaction> transactions) {
        write(keys.getTransactionsKey(), "transactions", transactions);
    }

    /**
     * Removes both blobs. Best effort like every other write.
     */
    public void clear() {
        for (String key : List.of(keys.getStateKey(), keys.getTransactionsKey())) {
            try {
                store.delete(key);
            } catch (RuntimeException e) {
                metrics.recordPersistenceFailure("clear");
                log.warn("Failed to delete {} from {} store: {}", key, store.name(), e.getMessage());
            }
        }
    }

    private Optional<String> read(String key, String target) {
        try {
            return store.get(key);
        } catch (RuntimeException e) {
            metrics.recordPersistenceFailure(target);
            log.warn("Failed to read {} from {} store, starting from defaults: {}",
                target, store.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<LedgerState> parseState(String json) {
        try {
            LedgerState state = objectMapper.readValue(json, LedgerState.class);
            if (state == null || !state.isWellFormed()) {
                log.warn("Stored ledger state is incomplete, starting from defaults");
                return Optional.empty();
            }
            return Optional.of(state.toBuilder()
                .rewards(List.copyOf(state.getRewards()))
                .stakes(List.copyOf(state.getStakes()))
                .contributions(List.copyOf(state.getContributions()))
                .build());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Stored ledger state is unreadable, starting from defaults: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<List<LedgerTransaction>> parseTransactions(String json) {
        try {
            List<LedgerTransaction> transactions = objectMapper.readValue(json, TRANSACTION_LIST);
            if (transactions == null || transactions.contains(null)) {
                log.warn("Stored transaction log is incomplete, starting with an empty log");
                return Optional.empty();
            }
            return Optional.of(List.copyOf(transactions));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Stored transaction log is unreadable, starting with an empty log: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, String target, Object value) {
        try {
            store.put(key, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException | RuntimeException e) {
            metrics.recordPersistenceFailure(target);
            log.warn("Failed to persist {} to {} store: {}", target, store.name(), e.getMessage());
        }
    }
}
