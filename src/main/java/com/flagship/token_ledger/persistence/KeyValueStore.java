package com.flagship.token_ledger.persistence;

import java.util.Optional;

/**
 * Minimal string key-value storage the ledger persists into.
 *
 * Implementations may throw unchecked exceptions when the backing store is
 * unreachable; {@link LedgerPersistenceAdapter} absorbs them.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void delete(String key);

    /**
     * @return true if the store answered
     */
    boolean ping();

    /**
     * Short name used in logs, metrics and health details.
     */
    String name();
}
