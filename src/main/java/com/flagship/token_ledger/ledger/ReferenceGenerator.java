package com.flagship.token_ledger.ledger;

/**
 * Source of record identifiers and mock transaction hashes.
 */
public interface ReferenceGenerator {

    /**
     * New unique identifier, e.g. {@code stake_6f1c...}.
     */
    String newId(String prefix);

    /**
     * New mock transaction hash: {@code 0x} followed by 64 hex digits.
     */
    String newHash();
}
