package com.flagship.token_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable log entry produced by exactly one committed ledger operation.
 */
@Value
public class LedgerTransaction {
    String id;
    TransactionKind kind;
    BigDecimal amount;
    TransactionStatus status;
    Instant timestamp;
    String referenceHash;
    String counterpartAddress;    // transfer/receive only
    Map<String, String> metadata;

    /**
     * Also the deserialization path, so entries reloaded from storage get
     * the same unmodifiable metadata as freshly committed ones.
     */
    @JsonCreator
    public LedgerTransaction(@JsonProperty("id") String id,
                             @JsonProperty("kind") TransactionKind kind,
                             @JsonProperty("amount") BigDecimal amount,
                             @JsonProperty("status") TransactionStatus status,
                             @JsonProperty("timestamp") Instant timestamp,
                             @JsonProperty("referenceHash") String referenceHash,
                             @JsonProperty("counterpartAddress") String counterpartAddress,
                             @JsonProperty("metadata") Map<String, String> metadata) {
        this.id = id;
        this.kind = kind;
        this.amount = amount;
        this.status = status;
        this.timestamp = timestamp;
        this.referenceHash = referenceHash;
        this.counterpartAddress = counterpartAddress;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static LedgerTransaction confirmed(String id, TransactionKind kind, BigDecimal amount,
                                              Instant timestamp, String referenceHash,
                                              String counterpartAddress, Map<String, String> metadata) {
        return new LedgerTransaction(id, kind, amount, TransactionStatus.CONFIRMED, timestamp,
            referenceHash, counterpartAddress, metadata);
    }

    /**
     * Amount with the sign this transaction applies to the primary balance.
     */
    @JsonIgnore
    public BigDecimal getSignedAmount() {
        return switch (kind.sign()) {
            case 1 -> amount;
            case -1 -> amount.negate();
            default -> BigDecimal.ZERO;
        };
    }
}
