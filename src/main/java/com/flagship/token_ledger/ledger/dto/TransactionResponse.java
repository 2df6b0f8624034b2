package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.transaction.LedgerTransaction;
import com.flagship.token_ledger.transaction.TransactionKind;
import com.flagship.token_ledger.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for a logged ledger transaction.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("amount")
    AmountView amount;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("reference_hash")
    String referenceHash;

    @JsonProperty("counterpart_address")
    String counterpartAddress;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .kind(transaction.getKind())
            .amount(AmountView.of(transaction.getAmount()))
            .status(transaction.getStatus())
            .timestamp(transaction.getTimestamp())
            .referenceHash(transaction.getReferenceHash())
            .counterpartAddress(transaction.getCounterpartAddress())
            .metadata(transaction.getMetadata())
            .build();
    }
}
