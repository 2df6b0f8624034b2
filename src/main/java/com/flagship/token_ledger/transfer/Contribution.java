package com.flagship.token_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Donation to a cause. Created only by a successful contribution; immutable.
 */
@Value
public class Contribution {
    String id;
    String causeId;
    BigDecimal amount;
    Instant timestamp;
    String referenceHash;
}
