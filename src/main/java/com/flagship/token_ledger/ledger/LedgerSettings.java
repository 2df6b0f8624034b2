package com.flagship.token_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables of a ledger instance, assembled by {@code LedgerConfig} from
 * application properties.
 */
@Value
@Builder
public class LedgerSettings {

    @Builder.Default
    BigDecimal startingPrimary = new BigDecimal("100");

    @Builder.Default
    BigDecimal startingSecondary = new BigDecimal("0.5");

    @Builder.Default
    BigDecimal annualRate = new BigDecimal("0.05");

    @Builder.Default
    int minAddressLength = 10;

    @Builder.Default
    Duration initializeDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration claimDelay = Duration.ofSeconds(2);

    @Builder.Default
    Duration contributeDelay = Duration.ofSeconds(2);

    @Builder.Default
    Duration transferDelay = Duration.ofSeconds(2);

    @Builder.Default
    Duration stakeDelay = Duration.ofSeconds(2);

    @Builder.Default
    Duration unstakeDelay = Duration.ofSeconds(2);

    public static LedgerSettings defaults() {
        return LedgerSettings.builder().build();
    }
}
