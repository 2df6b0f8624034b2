package com.flagship.token_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Token balance of the ledger account.
 *
 * {@code primary} is the spendable token amount, {@code secondary} the
 * gas-equivalent amount. Neither may ever be negative; changes produce a
 * new instance.
 */
@Value
public class Balance {
    BigDecimal primary;
    BigDecimal secondary;

    @JsonCreator
    public Balance(@JsonProperty("primary") BigDecimal primary,
                   @JsonProperty("secondary") BigDecimal secondary) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondary = Objects.requireNonNull(secondary, "secondary");
        if (primary.signum() < 0 || secondary.signum() < 0) {
            throw new IllegalStateException(
                String.format("Balance cannot be negative: primary=%s, secondary=%s", primary, secondary));
        }
    }

    public static Balance zero() {
        return new Balance(BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public boolean covers(BigDecimal amount) {
        return primary.compareTo(amount) >= 0;
    }

    public Balance credit(BigDecimal amount) {
        return new Balance(primary.add(amount), secondary);
    }

    public Balance creditSecondary(BigDecimal amount) {
        return new Balance(primary, secondary.add(amount));
    }

    /**
     * @throws IllegalStateException if the debit would make the primary balance negative
     */
    public Balance debit(BigDecimal amount) {
        return new Balance(primary.subtract(amount), secondary);
    }
}
