package com.flagship.token_ledger.staking;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.Objects;

/**
 * Simple (non-compounding) interest prorated by elapsed time.
 *
 * {@code accrued = principal × annualRate × elapsedDays / 365}
 */
public class InterestCalculator {

    private static final BigDecimal MILLIS_PER_YEAR = BigDecimal.valueOf(Duration.ofDays(365).toMillis());
    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);

    private final BigDecimal annualRate;

    public InterestCalculator(BigDecimal annualRate) {
        this.annualRate = Objects.requireNonNull(annualRate, "annualRate");
        if (annualRate.signum() < 0) {
            throw new IllegalArgumentException("Annual rate cannot be negative: " + annualRate);
        }
    }

    public BigDecimal annualRate() {
        return annualRate;
    }

    /**
     * Annual rate as a percentage, e.g. 5 for 0.05.
     */
    public BigDecimal apyPercent() {
        return annualRate.movePointRight(2).stripTrailingZeros();
    }

    /**
     * Interest accrued on {@code principal} over {@code elapsed}.
     * A negative duration (clock moved backwards) accrues nothing.
     */
    public BigDecimal accrued(BigDecimal principal, Duration elapsed) {
        if (elapsed.isNegative() || elapsed.isZero()) {
            return BigDecimal.ZERO;
        }
        return principal.multiply(annualRate)
            .multiply(BigDecimal.valueOf(elapsed.toMillis()))
            .divide(MILLIS_PER_YEAR, MathContext.DECIMAL64);
    }

    /**
     * Projected interest for a hypothetical stake held {@code days} days.
     */
    public BigDecimal project(BigDecimal principal, int days) {
        if (days <= 0) {
            return BigDecimal.ZERO;
        }
        return principal.multiply(annualRate)
            .multiply(BigDecimal.valueOf(days))
            .divide(DAYS_PER_YEAR, MathContext.DECIMAL64);
    }
}
