package com.flagship.token_ledger.staking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InterestCalculatorTest {

    private final InterestCalculator calculator = new InterestCalculator(new BigDecimal("0.05"));

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("A full year at 5% on 1000 accrues 50")
    void testFullYear() {
        assertAmount("50", calculator.accrued(new BigDecimal("1000"), Duration.ofDays(365)));
    }

    @Test
    @DisplayName("Interest is prorated linearly by elapsed time")
    void testProrated() {
        BigDecimal half = calculator.accrued(new BigDecimal("1000"), Duration.ofDays(365).dividedBy(2));
        assertAmount("25", half);
        BigDecimal oneDay = calculator.accrued(new BigDecimal("365"), Duration.ofDays(1));
        assertAmount("0.05", oneDay);
    }

    @Test
    @DisplayName("Zero or negative elapsed time accrues nothing")
    void testNoElapsedTime() {
        assertAmount("0", calculator.accrued(new BigDecimal("1000"), Duration.ZERO));
        assertAmount("0", calculator.accrued(new BigDecimal("1000"), Duration.ofHours(-3)));
    }

    @Test
    @DisplayName("Projection and APY reflect the configured annual rate")
    void testProjectionAndApy() {
        assertAmount("5", calculator.apyPercent());
        assertAmount("50", calculator.project(new BigDecimal("1000"), 365));
        assertAmount("0", calculator.project(new BigDecimal("1000"), 0));
    }

    @Test
    @DisplayName("Negative rates are rejected")
    void testNegativeRate() {
        assertThrows(IllegalArgumentException.class, () -> new InterestCalculator(new BigDecimal("-0.01")));
    }
}
