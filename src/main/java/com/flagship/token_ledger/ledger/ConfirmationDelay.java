package com.flagship.token_ledger.ledger;

import java.time.Duration;

/**
 * Simulated network confirmation time, awaited by the ledger writer before
 * an operation validates and commits.
 */
@FunctionalInterface
public interface ConfirmationDelay {

    void await(Duration delay) throws InterruptedException;

    /**
     * Blocks the writer thread for the full delay.
     */
    static ConfirmationDelay sleeping() {
        return delay -> {
            if (!delay.isZero() && !delay.isNegative()) {
                Thread.sleep(delay.toMillis());
            }
        };
    }

    /**
     * Commits immediately.
     */
    static ConfirmationDelay none() {
        return delay -> { };
    }
}
