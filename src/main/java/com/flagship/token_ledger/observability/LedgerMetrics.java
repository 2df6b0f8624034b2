package com.flagship.token_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: Counter of operations, tagged by operation and outcome
 * - ledger.operation.latency: Timer including the simulated confirmation delay
 * - ledger.persistence.failures: Counter of best-effort writes/reads that failed
 * - ledger.listener.failures: Counter of subscribers that threw
 * - ledger.balance.primary / ledger.transactions.count: Gauges
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Operation Metrics ====================

    /**
     * Records a finished operation. Outcome is "success" or the lower-cased error kind.
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Failure Metrics ====================

    public void recordPersistenceFailure(String target) {
        registry.counter("ledger.persistence.failures", "target", sanitizeTag(target)).increment();
    }

    public void recordListenerFailure(String channel) {
        registry.counter("ledger.listener.failures", "channel", sanitizeTag(channel)).increment();
    }

    public void recordForwardingFailure(String channel) {
        registry.counter("ledger.events.forwarding.failures", "channel", sanitizeTag(channel)).increment();
    }

    // ==================== Gauge Methods ====================

    public void registerBalanceGauge(Supplier<Number> supplier) {
        Gauge.builder("ledger.balance.primary", supplier)
                .description("Spendable token balance")
                .register(registry);
    }

    public void registerTransactionCountGauge(Supplier<Number> supplier) {
        Gauge.builder("ledger.transactions.count", supplier)
                .description("Entries in the transaction log")
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
