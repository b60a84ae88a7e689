package com.flagship.hour_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for hour ledger operations.
 *
 * Metrics exposed:
 * - ledger.deductions: deduction attempts, tagged by outcome
 * - ledger.refunds: refund operations, tagged by kind and outcome
 * - ledger.hours: hours moved, tagged by direction (deducted, refunded, expired)
 * - ledger.adjustments: duration adjustments, tagged by type
 * - ledger.eligibility.checks: eligibility checks, tagged by result
 * - ledger.purchases: package purchase transitions, tagged by status
 * - ledger.expirations: expired package processing, tagged by outcome
 * - ledger.latency: operation latency, tagged by operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter hoursDeducted;
    private final Counter hoursRefunded;
    private final Counter hoursExpired;

    private final Timer expirationBatchTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.hoursDeducted = Counter.builder("ledger.hours")
                .description("Tutoring hours moved by the ledger")
                .tag("direction", "deducted")
                .register(registry);

        this.hoursRefunded = Counter.builder("ledger.hours")
                .description("Tutoring hours moved by the ledger")
                .tag("direction", "refunded")
                .register(registry);

        this.hoursExpired = Counter.builder("ledger.hours")
                .description("Tutoring hours moved by the ledger")
                .tag("direction", "expired")
                .register(registry);

        this.expirationBatchTimer = Timer.builder("ledger.expiration.batch.duration")
                .description("Time taken to process a batch of expired packages")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordDeduction(String outcome) {
        registry.counter("ledger.deductions", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRefund(String kind, String outcome) {
        registry.counter("ledger.refunds",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordHoursDeducted(BigDecimal hours) {
        hoursDeducted.increment(hours.doubleValue());
    }

    public void recordHoursRefunded(BigDecimal hours) {
        hoursRefunded.increment(hours.doubleValue());
    }

    public void recordHoursExpired(BigDecimal hours) {
        hoursExpired.increment(hours.doubleValue());
    }

    public void recordAdjustment(String type) {
        registry.counter("ledger.adjustments", "type", sanitizeTag(type)).increment();
    }

    public void recordEligibilityCheck(boolean eligible) {
        registry.counter("ledger.eligibility.checks", "eligible", String.valueOf(eligible)).increment();
    }

    public void recordPurchase(String status) {
        registry.counter("ledger.purchases", "status", sanitizeTag(status)).increment();
    }

    public void recordExpiration(String outcome) {
        registry.counter("ledger.expirations", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * Records ledger operation latency.
     */
    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public <T> T timeExpirationBatch(Supplier<T> operation) {
        return expirationBatchTimer.record(operation);
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
