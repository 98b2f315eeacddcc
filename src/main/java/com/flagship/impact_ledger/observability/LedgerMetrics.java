package com.flagship.impact_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Micrometer meters for ledger operations.
 *
 * - ledger.transactions.created{mode,status}
 * - ledger.transactions.transitions{target,result}
 * - ledger.impact.credited (distribution summary of credited impact)
 * - ledger.giftcards.redeemed{result}
 * - ledger.operation.latency{operation}
 * - idempotency.cache{result}
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransactionCreated(String mode, String status) {
        registry.counter("ledger.transactions.created",
                "mode", sanitizeTag(mode),
                "status", sanitizeTag(status)
        ).increment();
    }

    /**
     * @param result applied, replayed, rejected or error
     */
    public void recordStatusTransition(String target, String result) {
        registry.counter("ledger.transactions.transitions",
                "target", sanitizeTag(target),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordImpactCredited(BigDecimal impact) {
        registry.summary("ledger.impact.credited").record(impact.doubleValue());
    }

    public void recordGiftCardRedemption(String result) {
        registry.counter("ledger.giftcards.redeemed", "result", sanitizeTag(result)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
