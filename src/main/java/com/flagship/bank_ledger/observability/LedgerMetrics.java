package com.flagship.bank_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transfers: counter tagged with outcome (success or an error code)
 * - ledger.fundings: counter tagged with outcome
 * - ledger.operation.latency: timer tagged with operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransfer(String outcome) {
        registry.counter("ledger.transfers", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordFunding(String outcome) {
        registry.counter("ledger.fundings", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
