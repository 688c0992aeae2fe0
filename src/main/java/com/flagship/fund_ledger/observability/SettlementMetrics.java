package com.flagship.fund_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for fund movements.
 *
 * Metrics exposed:
 * - settlements.completed{kind, status}: single and bulk salary settlements
 * - settlements.latency{kind}: settlement duration
 * - fund.availability.checks{result}: outcome of every availability check
 * - allocations.transitions{status}: allocation status changes, including creation
 * - consumption.records{kind, status}: expenses, bills and contract payments written or reviewed
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSettlement(String kind, String status) {
        registry.counter("settlements.completed",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordSettlementLatency(String kind, long durationMs) {
        registry.timer("settlements.latency",
                "kind", sanitizeTag(kind)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordAvailabilityCheck(String result) {
        registry.counter("fund.availability.checks", "result", sanitizeTag(result)).increment();
    }

    public void recordAllocationTransition(String status) {
        registry.counter("allocations.transitions", "status", sanitizeTag(status)).increment();
    }

    public void recordConsumption(String kind, String status) {
        registry.counter("consumption.records",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    /**
     * Keeps tag values to a bounded alphabet and length.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
