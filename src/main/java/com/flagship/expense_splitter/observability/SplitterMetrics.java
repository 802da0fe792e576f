package com.flagship.expense_splitter.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for ledger operations.
 *
 * Metrics exposed:
 * - splitter.operations: counter of operations, tagged with operation and status (success or
 *   the error kind)
 * - splitter.operations.latency: timer per operation
 * - splitter.settlement.size: number of payments in each computed settlement plan
 */
@Component
public class SplitterMetrics {

    public static final String STATUS_SUCCESS = "success";

    private final MeterRegistry registry;
    private final DistributionSummary settlementSize;

    public SplitterMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.settlementSize = DistributionSummary.builder("splitter.settlement.size")
                .description("Number of payments in a settlement plan")
                .baseUnit("transactions")
                .register(registry);
    }

    /**
     * Records the outcome of one service operation.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordOperation(String operation, String status) {
        registry.counter("splitter.operations",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("splitter.operations.latency",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    public void recordSettlementSize(int transactions) {
        settlementSize.record(transactions);
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
