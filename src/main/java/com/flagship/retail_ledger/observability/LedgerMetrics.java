package com.flagship.retail_ledger.observability;

import com.flagship.retail_ledger.exception.ErrorKind;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for engine operations.
 *
 * Metrics:
 * - ledger.operations: operation outcomes, tagged by operation and outcome
 *   (success, replayed, or the lower-cased error kind)
 * - ledger.operations.latency: timer per operation
 * - ledger.bulk.rows: bulk rows by outcome
 * - idempotency.cache: hit / miss
 */
@Component
public class LedgerMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_REPLAYED = "replayed";
    private static final String OUTCOME_UNEXPECTED = "unexpected_error";

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSuccess(String operation, Duration duration) {
        record(operation, OUTCOME_SUCCESS, duration);
    }

    public void recordReplay(String operation, Duration duration) {
        record(operation, OUTCOME_REPLAYED, duration);
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordFailure(String operation, ErrorKind kind, Duration duration) {
        record(operation, kind.name().toLowerCase(), duration);
    }

    public void recordUnexpectedFailure(String operation, Duration duration) {
        record(operation, OUTCOME_UNEXPECTED, duration);
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordBulkRows(String operation, int updated, int skipped) {
        registry.counter("ledger.bulk.rows", "operation", operation, "outcome", "updated").increment(updated);
        registry.counter("ledger.bulk.rows", "operation", operation, "outcome", "skipped").increment(skipped);
    }

    private void record(String operation, String outcome, Duration duration) {
        registry.counter("ledger.operations",
                "operation", operation,
                "outcome", outcome
        ).increment();
        registry.timer("ledger.operations.latency",
                "operation", operation
        ).record(duration);
    }
}
