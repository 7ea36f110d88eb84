package com.flagship.asset_issuance.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for issuance operations.
 *
 * Metrics exposed:
 * - issuance.setup: Counter of account setups, tagged by status
 * - issuance.funding: Counter of faucet funding attempts, tagged by role and outcome
 * - issuance.result: Counter of issuance runs, tagged by outcome (success or failed stage)
 * - issuance.duration: Timer for whole issuance runs
 * - balance.lookup: Counter of balance lookups, tagged by asset kind and status
 * - ledger.call.latency: Timer for each ledger/faucet call, tagged by operation and status
 */
@Component
public class IssuanceMetrics {

    private final MeterRegistry registry;

    private final Timer issuanceTimer;

    public IssuanceMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.issuanceTimer = Timer.builder("issuance.duration")
                .description("Time taken by a full trustline and payment run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordSetup(String status) {
        registry.counter("issuance.setup", "status", sanitizeTag(status)).increment();
    }

    public void recordFunding(String role, String outcome) {
        registry.counter("issuance.funding",
                "role", sanitizeTag(role),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    /**
     * Records the end of an issuance run.
     *
     * @param outcome "success", or the failed stage in lower case
     */
    public void recordIssuance(String outcome, long durationMs) {
        Counter.builder("issuance.result")
                .tag("outcome", sanitizeTag(outcome))
                .register(registry)
                .increment();
        issuanceTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordBalanceLookup(String assetKind, String status) {
        registry.counter("balance.lookup",
                "asset", sanitizeTag(assetKind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLedgerCall(String operation, String status, long durationMs) {
        registry.timer("ledger.call.latency",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).record(Duration.ofMillis(durationMs));
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
