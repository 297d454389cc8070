package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.ledger.LedgerEntryType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for settlement operations.
 *
 * Metrics exposed:
 * - settlement.verification: payment verification outcomes
 * - settlement.amount_mismatch: gateway amount disagreed with the stored expectation
 * - settlement.check_in: check-in outcomes by result code
 * - settlement.withdrawal / settlement.refund: workflow outcomes
 * - ledger.entries / ledger.replay.mismatch: ledger appends by type and replay drift
 * - settlement.latency / gateway.calls: operation and gateway timers
 * - settlement.payments.pending / settlement.withdrawals.processing: gauges refreshed by {@link MetricsScheduler}
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final AtomicLong pendingPayments = new AtomicLong(0);
    private final AtomicLong processingWithdrawals = new AtomicLong(0);

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("settlement.payments.pending", pendingPayments, AtomicLong::get)
                .description("Payments still waiting for gateway confirmation")
                .register(registry);

        Gauge.builder("settlement.withdrawals.processing", processingWithdrawals, AtomicLong::get)
                .description("Withdrawals debited and waiting for a payout outcome")
                .register(registry);
    }

    // ==================== Payments ====================

    /**
     * @param outcome verified, already_verified, still_pending, failed or error
     */
    public void recordVerification(String outcome) {
        registry.counter("settlement.verification", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordAmountMismatch() {
        registry.counter("settlement.amount_mismatch").increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // ==================== Tickets, withdrawals, refunds ====================

    public void recordCheckIn(String outcome) {
        registry.counter("settlement.check_in", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordWithdrawal(String outcome) {
        registry.counter("settlement.withdrawal", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * The gateway reported a reversal for a payout we had already completed.
     */
    public void recordPayoutReversedAfterCompletion() {
        registry.counter("settlement.withdrawal.reversed_after_completion").increment();
    }

    public void recordRefund(String outcome) {
        registry.counter("settlement.refund", "outcome", sanitizeTag(outcome)).increment();
    }

    // ==================== Ledger ====================

    public void recordLedgerEntry(LedgerEntryType type) {
        registry.counter("ledger.entries", "type", type.name()).increment();
    }

    public void recordReplayMismatch() {
        registry.counter("ledger.replay.mismatch").increment();
    }

    // ==================== Timers ====================

    public void recordLatency(String operation, long durationMs) {
        registry.timer("settlement.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordGatewayCall(String operation, String outcome, long durationMs) {
        registry.timer("gateway.calls",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Gauges ====================

    void updatePendingPayments(long count) {
        pendingPayments.set(count);
    }

    void updateProcessingWithdrawals(long count) {
        processingWithdrawals.set(count);
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
