package com.flagship.settlement_engine.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-verifies payments that stayed PENDING past the staleness threshold,
 * covering lost webhooks and buyers who closed the tab.
 */
@Component
@ConditionalOnProperty(name = "settlement.jobs.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaymentSweepJob {

    private final PaymentReconciler reconciler;

    @Scheduled(fixedDelayString = "${settlement.jobs.payment-sweep-interval-ms:60000}")
    public void sweep() {
        try {
            BulkVerificationReport report = reconciler.sweepStalePayments();
            log.debug("Stale payment sweep: {}", report);
        } catch (RuntimeException e) {
            log.error("Stale payment sweep failed", e);
        }
    }
}
