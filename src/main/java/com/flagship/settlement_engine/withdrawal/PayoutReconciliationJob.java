package com.flagship.settlement_engine.withdrawal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Settles withdrawals left PROCESSING because the payout outcome was unknown at dispatch.
 */
@Component
@ConditionalOnProperty(name = "settlement.jobs.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PayoutReconciliationJob {

    private final WithdrawalService withdrawalService;

    @Scheduled(fixedDelayString = "${settlement.jobs.payout-reconciliation-interval-ms:120000}")
    public void reconcile() {
        try {
            withdrawalService.reconcileProcessing();
        } catch (RuntimeException e) {
            log.error("Payout reconciliation run failed", e);
        }
    }
}
