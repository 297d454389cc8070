package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.payment.PaymentRepository;
import com.flagship.settlement_engine.payment.PaymentStatus;
import com.flagship.settlement_engine.withdrawal.WithdrawalRepository;
import com.flagship.settlement_engine.withdrawal.WithdrawalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query, so scrapes stay cheap.
 */
@Component
@ConditionalOnProperty(name = "settlement.jobs.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SettlementMetrics settlementMetrics;
    private final PaymentRepository paymentRepository;
    private final WithdrawalRepository withdrawalRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        try {
            outboxMetrics.refreshMetrics();
            settlementMetrics.updatePendingPayments(paymentRepository.countByStatus(PaymentStatus.PENDING));
            settlementMetrics.updateProcessingWithdrawals(
                withdrawalRepository.countByStatus(WithdrawalStatus.PROCESSING));
        } catch (Exception e) {
            log.warn("Failed to refresh gauges: {}", e.getMessage());
        }
    }
}
