package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.gateway.GatewayTransaction;
import com.flagship.settlement_engine.gateway.PaymentGateway;
import com.flagship.settlement_engine.gateway.TransactionStatus;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.ticket.Ticket;
import com.flagship.settlement_engine.ticket.TicketEntity;
import com.flagship.settlement_engine.ticket.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Verifies payments against the gateway. Webhooks, buyer polls, the admin
 * endpoints and the stale-payment sweep all come through {@link #verify(String)}.
 *
 * Not transactional itself: the gateway is called with no lock held, and only the
 * resulting state change runs in a transaction ({@link PaymentSettlementService}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentReconciler {

    private final PaymentPersistenceService persistenceService;
    private final PaymentSettlementService settlementService;
    private final PaymentGateway gateway;
    private final TicketRepository ticketRepository;
    private final SettlementProperties properties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Safe to call any number of times, concurrently, for the same reference.
     *
     * @throws SettlementException PAYMENT_NOT_FOUND for an unknown reference,
     *                             PAYMENT_AMOUNT_MISMATCH when the gateway reports a different amount
     */
    public VerificationResult verify(String reference) {
        long start = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = CorrelationContext.put(CorrelationContext.REFERENCE_MDC_KEY, reference)) {
            VerificationResult result = doVerify(reference);
            metrics.recordVerification(result.getOutcome().name().toLowerCase());
            return result;
        } catch (SettlementException e) {
            metrics.recordVerification(e.getErrorCode().name().toLowerCase());
            throw e;
        } finally {
            metrics.recordLatency("verify", System.currentTimeMillis() - start);
        }
    }

    private VerificationResult doVerify(String reference) {
        Payment payment = persistenceService.getByReference(reference);

        switch (payment.getStatus()) {
            case SUCCESS:
                log.debug("Payment already verified");
                return VerificationResult.alreadyVerified(payment, ticketOf(payment));
            case FAILED:
                return VerificationResult.failed(payment);
            case REFUNDED:
                return VerificationResult.refunded(payment, ticketOf(payment));
            default:
                break;
        }

        GatewayTransaction transaction;
        try {
            transaction = gateway.verifyTransaction(reference);
        } catch (SettlementException e) {
            if (e.getErrorCode() != ErrorCode.GATEWAY_UNAVAILABLE && e.getErrorCode() != ErrorCode.GATEWAY_REJECTED) {
                throw e;
            }
            log.warn("Gateway could not verify payment, leaving it PENDING: {}", e.getMessage());
            return VerificationResult.stillPending(payment, "Gateway could not confirm the payment yet; try again shortly");
        }

        if (transaction.isPaid()) {
            if (transaction.getAmountPaid() == null || transaction.getAmountPaid().compareTo(payment.getAmount()) != 0) {
                return rejectAmountMismatch(payment, transaction);
            }
            return settlementService.confirm(reference, transaction);
        }

        if (transaction.getStatus() == TransactionStatus.FAILED) {
            Payment failed = settlementService.markFailed(
                reference, "Gateway reported status " + transaction.getRawStatus(), false);
            return failed.getStatus() == PaymentStatus.FAILED
                ? VerificationResult.failed(failed)
                : VerificationResult.stillPending(failed, "Payment changed state concurrently");
        }

        log.debug("Gateway still reports payment as {}", transaction.getRawStatus());
        return VerificationResult.stillPending(payment, "Payment has not been completed at the gateway");
    }

    private VerificationResult rejectAmountMismatch(Payment payment, GatewayTransaction transaction) {
        String paid = String.valueOf(transaction.getAmountPaid());
        log.error("Amount mismatch: expected={}, paid={}, gatewayStatus={}. Payment flagged for review.",
            payment.getAmount(), paid, transaction.getRawStatus());
        metrics.recordAmountMismatch();

        settlementService.markFailed(payment.getReference(),
            String.format("Amount mismatch: expected %s, gateway reported %s", payment.getAmount(), paid), true);

        throw new SettlementException(ErrorCode.PAYMENT_AMOUNT_MISMATCH,
            String.format("Payment %s: expected %s but gateway reported %s", payment.getReference(), payment.getAmount(), paid),
            Map.of("expected", payment.getAmount().toPlainString(), "paid", paid));
    }

    /**
     * Verifies every PENDING payment, tolerating individual failures.
     */
    public BulkVerificationReport verifyAll() {
        return verifyBatch(persistenceService.findPending());
    }

    /**
     * Verifies PENDING payments older than the configured staleness threshold.
     */
    public BulkVerificationReport sweepStalePayments() {
        Instant cutoff = clock.instant().minus(properties.getReconciliation().getStaleAfter());
        return verifyBatch(persistenceService.findStalePending(cutoff, properties.getReconciliation().getBatchSize()));
    }

    private BulkVerificationReport verifyBatch(List<Payment> payments) {
        int verified = 0;
        int stillPending = 0;
        int failed = 0;

        for (Payment payment : payments) {
            try {
                VerificationResult result = verify(payment.getReference());
                if (result.isSuccessful()) {
                    verified++;
                } else if (result.getOutcome() == VerificationResult.Outcome.STILL_PENDING) {
                    stillPending++;
                } else {
                    failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Verification failed for reference={}: {}", payment.getReference(), e.getMessage());
            }
        }

        BulkVerificationReport report = new BulkVerificationReport(payments.size(), verified, stillPending, failed);
        if (report.getTotal() > 0) {
            log.info("Bulk verification finished: total={}, verified={}, stillPending={}, failed={}",
                report.getTotal(), verified, stillPending, failed);
        }
        return report;
    }

    private Ticket ticketOf(Payment payment) {
        return ticketRepository.findByPaymentId(payment.getId())
            .map(TicketEntity::toDomain)
            .orElse(null);
    }
}
