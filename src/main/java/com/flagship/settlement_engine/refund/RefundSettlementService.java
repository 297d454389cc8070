package com.flagship.settlement_engine.refund;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.ledger.BalanceBucket;
import com.flagship.settlement_engine.ledger.LedgerPosting;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.payment.Payment;
import com.flagship.settlement_engine.payment.PaymentPersistenceService;
import com.flagship.settlement_engine.refund.event.RefundProcessedEvent;
import com.flagship.settlement_engine.ticket.Ticket;
import com.flagship.settlement_engine.ticket.TicketEntity;
import com.flagship.settlement_engine.ticket.TicketRepository;
import com.flagship.settlement_engine.ticket.TicketStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * The local half of processing a refund, run after the gateway has returned the money.
 * Payment, ticket, ledger and refund request change together or not at all.
 * A ticket checked in while the gateway call was running does not stop the
 * settlement, since the money has already left.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefundSettlementService {

    private final RefundRequestRepository repository;
    private final TicketRepository ticketRepository;
    private final PaymentPersistenceService paymentPersistenceService;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    @Transactional
    public RefundRequest settle(UUID refundId, String gatewayRefundReference) {
        RefundRequestEntity entity = repository.findByIdForUpdate(refundId)
            .orElseThrow(() -> new SettlementException(ErrorCode.REFUND_NOT_FOUND, "Refund request not found: " + refundId));
        RefundRequest refund = entity.toDomain();
        if (refund.getStatus() == RefundStatus.PROCESSED) {
            log.debug("Refund already processed");
            return refund;
        }
        if (refund.getStatus() != RefundStatus.APPROVED) {
            throw new SettlementException(ErrorCode.REFUND_INVALID_STATE,
                "Refund request is " + refund.getStatus() + " and cannot be processed");
        }

        Ticket ticket = ticketRepository.findById(refund.getTicketId())
            .map(TicketEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.TICKET_NOT_FOUND));
        Payment payment = paymentPersistenceService.findById(ticket.getPaymentId())
            .orElseThrow(() -> new SettlementException(ErrorCode.PAYMENT_NOT_FOUND));

        ledgerService.lockBalance(payment.getOrganizerId());
        if (ledgerService.isSaleReversed(ticket.getId())) {
            throw new SettlementException(ErrorCode.LEDGER_ALREADY_REVERSED,
                "Sale for ticket " + ticket.getTicketNumber() + " has already been reversed");
        }
        BalanceBucket bucket = ledgerService.bucketHoldingSale(ticket.getId());

        Instant now = clock.instant();
        Ticket settledTicket;
        if (ticketRepository.markRefunded(ticket.getId(), now) == 1) {
            settledTicket = ticket.refund(now);
        } else {
            settledTicket = ticketAdmittedDuringRefund(ticket.getId(), gatewayRefundReference);
        }

        Payment locked = paymentPersistenceService.lockByReference(payment.getReference());
        paymentPersistenceService.update(locked.refund(now));

        ledgerService.append(LedgerPosting.refund(payment.getOrganizerId(), payment.getId(), ticket.getId(),
            refundId, refund.getRefundAmount(), bucket, "Refund of " + ticket.getTicketNumber()));

        RefundRequest processed = refund.markProcessed(gatewayRefundReference, now);
        entity.updateFromDomain(processed);
        repository.saveAndFlush(entity);

        outboxService.saveEvent(RefundProcessedEvent.of(processed, settledTicket, payment.getOrganizerId()));
        log.info("Refund processed: amount={}, bucket={}, gatewayRefundReference={}",
            processed.getRefundAmount(), bucket, gatewayRefundReference);
        return processed;
    }

    /**
     * The gateway has already returned the money, so the refund is recorded even
     * though the ticket was scanned meanwhile. The ticket keeps its CHECKED_IN
     * status and the refund is counted for manual review.
     */
    private Ticket ticketAdmittedDuringRefund(UUID ticketId, String gatewayRefundReference) {
        Ticket current = ticketRepository.findById(ticketId)
            .map(TicketEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.TICKET_NOT_FOUND));
        if (current.getStatus() != TicketStatus.CHECKED_IN) {
            throw new SettlementException(ErrorCode.TICKET_NOT_ACTIVE,
                "Ticket " + current.getTicketNumber() + " is " + current.getStatus());
        }
        log.error("Ticket {} was checked in while its refund was at the gateway; refund {} recorded for manual review",
            current.getTicketNumber(), gatewayRefundReference);
        metrics.recordRefund("processed_after_check_in");
        return current;
    }
}
