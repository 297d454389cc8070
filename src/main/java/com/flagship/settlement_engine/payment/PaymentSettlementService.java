package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.gateway.GatewayTransaction;
import com.flagship.settlement_engine.ledger.LedgerPosting;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.payment.event.PaymentFailedEvent;
import com.flagship.settlement_engine.payment.event.PaymentVerifiedEvent;
import com.flagship.settlement_engine.ticket.Ticket;
import com.flagship.settlement_engine.ticket.TicketEntity;
import com.flagship.settlement_engine.ticket.TicketIssuer;
import com.flagship.settlement_engine.ticket.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * The local half of verification: the state changes taken once the gateway has answered.
 *
 * Key principles:
 * - Payment SUCCESS, the ticket and the TICKET_SALE entry commit together or not at all
 * - The payment row lock serializes concurrent confirmations of one reference
 * - No gateway call happens while a lock is held
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSettlementService {

    private final PaymentPersistenceService persistenceService;
    private final TicketIssuer ticketIssuer;
    private final TicketRepository ticketRepository;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final FeeSchedule feeSchedule;
    private final Clock clock;

    /**
     * Marks the payment SUCCESS, issues its ticket and credits the organizer's pending balance.
     * A payment that is already SUCCESS is returned with its original ticket.
     *
     * @throws SettlementException PAYMENT_INVALID_STATE when the payment already FAILED or was REFUNDED
     */
    @Transactional
    public VerificationResult confirm(String reference, GatewayTransaction transaction) {
        Payment payment = persistenceService.lockByReference(reference);

        if (payment.getStatus() == PaymentStatus.SUCCESS) {
            log.debug("Payment already confirmed by a concurrent call");
            return VerificationResult.alreadyVerified(payment, ticketOf(payment));
        }
        if (payment.getStatus() != PaymentStatus.PENDING) {
            throw new SettlementException(ErrorCode.PAYMENT_INVALID_STATE,
                "Payment " + reference + " is " + payment.getStatus() + " and cannot be confirmed");
        }

        Instant now = clock.instant();
        Payment succeeded = persistenceService.update(payment.succeed(transaction.getTransactionReference(), now));
        Ticket ticket = ticketIssuer.issue(succeeded, now);

        BigDecimal net = feeSchedule.netOf(succeeded.getAmount());
        ledgerService.append(LedgerPosting.ticketSale(
            succeeded.getOrganizerId(),
            succeeded.getId(),
            ticket.getId(),
            net,
            String.format("Ticket sale %s (%s)", ticket.getTicketNumber(), reference)
        ));

        outboxService.saveEvent(PaymentVerifiedEvent.of(succeeded, ticket, net, now));

        log.info("Payment confirmed: ticketNumber={}, amount={}, net={}",
            ticket.getTicketNumber(), succeeded.getAmount(), net);
        return VerificationResult.verified(succeeded, ticket);
    }

    /**
     * Moves a PENDING payment to FAILED in its own transaction, so the failure is
     * recorded even when the caller goes on to throw.
     *
     * @return the payment as stored afterwards; unchanged if it had already left PENDING
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Payment markFailed(String reference, String reason, boolean requiresReview) {
        Payment payment = persistenceService.lockByReference(reference);
        if (payment.getStatus() != PaymentStatus.PENDING) {
            log.warn("Not failing payment in {} status: reason={}", payment.getStatus(), reason);
            return payment;
        }

        Instant now = clock.instant();
        Payment failed = persistenceService.update(payment.fail(reason, requiresReview, now));
        outboxService.saveEvent(PaymentFailedEvent.of(failed, now));

        log.info("Payment failed: reason={}, requiresReview={}", reason, requiresReview);
        return failed;
    }

    private Ticket ticketOf(Payment payment) {
        return ticketRepository.findByPaymentId(payment.getId())
            .map(TicketEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException("Payment " + payment.getReference() + " is SUCCESS without a ticket"));
    }
}
