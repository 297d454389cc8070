package com.flagship.settlement_engine.refund;

import com.flagship.settlement_engine.catalog.CatalogRepository;
import com.flagship.settlement_engine.catalog.EventInfo;
import com.flagship.settlement_engine.catalog.TierInfo;
import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.common.actor.ActorRole;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.gateway.PaymentGateway;
import com.flagship.settlement_engine.gateway.RefundResult;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.payment.Payment;
import com.flagship.settlement_engine.payment.PaymentPersistenceService;
import com.flagship.settlement_engine.ticket.Ticket;
import com.flagship.settlement_engine.ticket.TicketEntity;
import com.flagship.settlement_engine.ticket.TicketRepository;
import com.flagship.settlement_engine.ticket.TicketStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Refund workflow: buyer request, organizer review, admin processing.
 *
 * {@link #process} calls the gateway outside any transaction; the local state
 * change that follows is {@link RefundSettlementService#settle}. If the gateway
 * call fails the request stays APPROVED and processing can be retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefundService {

    private final RefundRequestRepository repository;
    private final RefundSettlementService settlementService;
    private final TicketRepository ticketRepository;
    private final PaymentPersistenceService paymentPersistenceService;
    private final CatalogRepository catalogRepository;
    private final LedgerService ledgerService;
    private final PaymentGateway gateway;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * The refund amount is what the sale credited the organizer, so the platform keeps its fee.
     */
    @Transactional
    public RefundRequest request(UUID ticketId, String reason, Actor actor) {
        Ticket ticket = loadTicket(ticketId);
        if (actor.role() != ActorRole.BUYER || !actor.id().equals(ticket.getBuyerId())) {
            throw new SettlementException(ErrorCode.FORBIDDEN, "Only the ticket's buyer may request a refund");
        }

        TierInfo tier = catalogRepository.getTier(ticket.getTierId());
        if (!tier.isRefundEnabled()) {
            throw new SettlementException(ErrorCode.REFUND_NOT_ENABLED);
        }
        requireActive(ticket);
        if (repository.existsByTicketIdAndStatusNot(ticketId, RefundStatus.REJECTED)) {
            throw new SettlementException(ErrorCode.REFUND_ALREADY_REQUESTED);
        }

        Instant now = clock.instant();
        EventInfo event = catalogRepository.getEvent(ticket.getEventId());
        if (event.hasStarted(now)) {
            throw new SettlementException(ErrorCode.REFUND_WINDOW_CLOSED);
        }

        LedgerEntry sale = ledgerService.findSale(ticketId)
            .orElseThrow(() -> new SettlementException(ErrorCode.LEDGER_SALE_NOT_FOUND,
                "No sale recorded for ticket " + ticket.getTicketNumber()));

        RefundRequest refund = RefundRequest.create(UUID.randomUUID(), ticketId, actor.id(), reason, sale.getAmount(), now);
        repository.saveAndFlush(RefundRequestEntity.fromDomain(refund));

        metrics.recordRefund("requested");
        log.info("Refund requested: ticketId={}, refundAmount={}", ticketId, refund.getRefundAmount());
        return refund;
    }

    @Transactional
    public RefundRequest approve(UUID refundId, Actor actor) {
        RefundRequestEntity entity = lock(refundId);
        RefundRequest refund = entity.toDomain();
        requireReviewer(refund, actor);
        requireStatus(refund, RefundStatus.PENDING, "approved");

        RefundRequest approved = refund.approve(actor.id(), clock.instant());
        entity.updateFromDomain(approved);
        repository.saveAndFlush(entity);

        metrics.recordRefund("approved");
        log.info("Refund approved: refundId={}", refundId);
        return approved;
    }

    @Transactional
    public RefundRequest reject(UUID refundId, String note, Actor actor) {
        if (note == null || note.isBlank()) {
            throw new SettlementException(ErrorCode.REJECTION_NOTE_REQUIRED);
        }
        RefundRequestEntity entity = lock(refundId);
        RefundRequest refund = entity.toDomain();
        requireReviewer(refund, actor);
        requireStatus(refund, RefundStatus.PENDING, "rejected");

        RefundRequest rejected = refund.reject(actor.id(), note, clock.instant());
        entity.updateFromDomain(rejected);
        repository.saveAndFlush(entity);

        metrics.recordRefund("rejected");
        log.info("Refund rejected: refundId={}", refundId);
        return rejected;
    }

    /**
     * Returns the money through the gateway, then settles locally.
     *
     * @throws SettlementException GATEWAY_UNAVAILABLE or GATEWAY_REJECTED with the request still APPROVED
     */
    public RefundRequest process(UUID refundId, Actor actor) {
        actor.requireAdmin();
        long start = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = CorrelationContext.put(CorrelationContext.REFUND_ID_MDC_KEY, refundId)) {
            RefundRequest refund = find(refundId);
            if (refund.getStatus() == RefundStatus.PROCESSED) {
                return refund;
            }
            requireStatus(refund, RefundStatus.APPROVED, "processed");

            Ticket ticket = loadTicket(refund.getTicketId());
            requireActive(ticket);
            Payment payment = paymentPersistenceService.findById(ticket.getPaymentId())
                .orElseThrow(() -> new SettlementException(ErrorCode.PAYMENT_NOT_FOUND));

            RefundResult result;
            try {
                result = gateway.refundTransaction(payment.getGatewayTransactionRef(),
                    RefundRequest.refundReference(refundId), refund.getRefundAmount(),
                    refund.getReason() != null ? refund.getReason() : "Ticket refund");
            } catch (SettlementException e) {
                metrics.recordRefund("gateway_" + e.getErrorCode().name().toLowerCase(Locale.ROOT));
                log.warn("Gateway refund failed, request stays APPROVED: {}", e.getMessage());
                throw e;
            }

            String gatewayReference = result.getRefundReference() != null
                ? result.getRefundReference()
                : RefundRequest.refundReference(refundId);
            RefundRequest processed = settlementService.settle(refundId, gatewayReference);
            metrics.recordRefund("processed");
            return processed;
        } finally {
            metrics.recordLatency("refund_process", System.currentTimeMillis() - start);
        }
    }

    @Transactional(readOnly = true)
    public RefundRequest get(UUID refundId, Actor actor) {
        RefundRequest refund = find(refundId);
        if (!actor.id().equals(refund.getRequesterId())) {
            requireReviewer(refund, actor);
        }
        return refund;
    }

    @Transactional(readOnly = true)
    public List<RefundRequest> listByStatus(RefundStatus status, Actor actor) {
        actor.requireAdmin();
        return repository.findByStatusOrderByCreatedAtAsc(status).stream()
            .map(RefundRequestEntity::toDomain)
            .collect(Collectors.toList());
    }

    private RefundRequest find(UUID refundId) {
        return repository.findById(refundId)
            .map(RefundRequestEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.REFUND_NOT_FOUND, "Refund request not found: " + refundId));
    }

    private RefundRequestEntity lock(UUID refundId) {
        return repository.findByIdForUpdate(refundId)
            .orElseThrow(() -> new SettlementException(ErrorCode.REFUND_NOT_FOUND, "Refund request not found: " + refundId));
    }

    private Ticket loadTicket(UUID ticketId) {
        return ticketRepository.findById(ticketId)
            .map(TicketEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.TICKET_NOT_FOUND, "Ticket not found: " + ticketId));
    }

    private void requireReviewer(RefundRequest refund, Actor actor) {
        Ticket ticket = loadTicket(refund.getTicketId());
        EventInfo event = catalogRepository.getEvent(ticket.getEventId());
        actor.requireActsFor(event.getOrganizerId());
    }

    private static void requireActive(Ticket ticket) {
        if (ticket.getStatus() == TicketStatus.REFUNDED) {
            throw new SettlementException(ErrorCode.TICKET_REFUNDED);
        }
        if (!ticket.isActive()) {
            throw new SettlementException(ErrorCode.TICKET_NOT_ACTIVE,
                "Ticket " + ticket.getTicketNumber() + " is " + ticket.getStatus());
        }
    }

    private static void requireStatus(RefundRequest refund, RefundStatus required, String action) {
        if (refund.getStatus() != required) {
            throw new SettlementException(ErrorCode.REFUND_INVALID_STATE,
                String.format("Refund request is %s and cannot be %s", refund.getStatus(), action));
        }
    }
}
