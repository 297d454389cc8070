package com.flagship.settlement_engine.payment.event;

import com.flagship.settlement_engine.outbox.SettlementEvent;
import com.flagship.settlement_engine.payment.Payment;
import com.flagship.settlement_engine.ticket.Ticket;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment was confirmed by the gateway, its ticket issued and the sale credited.
 */
@Value
public class PaymentVerifiedEvent implements SettlementEvent {
    UUID eventId;
    UUID paymentId;
    String reference;
    UUID ticketId;
    String ticketNumber;
    UUID ticketedEventId;
    UUID tierId;
    UUID organizerId;
    BigDecimal amount;
    BigDecimal netAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentVerified";
    public static final String AGGREGATE_TYPE = "Payment";

    @Override
    public UUID getAggregateId() {
        return paymentId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    public static PaymentVerifiedEvent of(Payment payment, Ticket ticket, BigDecimal netAmount, Instant occurredAt) {
        return new PaymentVerifiedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getReference(),
            ticket.getId(),
            ticket.getTicketNumber(),
            payment.getEventId(),
            payment.getTierId(),
            payment.getOrganizerId(),
            payment.getAmount(),
            netAmount,
            occurredAt
        );
    }
}
