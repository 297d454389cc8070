package com.flagship.settlement_engine.refund.event;

import com.flagship.settlement_engine.outbox.SettlementEvent;
import com.flagship.settlement_engine.refund.RefundRequest;
import com.flagship.settlement_engine.ticket.Ticket;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class RefundProcessedEvent implements SettlementEvent {
    UUID eventId;
    UUID refundId;
    UUID ticketId;
    UUID paymentId;
    UUID ticketedEventId;
    UUID organizerId;
    BigDecimal amountPaid;
    BigDecimal refundAmount;
    String gatewayRefundReference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RefundProcessed";
    public static final String AGGREGATE_TYPE = "Refund";

    @Override
    public UUID getAggregateId() {
        return refundId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    public static RefundProcessedEvent of(RefundRequest refund, Ticket ticket, UUID organizerId) {
        return new RefundProcessedEvent(UUID.randomUUID(), refund.getId(), ticket.getId(), ticket.getPaymentId(),
            ticket.getEventId(), organizerId, ticket.getAmountPaid(), refund.getRefundAmount(),
            refund.getGatewayRefundReference(), refund.getProcessedAt());
    }
}
