package com.flagship.settlement_engine.payment.event;

import com.flagship.settlement_engine.outbox.SettlementEvent;
import com.flagship.settlement_engine.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment reached FAILED. {@code requiresReview} marks amount mismatches.
 */
@Value
public class PaymentFailedEvent implements SettlementEvent {
    UUID eventId;
    UUID paymentId;
    String reference;
    UUID ticketedEventId;
    BigDecimal amount;
    String reason;
    boolean requiresReview;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

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
        return PaymentVerifiedEvent.AGGREGATE_TYPE;
    }

    public static PaymentFailedEvent of(Payment payment, Instant occurredAt) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getReference(),
            payment.getEventId(),
            payment.getAmount(),
            payment.getFailureReason(),
            payment.isRequiresReview(),
            occurredAt
        );
    }
}
