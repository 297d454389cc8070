package com.flagship.settlement_engine.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A buyer's payment for one ticket.
 *
 * Immutable: every transition returns a new instance and rejects moves the
 * lifecycle does not allow. SUCCESS is reached at most once per reference.
 */
@Value
public class Payment {
    UUID id;
    String reference;
    BigDecimal amount;
    PaymentStatus status;
    UUID eventId;
    UUID tierId;
    UUID organizerId;
    UUID buyerId;
    String buyerEmail;
    String gatewayTransactionRef;
    String failureReason;
    boolean requiresReview;
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;

    public static Payment create(UUID id, String reference, BigDecimal amount, UUID eventId, UUID tierId,
                                 UUID organizerId, UUID buyerId, String buyerEmail, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        return new Payment(id, reference, amount, PaymentStatus.PENDING, eventId, tierId, organizerId,
            buyerId, buyerEmail, null, null, false, null, now, now);
    }

    /**
     * @throws IllegalStateException unless the payment is PENDING
     */
    public Payment succeed(String gatewayTransactionRef, Instant paidAt) {
        requireStatus(PaymentStatus.SUCCESS, PaymentStatus.PENDING);
        return new Payment(id, reference, amount, PaymentStatus.SUCCESS, eventId, tierId, organizerId,
            buyerId, buyerEmail, gatewayTransactionRef, null, false, paidAt, createdAt, paidAt);
    }

    /**
     * @param requiresReview true when the failure needs a human, e.g. the gateway reported a different amount
     * @throws IllegalStateException unless the payment is PENDING
     */
    public Payment fail(String reason, boolean requiresReview, Instant now) {
        requireStatus(PaymentStatus.FAILED, PaymentStatus.PENDING);
        return new Payment(id, reference, amount, PaymentStatus.FAILED, eventId, tierId, organizerId,
            buyerId, buyerEmail, gatewayTransactionRef, reason, requiresReview, paidAt, createdAt, now);
    }

    /**
     * @throws IllegalStateException unless the payment is SUCCESS
     */
    public Payment refund(Instant now) {
        requireStatus(PaymentStatus.REFUNDED, PaymentStatus.SUCCESS);
        return new Payment(id, reference, amount, PaymentStatus.REFUNDED, eventId, tierId, organizerId,
            buyerId, buyerEmail, gatewayTransactionRef, failureReason, requiresReview, paidAt, createdAt, now);
    }

    public boolean isTerminal() {
        return status == PaymentStatus.FAILED || status == PaymentStatus.REFUNDED;
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return switch (status) {
            case PENDING -> target == PaymentStatus.SUCCESS || target == PaymentStatus.FAILED;
            case SUCCESS -> target == PaymentStatus.REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }

    private void requireStatus(PaymentStatus target, PaymentStatus required) {
        if (status != required) {
            throw new IllegalStateException(String.format(
                "Cannot move payment %s from %s to %s. Only %s payments can.", reference, status, target, required));
        }
    }
}
