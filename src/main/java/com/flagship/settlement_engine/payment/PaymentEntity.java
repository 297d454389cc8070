package com.flagship.settlement_engine.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@link Payment}.
 *
 * No setters: state only changes through {@link #updateFromDomain(Payment)} so a
 * transition always passes the domain guards first. The idempotency key is a
 * persistence concern and is passed in separately.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false, length = 64)
    private String reference;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "tier_id", nullable = false, updatable = false)
    private UUID tierId;

    @Column(name = "organizer_id", nullable = false, updatable = false)
    private UUID organizerId;

    @Column(name = "buyer_id", updatable = false)
    private UUID buyerId;

    @Column(name = "buyer_email", nullable = false, updatable = false)
    private String buyerEmail;

    @Column(name = "gateway_transaction_ref", length = 128)
    private String gatewayTransactionRef;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "requires_review", nullable = false)
    private boolean requiresReview;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    static PaymentEntity fromDomain(Payment payment, String idempotencyKey) {
        return new PaymentEntity(
            payment.getId(),
            payment.getReference(),
            idempotencyKey,
            payment.getAmount(),
            payment.getStatus(),
            payment.getEventId(),
            payment.getTierId(),
            payment.getOrganizerId(),
            payment.getBuyerId(),
            payment.getBuyerEmail(),
            payment.getGatewayTransactionRef(),
            payment.getFailureReason(),
            payment.isRequiresReview(),
            payment.getPaidAt(),
            payment.getCreatedAt(),
            payment.getUpdatedAt()
        );
    }

    public Payment toDomain() {
        return new Payment(
            id,
            reference,
            amount,
            status,
            eventId,
            tierId,
            organizerId,
            buyerId,
            buyerEmail,
            gatewayTransactionRef,
            failureReason,
            requiresReview,
            paidAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable part of the payment. Identity, amount and catalog references never change.
     */
    void updateFromDomain(Payment payment) {
        if (!id.equals(payment.getId())) {
            throw new IllegalArgumentException("Payment " + payment.getId() + " does not match entity " + id);
        }
        this.status = payment.getStatus();
        this.gatewayTransactionRef = payment.getGatewayTransactionRef();
        this.failureReason = payment.getFailureReason();
        this.requiresReview = payment.isRequiresReview();
        this.paidAt = payment.getPaidAt();
        this.updatedAt = payment.getUpdatedAt();
    }
}
