package com.flagship.settlement_engine.refund;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "refund_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RefundRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "ticket_id", nullable = false, updatable = false)
    private UUID ticketId;

    @Column(name = "requester_id", nullable = false, updatable = false)
    private UUID requesterId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RefundStatus status;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "rejection_note", columnDefinition = "TEXT")
    private String rejectionNote;

    @Column(name = "refund_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal refundAmount;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "gateway_refund_reference", length = 128)
    private String gatewayRefundReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    static RefundRequestEntity fromDomain(RefundRequest request) {
        return new RefundRequestEntity(
            request.getId(),
            request.getTicketId(),
            request.getRequesterId(),
            request.getStatus(),
            request.getReason(),
            request.getRejectionNote(),
            request.getRefundAmount(),
            request.getReviewedBy(),
            request.getGatewayRefundReference(),
            request.getCreatedAt(),
            request.getUpdatedAt(),
            request.getReviewedAt(),
            request.getProcessedAt()
        );
    }

    public RefundRequest toDomain() {
        return new RefundRequest(id, ticketId, requesterId, status, reason, rejectionNote, refundAmount,
            reviewedBy, gatewayRefundReference, createdAt, updatedAt, reviewedAt, processedAt);
    }

    void updateFromDomain(RefundRequest request) {
        if (!id.equals(request.getId())) {
            throw new IllegalArgumentException("Refund request " + request.getId() + " does not match entity " + id);
        }
        this.status = request.getStatus();
        this.rejectionNote = request.getRejectionNote();
        this.reviewedBy = request.getReviewedBy();
        this.gatewayRefundReference = request.getGatewayRefundReference();
        this.updatedAt = request.getUpdatedAt();
        this.reviewedAt = request.getReviewedAt();
        this.processedAt = request.getProcessedAt();
    }
}
