package com.flagship.settlement_engine.refund;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A buyer's request to return a ticket.
 *
 * PENDING to APPROVED or REJECTED by the organizer, then APPROVED to PROCESSED
 * once the gateway has returned the money. No money moves before PROCESSED.
 */
@Value
public class RefundRequest {
    UUID id;
    UUID ticketId;
    UUID requesterId;
    RefundStatus status;
    String reason;
    String rejectionNote;
    BigDecimal refundAmount;
    UUID reviewedBy;
    String gatewayRefundReference;
    Instant createdAt;
    Instant updatedAt;
    Instant reviewedAt;
    Instant processedAt;

    public static RefundRequest create(UUID id, UUID ticketId, UUID requesterId, String reason,
                                       BigDecimal refundAmount, Instant now) {
        if (refundAmount == null || refundAmount.signum() <= 0) {
            throw new IllegalArgumentException("Refund amount must be positive");
        }
        return new RefundRequest(id, ticketId, requesterId, RefundStatus.PENDING, reason, null, refundAmount,
            null, null, now, now, null, null);
    }

    /**
     * Reference the gateway refund is filed under. Fixed by the request id so a retried
     * process call cannot refund twice.
     */
    public static String refundReference(UUID refundId) {
        return "RF-" + refundId;
    }

    public RefundRequest approve(UUID reviewer, Instant now) {
        requireStatus(RefundStatus.PENDING, "approve");
        return new RefundRequest(id, ticketId, requesterId, RefundStatus.APPROVED, reason, null, refundAmount,
            reviewer, null, createdAt, now, now, null);
    }

    public RefundRequest reject(UUID reviewer, String note, Instant now) {
        requireStatus(RefundStatus.PENDING, "reject");
        if (note == null || note.isBlank()) {
            throw new IllegalArgumentException("A rejection note is required");
        }
        return new RefundRequest(id, ticketId, requesterId, RefundStatus.REJECTED, reason, note.trim(), refundAmount,
            reviewer, null, createdAt, now, now, null);
    }

    public RefundRequest markProcessed(String gatewayReference, Instant now) {
        requireStatus(RefundStatus.APPROVED, "process");
        return new RefundRequest(id, ticketId, requesterId, RefundStatus.PROCESSED, reason, rejectionNote, refundAmount,
            reviewedBy, gatewayReference, createdAt, now, reviewedAt, now);
    }

    public boolean isOpen() {
        return status == RefundStatus.PENDING || status == RefundStatus.APPROVED;
    }

    private void requireStatus(RefundStatus required, String action) {
        if (status != required) {
            throw new IllegalStateException(String.format(
                "Cannot %s refund request %s in %s status. It must be %s.", action, id, status, required));
        }
    }
}
