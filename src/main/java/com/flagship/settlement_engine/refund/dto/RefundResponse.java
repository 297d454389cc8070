package com.flagship.settlement_engine.refund.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.refund.RefundRequest;
import com.flagship.settlement_engine.refund.RefundStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RefundResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("ticket_id")
    UUID ticketId;

    @JsonProperty("status")
    RefundStatus status;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("rejection_note")
    String rejectionNote;

    @JsonProperty("refund_amount")
    BigDecimal refundAmount;

    @JsonProperty("gateway_refund_reference")
    String gatewayRefundReference;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("reviewed_at")
    Instant reviewedAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static RefundResponse from(RefundRequest refund) {
        return RefundResponse.builder()
            .id(refund.getId())
            .ticketId(refund.getTicketId())
            .status(refund.getStatus())
            .reason(refund.getReason())
            .rejectionNote(refund.getRejectionNote())
            .refundAmount(refund.getRefundAmount())
            .gatewayRefundReference(refund.getGatewayRefundReference())
            .createdAt(refund.getCreatedAt())
            .reviewedAt(refund.getReviewedAt())
            .processedAt(refund.getProcessedAt())
            .build();
    }
}
