package com.flagship.settlement_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.payment.Payment;
import com.flagship.settlement_engine.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("tier_id")
    UUID tierId;

    @JsonProperty("buyer_email")
    String buyerEmail;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("requires_review")
    boolean requiresReview;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .reference(payment.getReference())
            .amount(payment.getAmount())
            .status(payment.getStatus())
            .eventId(payment.getEventId())
            .tierId(payment.getTierId())
            .buyerEmail(payment.getBuyerEmail())
            .failureReason(payment.getFailureReason())
            .requiresReview(payment.isRequiresReview())
            .paidAt(payment.getPaidAt())
            .createdAt(payment.getCreatedAt())
            .build();
    }
}
