package com.flagship.settlement_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.payment.PaymentStatus;
import com.flagship.settlement_engine.payment.VerificationResult;
import com.flagship.settlement_engine.ticket.dto.TicketResponse;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VerificationResponse {

    @JsonProperty("outcome")
    VerificationResult.Outcome outcome;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("message")
    String message;

    @JsonProperty("ticket")
    TicketResponse ticket;

    public static VerificationResponse from(VerificationResult result) {
        return VerificationResponse.builder()
            .outcome(result.getOutcome())
            .reference(result.getPayment().getReference())
            .paymentStatus(result.getPayment().getStatus())
            .message(result.getMessage())
            .ticket(result.getTicket() != null ? TicketResponse.from(result.getTicket()) : null)
            .build();
    }
}
