package com.flagship.settlement_engine.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.consumer.SalesSummaryProjector;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SalesSummaryResponse {

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("tickets_sold")
    int ticketsSold;

    @JsonProperty("gross_amount")
    BigDecimal grossAmount;

    @JsonProperty("tickets_refunded")
    int ticketsRefunded;

    @JsonProperty("refunded_amount")
    BigDecimal refundedAmount;

    @JsonProperty("tickets_checked_in")
    int ticketsCheckedIn;

    public static SalesSummaryResponse from(SalesSummaryProjector.SalesSummary summary) {
        return SalesSummaryResponse.builder()
            .eventId(summary.getEventId())
            .ticketsSold(summary.getTicketsSold())
            .grossAmount(summary.getGrossAmount())
            .ticketsRefunded(summary.getTicketsRefunded())
            .refundedAmount(summary.getRefundedAmount())
            .ticketsCheckedIn(summary.getTicketsCheckedIn())
            .build();
    }

    public static SalesSummaryResponse empty(UUID eventId) {
        return SalesSummaryResponse.builder()
            .eventId(eventId)
            .grossAmount(BigDecimal.ZERO)
            .refundedAmount(BigDecimal.ZERO)
            .build();
    }
}
