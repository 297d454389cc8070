package com.flagship.settlement_engine.ticket.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.ticket.Ticket;
import com.flagship.settlement_engine.ticket.TicketStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TicketResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("ticket_number")
    String ticketNumber;

    @JsonProperty("status")
    TicketStatus status;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("tier_id")
    UUID tierId;

    @JsonProperty("buyer_email")
    String buyerEmail;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("checked_in_at")
    Instant checkedInAt;

    @JsonProperty("checked_in_by")
    String checkedInBy;

    public static TicketResponse from(Ticket ticket) {
        return TicketResponse.builder()
            .id(ticket.getId())
            .ticketNumber(ticket.getTicketNumber())
            .status(ticket.getStatus())
            .eventId(ticket.getEventId())
            .tierId(ticket.getTierId())
            .buyerEmail(ticket.getBuyerEmail())
            .amountPaid(ticket.getAmountPaid())
            .checkedInAt(ticket.getCheckedInAt())
            .checkedInBy(ticket.getCheckedInBy())
            .build();
    }
}
