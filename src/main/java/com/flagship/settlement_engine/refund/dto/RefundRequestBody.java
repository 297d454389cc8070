package com.flagship.settlement_engine.refund.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
public class RefundRequestBody {

    @NotNull(message = "Ticket id is required")
    @JsonProperty("ticket_id")
    private UUID ticketId;

    @Size(max = 1000, message = "Reason must be at most 1000 characters")
    @JsonProperty("reason")
    private String reason;
}
