package com.flagship.settlement_engine.ticket.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class CheckInRequest {

    /**
     * Ticket number or ticket id as encoded in the QR code.
     */
    @NotBlank(message = "Ticket is required")
    @JsonProperty("ticket")
    private String ticket;

    @JsonProperty("agent_code")
    private String agentCode;
}
