package com.flagship.settlement_engine.ticket.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ActivateAgentCodeRequest {

    @NotBlank(message = "Code is required")
    @JsonProperty("code")
    private String code;
}
