package com.flagship.settlement_engine.ticket.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class AgentCodeRequest {

    @Size(max = 100, message = "Label must be at most 100 characters")
    @JsonProperty("label")
    private String label;
}
