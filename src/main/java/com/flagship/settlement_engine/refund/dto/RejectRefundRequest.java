package com.flagship.settlement_engine.refund.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class RejectRefundRequest {

    @Size(max = 1000, message = "Note must be at most 1000 characters")
    @JsonProperty("note")
    private String note;
}
