package com.flagship.settlement_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
public class CheckoutRequest {

    @NotNull(message = "Event ID is required")
    @JsonProperty("event_id")
    private UUID eventId;

    @NotNull(message = "Tier ID is required")
    @JsonProperty("tier_id")
    private UUID tierId;

    @NotBlank(message = "Buyer email is required")
    @Email(message = "Buyer email must be a valid address")
    @JsonProperty("buyer_email")
    private String buyerEmail;
}
