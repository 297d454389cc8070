package com.flagship.settlement_engine.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("organizer_id")
    UUID organizerId;

    @JsonProperty("pending")
    BigDecimal pending;

    @JsonProperty("available")
    BigDecimal available;

    @JsonProperty("withdrawn")
    BigDecimal withdrawn;

    @JsonProperty("withdrawable")
    BigDecimal withdrawable;

    public static BalanceResponse from(OrganizerBalance balance) {
        return BalanceResponse.builder()
            .organizerId(balance.getOrganizerId())
            .pending(balance.getPending())
            .available(balance.getAvailable())
            .withdrawn(balance.getWithdrawn())
            .withdrawable(balance.getWithdrawable())
            .build();
    }
}
