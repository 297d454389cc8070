package com.flagship.settlement_engine.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.withdrawal.PayoutAccount;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PayoutAccountResponse {

    @JsonProperty("organizer_id")
    UUID organizerId;

    @JsonProperty("bank_code")
    String bankCode;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("verified_at")
    Instant verifiedAt;

    public static PayoutAccountResponse from(PayoutAccount account) {
        return PayoutAccountResponse.builder()
            .organizerId(account.getOrganizerId())
            .bankCode(account.getBankCode())
            .accountNumber(account.getAccountNumber())
            .accountName(account.getAccountName())
            .verifiedAt(account.getVerifiedAt())
            .build();
    }
}
