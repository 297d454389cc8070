package com.flagship.settlement_engine.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.withdrawal.Withdrawal;
import com.flagship.settlement_engine.withdrawal.WithdrawalStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The OTP hash never leaves the service; only its expiry is exposed.
 */
@Value
@Builder
public class WithdrawalResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("organizer_id")
    UUID organizerId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    WithdrawalStatus status;

    @JsonProperty("otp_expires_at")
    Instant otpExpiresAt;

    @JsonProperty("bank_code")
    String bankCode;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("gateway_reference")
    String gatewayReference;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static WithdrawalResponse from(Withdrawal withdrawal) {
        return WithdrawalResponse.builder()
            .id(withdrawal.getId())
            .organizerId(withdrawal.getOrganizerId())
            .amount(withdrawal.getAmount())
            .status(withdrawal.getStatus())
            .otpExpiresAt(withdrawal.getOtpExpiresAt())
            .bankCode(withdrawal.getBankCode())
            .accountNumber(withdrawal.getAccountNumber())
            .accountName(withdrawal.getAccountName())
            .gatewayReference(withdrawal.getGatewayReference())
            .failureReason(withdrawal.getFailureReason())
            .createdAt(withdrawal.getCreatedAt())
            .processedAt(withdrawal.getProcessedAt())
            .build();
    }
}
