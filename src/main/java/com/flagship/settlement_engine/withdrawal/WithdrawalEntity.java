package com.flagship.settlement_engine.withdrawal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "withdrawals")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WithdrawalEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organizer_id", nullable = false, updatable = false)
    private UUID organizerId;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WithdrawalStatus status;

    @Column(name = "otp_hash", length = 64)
    private String otpHash;

    @Column(name = "otp_expires_at", nullable = false, updatable = false)
    private Instant otpExpiresAt;

    @Column(name = "otp_attempts", nullable = false)
    private int otpAttempts;

    @Column(name = "bank_code", nullable = false, updatable = false)
    private String bankCode;

    @Column(name = "account_number", nullable = false, updatable = false)
    private String accountNumber;

    @Column(name = "account_name", nullable = false, updatable = false)
    private String accountName;

    @Column(name = "gateway_reference", unique = true, length = 128)
    private String gatewayReference;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    static WithdrawalEntity fromDomain(Withdrawal withdrawal) {
        return new WithdrawalEntity(
            withdrawal.getId(),
            withdrawal.getOrganizerId(),
            withdrawal.getAmount(),
            withdrawal.getStatus(),
            withdrawal.getOtpHash(),
            withdrawal.getOtpExpiresAt(),
            withdrawal.getOtpAttempts(),
            withdrawal.getBankCode(),
            withdrawal.getAccountNumber(),
            withdrawal.getAccountName(),
            withdrawal.getGatewayReference(),
            withdrawal.getFailureReason(),
            withdrawal.getCreatedAt(),
            withdrawal.getUpdatedAt(),
            withdrawal.getProcessedAt()
        );
    }

    public Withdrawal toDomain() {
        return new Withdrawal(
            id,
            organizerId,
            amount,
            status,
            otpHash,
            otpExpiresAt,
            otpAttempts,
            bankCode,
            accountNumber,
            accountName,
            gatewayReference,
            failureReason,
            createdAt,
            updatedAt,
            processedAt
        );
    }

    void updateFromDomain(Withdrawal withdrawal) {
        if (!id.equals(withdrawal.getId())) {
            throw new IllegalArgumentException("Withdrawal " + withdrawal.getId() + " does not match entity " + id);
        }
        this.status = withdrawal.getStatus();
        this.otpHash = withdrawal.getOtpHash();
        this.otpAttempts = withdrawal.getOtpAttempts();
        this.gatewayReference = withdrawal.getGatewayReference();
        this.failureReason = withdrawal.getFailureReason();
        this.updatedAt = withdrawal.getUpdatedAt();
        this.processedAt = withdrawal.getProcessedAt();
    }
}
