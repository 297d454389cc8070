package com.flagship.settlement_engine.withdrawal;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An organizer's request to move available funds to their bank account.
 *
 * The OTP is held only as a hash. Expiry and attempt exhaustion are terminal
 * transitions of their own, not flags on an open withdrawal.
 */
@Value
public class Withdrawal {
    UUID id;
    UUID organizerId;
    BigDecimal amount;
    WithdrawalStatus status;
    String otpHash;
    Instant otpExpiresAt;
    int otpAttempts;
    String bankCode;
    String accountNumber;
    String accountName;
    String gatewayReference;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;
    Instant processedAt;

    public static Withdrawal open(UUID id, UUID organizerId, BigDecimal amount, String otpHash,
                                  Instant otpExpiresAt, PayoutAccount account, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Withdrawal amount must be positive");
        }
        return new Withdrawal(id, organizerId, amount, WithdrawalStatus.PENDING_OTP, otpHash, otpExpiresAt, 0,
            account.getBankCode(), account.getAccountNumber(), account.getAccountName(),
            null, null, now, now, null);
    }

    /**
     * Payout reference sent to the gateway. Fixed by the withdrawal id so a retried
     * dispatch can never create a second payout.
     */
    public static String payoutReference(UUID withdrawalId) {
        return "WD-" + withdrawalId;
    }

    public boolean isOtpExpired(Instant now) {
        return !now.isBefore(otpExpiresAt);
    }

    public Withdrawal recordFailedAttempt(Instant now) {
        requireStatus(WithdrawalStatus.PENDING_OTP, "record an OTP attempt");
        return new Withdrawal(id, organizerId, amount, status, otpHash, otpExpiresAt, otpAttempts + 1,
            bankCode, accountNumber, accountName, gatewayReference, failureReason, createdAt, now, processedAt);
    }

    /**
     * Ends a withdrawal that never debited the ledger.
     */
    public Withdrawal abandon(String reason, Instant now) {
        requireStatus(WithdrawalStatus.PENDING_OTP, "abandon");
        return new Withdrawal(id, organizerId, amount, WithdrawalStatus.FAILED, null, otpExpiresAt, otpAttempts,
            bankCode, accountNumber, accountName, gatewayReference, reason, createdAt, now, now);
    }

    public Withdrawal startProcessing(Instant now) {
        requireStatus(WithdrawalStatus.PENDING_OTP, "start processing");
        return new Withdrawal(id, organizerId, amount, WithdrawalStatus.PROCESSING, null, otpExpiresAt, otpAttempts,
            bankCode, accountNumber, accountName, payoutReference(id), null, createdAt, now, null);
    }

    public Withdrawal complete(Instant now) {
        requireStatus(WithdrawalStatus.PROCESSING, "complete");
        return new Withdrawal(id, organizerId, amount, WithdrawalStatus.COMPLETED, null, otpExpiresAt, otpAttempts,
            bankCode, accountNumber, accountName, gatewayReference, null, createdAt, now, now);
    }

    /**
     * Payout failed after the debit. The caller appends the compensating entry in the same transaction.
     */
    public Withdrawal failPayout(String reason, Instant now) {
        requireStatus(WithdrawalStatus.PROCESSING, "fail payout");
        return new Withdrawal(id, organizerId, amount, WithdrawalStatus.FAILED, null, otpExpiresAt, otpAttempts,
            bankCode, accountNumber, accountName, gatewayReference, reason, createdAt, now, now);
    }

    public int remainingAttempts(int maxAttempts) {
        return Math.max(0, maxAttempts - otpAttempts);
    }

    public boolean isTerminal() {
        return status == WithdrawalStatus.COMPLETED || status == WithdrawalStatus.FAILED;
    }

    private void requireStatus(WithdrawalStatus required, String action) {
        if (status != required) {
            throw new IllegalStateException(String.format(
                "Cannot %s withdrawal %s in %s status. It must be %s.", action, id, status, required));
        }
    }
}
