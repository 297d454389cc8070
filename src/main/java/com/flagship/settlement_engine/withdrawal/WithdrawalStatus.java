package com.flagship.settlement_engine.withdrawal;

/**
 * PENDING_OTP -> PROCESSING -> COMPLETED
 * PENDING_OTP -> FAILED (OTP expired, attempts exhausted, balance dropped)
 * PROCESSING  -> FAILED (payout rejected; the debit is reversed)
 */
public enum WithdrawalStatus {
    PENDING_OTP,
    PROCESSING,
    COMPLETED,
    FAILED
}
