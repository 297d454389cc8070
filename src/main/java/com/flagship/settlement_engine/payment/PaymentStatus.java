package com.flagship.settlement_engine.payment;

/**
 * Payment lifecycle.
 *
 * PENDING -> SUCCESS -> REFUNDED
 * PENDING -> FAILED
 */
public enum PaymentStatus {
    PENDING,
    SUCCESS,
    FAILED,
    REFUNDED
}
