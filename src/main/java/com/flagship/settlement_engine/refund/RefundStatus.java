package com.flagship.settlement_engine.refund;

public enum RefundStatus {
    PENDING,
    APPROVED,
    REJECTED,
    PROCESSED
}
