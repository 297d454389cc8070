package com.flagship.settlement_engine.common.exception;

/**
 * Coarse error taxonomy. Callers that only need to know whether to retry,
 * compensate or explain can switch on the category instead of the code.
 */
public enum ErrorCategory {
    NOT_FOUND,
    INVALID_STATE,
    INSUFFICIENT_BALANCE,
    OTP_INVALID,
    OTP_EXPIRED,
    OTP_ATTEMPTS_EXCEEDED,
    GATEWAY_UNAVAILABLE,
    GATEWAY_REJECTED,
    AMOUNT_MISMATCH,
    INVALID_REQUEST,
    FORBIDDEN,
    INTERNAL
}
