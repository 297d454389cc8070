package com.flagship.settlement_engine.common.exception;

/**
 * Transient gateway failure: I/O error, timeout or a 5xx answer.
 * The outcome of the remote call is unknown and the caller must retry later.
 */
public class GatewayUnavailableException extends SettlementException {

    public GatewayUnavailableException(String message) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message, cause);
    }
}
