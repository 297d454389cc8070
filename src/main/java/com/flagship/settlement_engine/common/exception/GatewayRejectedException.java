package com.flagship.settlement_engine.common.exception;

/**
 * The gateway answered and refused the request. Terminal for that attempt.
 */
public class GatewayRejectedException extends SettlementException {

    public GatewayRejectedException(String message) {
        super(ErrorCode.GATEWAY_REJECTED, message);
    }
}
