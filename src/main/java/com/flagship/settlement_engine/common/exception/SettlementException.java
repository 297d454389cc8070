package com.flagship.settlement_engine.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Base exception for every failure the engine reports to its callers.
 * Details are rendered into the error response as-is.
 */
@Getter
public class SettlementException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, String> details;

    public SettlementException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage());
    }

    public SettlementException(ErrorCode errorCode, String message) {
        this(errorCode, message, Collections.emptyMap());
    }

    public SettlementException(ErrorCode errorCode, String message, Map<String, String> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details;
    }

    public SettlementException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Collections.emptyMap();
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }
}
