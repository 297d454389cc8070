package com.flagship.settlement_engine.gateway;

import java.util.Locale;

public enum PayoutStatus {
    SUCCESS,
    PENDING,
    FAILED,
    REVERSED,
    NOT_FOUND;

    public static PayoutStatus fromGateway(String raw) {
        if (raw == null) {
            return PENDING;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "SUCCESS", "SUCCESSFUL", "COMPLETED" -> SUCCESS;
            case "FAILED", "EXPIRED", "CANCELLED", "REJECTED" -> FAILED;
            case "REVERSED" -> REVERSED;
            default -> PENDING;
        };
    }

    /**
     * The money did not reach the organizer and the debit must be compensated.
     */
    public boolean isFailure() {
        return this == FAILED || this == REVERSED || this == NOT_FOUND;
    }
}
