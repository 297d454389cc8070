package com.flagship.settlement_engine.gateway;

import java.util.Locale;

/**
 * Gateway transaction status, normalised.
 */
public enum TransactionStatus {
    PAID,
    PENDING,
    FAILED;

    /**
     * PAID and SUCCESS settle. OVERPAID and PARTIALLY_PAID also carry money, so they
     * map to PAID and are caught by the amount check. FAILED, EXPIRED and CANCELLED
     * are terminal failures. Anything else is still pending.
     */
    public static TransactionStatus fromGateway(String raw) {
        if (raw == null) {
            return PENDING;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "PAID", "SUCCESS", "OVERPAID", "PARTIALLY_PAID" -> PAID;
            case "FAILED", "EXPIRED", "CANCELLED" -> FAILED;
            default -> PENDING;
        };
    }
}
