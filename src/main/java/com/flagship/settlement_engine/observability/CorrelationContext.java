package com.flagship.settlement_engine.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys and helpers for request correlation.
 *
 * The correlation id flows from the HTTP header into every log line; the
 * business keys (reference, withdrawalId, ...) are pushed by services for the
 * span of one operation.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String REFERENCE_MDC_KEY = "reference";
    public static final String WITHDRAWAL_ID_MDC_KEY = "withdrawalId";
    public static final String REFUND_ID_MDC_KEY = "refundId";
    public static final String TICKET_ID_MDC_KEY = "ticketId";
    public static final String ORGANIZER_ID_MDC_KEY = "organizerId";
    public static final String ACTOR_MDC_KEY = "actor";

    private static final String[] BUSINESS_KEYS = {
        REFERENCE_MDC_KEY, WITHDRAWAL_ID_MDC_KEY, REFUND_ID_MDC_KEY, TICKET_ID_MDC_KEY, ORGANIZER_ID_MDC_KEY
    };

    private CorrelationContext() {
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts one business key in MDC. Close the returned handle to remove it.
     */
    public static MDC.MDCCloseable put(String key, Object value) {
        return MDC.putCloseable(key, value != null ? value.toString() : null);
    }

    public static void clearBusinessKeys() {
        for (String key : BUSINESS_KEYS) {
            MDC.remove(key);
        }
    }
}
