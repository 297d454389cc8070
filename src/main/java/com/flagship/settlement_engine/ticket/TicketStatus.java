package com.flagship.settlement_engine.ticket;

/**
 * ACTIVE is the only state a ticket can leave. CHECKED_IN, REFUNDED and CANCELLED are terminal.
 */
public enum TicketStatus {
    ACTIVE,
    CHECKED_IN,
    REFUNDED,
    CANCELLED
}
