package com.flagship.settlement_engine.ledger;

/**
 * Which side of the organizer balance a refund or chargeback is taken from.
 */
public enum BalanceBucket {
    PENDING,
    AVAILABLE
}
