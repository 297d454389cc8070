package com.flagship.settlement_engine.ledger;

/**
 * Kind of monetary fact recorded in the ledger. Amounts are always positive;
 * the type (and, for debits against a sale, the bucket) decides the direction.
 */
public enum LedgerEntryType {
    /** Net proceeds of a sale, credited to pending. */
    TICKET_SALE,
    /** A matured sale moving from pending to available. */
    MATURATION,
    /** Payout dispatched: available to withdrawn. */
    WITHDRAWAL,
    /** Compensation for a failed payout: withdrawn back to available. */
    WITHDRAWAL_REVERSAL,
    /** Sale reversed at the buyer's request. */
    REFUND,
    /** Sale reversed by the card network or bank. */
    CHARGEBACK;

    public boolean requiresBucket() {
        return this == REFUND || this == CHARGEBACK;
    }
}
