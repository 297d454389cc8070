package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request to append one entry. Snapshots are computed by the ledger, never by the caller.
 */
@Value
public class LedgerPosting {
    UUID organizerId;
    LedgerEntryType entryType;
    BigDecimal amount;
    BalanceBucket balanceBucket;
    UUID relatedPaymentId;
    UUID relatedTicketId;
    UUID relatedWithdrawalId;
    UUID relatedRefundId;
    String description;

    public static LedgerPosting ticketSale(UUID organizerId, UUID paymentId, UUID ticketId,
                                           BigDecimal netAmount, String description) {
        return new LedgerPosting(organizerId, LedgerEntryType.TICKET_SALE, netAmount, null,
            paymentId, ticketId, null, null, description);
    }

    public static LedgerPosting maturation(UUID organizerId, UUID paymentId, UUID ticketId,
                                           BigDecimal amount, String description) {
        return new LedgerPosting(organizerId, LedgerEntryType.MATURATION, amount, null,
            paymentId, ticketId, null, null, description);
    }

    public static LedgerPosting withdrawal(UUID organizerId, UUID withdrawalId,
                                           BigDecimal amount, String description) {
        return new LedgerPosting(organizerId, LedgerEntryType.WITHDRAWAL, amount, null,
            null, null, withdrawalId, null, description);
    }

    public static LedgerPosting withdrawalReversal(UUID organizerId, UUID withdrawalId,
                                                   BigDecimal amount, String description) {
        return new LedgerPosting(organizerId, LedgerEntryType.WITHDRAWAL_REVERSAL, amount, null,
            null, null, withdrawalId, null, description);
    }

    public static LedgerPosting refund(UUID organizerId, UUID paymentId, UUID ticketId, UUID refundId,
                                       BigDecimal amount, BalanceBucket bucket, String description) {
        return new LedgerPosting(organizerId, LedgerEntryType.REFUND, amount, bucket,
            paymentId, ticketId, null, refundId, description);
    }

    public static LedgerPosting chargeback(UUID organizerId, UUID paymentId, UUID ticketId,
                                           BigDecimal amount, BalanceBucket bucket, String description) {
        return new LedgerPosting(organizerId, LedgerEntryType.CHARGEBACK, amount, bucket,
            paymentId, ticketId, null, null, description);
    }
}
