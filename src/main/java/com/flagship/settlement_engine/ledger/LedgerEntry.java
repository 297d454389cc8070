package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable row of the organizer ledger.
 *
 * The three *BalanceAfter fields are the balance right after this entry was
 * applied. Replaying all earlier entries must reproduce them exactly.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID organizerId;
    LedgerEntryType entryType;
    BigDecimal amount;
    BalanceBucket balanceBucket;
    UUID relatedPaymentId;
    UUID relatedTicketId;
    UUID relatedWithdrawalId;
    UUID relatedRefundId;
    String description;
    BigDecimal pendingBalanceAfter;
    BigDecimal availableBalanceAfter;
    BigDecimal withdrawnBalanceAfter;
    Long sequenceNumber;
    Instant createdAt;

    public OrganizerBalance balanceAfter() {
        return new OrganizerBalance(organizerId, pendingBalanceAfter, availableBalanceAfter, withdrawnBalanceAfter);
    }
}
