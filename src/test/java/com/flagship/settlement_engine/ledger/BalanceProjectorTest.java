package com.flagship.settlement_engine.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BalanceProjectorTest {

    private final UUID organizerId = UUID.randomUUID();

    private OrganizerBalance apply(OrganizerBalance balance, LedgerEntryType type, BalanceBucket bucket, String amount) {
        return BalanceProjector.apply(balance, type, bucket, new BigDecimal(amount));
    }

    private static void assertBalance(String pending, String available, String withdrawn, OrganizerBalance balance) {
        assertEquals(0, new BigDecimal(pending).compareTo(balance.getPending()), "pending");
        assertEquals(0, new BigDecimal(available).compareTo(balance.getAvailable()), "available");
        assertEquals(0, new BigDecimal(withdrawn).compareTo(balance.getWithdrawn()), "withdrawn");
    }

    @Test
    @DisplayName("Sale, maturation, withdrawal and reversal move money between buckets")
    void lifecycle() {
        OrganizerBalance balance = OrganizerBalance.zero(organizerId);

        balance = apply(balance, LedgerEntryType.TICKET_SALE, null, "23750.00");
        assertBalance("23750", "0", "0", balance);

        balance = apply(balance, LedgerEntryType.MATURATION, null, "23750.00");
        assertBalance("0", "23750", "0", balance);

        balance = apply(balance, LedgerEntryType.WITHDRAWAL, null, "10000.00");
        assertBalance("0", "13750", "10000", balance);

        balance = apply(balance, LedgerEntryType.WITHDRAWAL_REVERSAL, null, "10000.00");
        assertBalance("0", "23750", "0", balance);
    }

    @Test
    @DisplayName("Refunds and chargebacks debit the bucket they name")
    void reversalsDebitNamedBucket() {
        OrganizerBalance balance = apply(OrganizerBalance.zero(organizerId), LedgerEntryType.TICKET_SALE, null, "100.00");
        balance = apply(balance, LedgerEntryType.TICKET_SALE, null, "50.00");
        balance = apply(balance, LedgerEntryType.MATURATION, null, "50.00");

        balance = apply(balance, LedgerEntryType.REFUND, BalanceBucket.PENDING, "100.00");
        assertBalance("0", "50", "0", balance);

        balance = apply(balance, LedgerEntryType.CHARGEBACK, BalanceBucket.AVAILABLE, "50.00");
        assertBalance("0", "0", "0", balance);
    }

    @Test
    @DisplayName("Available may go negative; withdrawable never does")
    void negativeAvailable() {
        OrganizerBalance balance = apply(OrganizerBalance.zero(organizerId), LedgerEntryType.REFUND, BalanceBucket.AVAILABLE, "75.50");

        assertBalance("0", "-75.50", "0", balance);
        assertEquals(0, BigDecimal.ZERO.compareTo(balance.getWithdrawable()));
    }

    @Test
    @DisplayName("Amounts must be positive and reversals must name a bucket")
    void rejectsInvalidPostings() {
        OrganizerBalance zero = OrganizerBalance.zero(organizerId);

        assertThrows(IllegalArgumentException.class, () -> apply(zero, LedgerEntryType.TICKET_SALE, null, "0"));
        assertThrows(IllegalArgumentException.class, () -> apply(zero, LedgerEntryType.TICKET_SALE, null, "-5"));
        assertThrows(IllegalArgumentException.class, () -> apply(zero, LedgerEntryType.REFUND, null, "5"));
    }

    @Test
    @DisplayName("Results are kept at two decimals")
    void scale() {
        OrganizerBalance balance = apply(OrganizerBalance.zero(organizerId), LedgerEntryType.TICKET_SALE, null, "10.005");

        assertEquals(2, balance.getPending().scale());
        assertEquals(new BigDecimal("10.01"), balance.getPending());
    }
}
