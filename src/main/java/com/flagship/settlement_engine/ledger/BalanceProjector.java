package com.flagship.settlement_engine.ledger;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Pure fold from ledger entries to an organizer balance.
 *
 * The same function is used when appending (to compute the snapshot stored on
 * the new entry and the cached balance) and when replaying (to verify them),
 * so the two paths cannot drift apart.
 */
public final class BalanceProjector {

    private BalanceProjector() {
    }

    public static OrganizerBalance apply(OrganizerBalance balance, LedgerEntryType type,
                                         BalanceBucket bucket, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Ledger amount must be positive: " + amount);
        }
        if (type.requiresBucket() && bucket == null) {
            throw new IllegalArgumentException(type + " entries must name the bucket they debit");
        }

        BigDecimal pending = balance.getPending();
        BigDecimal available = balance.getAvailable();
        BigDecimal withdrawn = balance.getWithdrawn();

        switch (type) {
            case TICKET_SALE -> pending = pending.add(amount);
            case MATURATION -> {
                pending = pending.subtract(amount);
                available = available.add(amount);
            }
            case WITHDRAWAL -> {
                available = available.subtract(amount);
                withdrawn = withdrawn.add(amount);
            }
            case WITHDRAWAL_REVERSAL -> {
                withdrawn = withdrawn.subtract(amount);
                available = available.add(amount);
            }
            case REFUND, CHARGEBACK -> {
                if (bucket == BalanceBucket.PENDING) {
                    pending = pending.subtract(amount);
                } else {
                    available = available.subtract(amount);
                }
            }
        }

        return new OrganizerBalance(
            balance.getOrganizerId(),
            OrganizerBalance.money(pending),
            OrganizerBalance.money(available),
            OrganizerBalance.money(withdrawn)
        );
    }

    public static OrganizerBalance apply(OrganizerBalance balance, LedgerEntry entry) {
        return apply(balance, entry.getEntryType(), entry.getBalanceBucket(), entry.getAmount());
    }

    /**
     * Folds entries in the order given. Callers pass them in sequence order.
     */
    public static OrganizerBalance replay(UUID organizerId, List<LedgerEntry> entries) {
        OrganizerBalance balance = OrganizerBalance.zero(organizerId);
        for (LedgerEntry entry : entries) {
            balance = apply(balance, entry);
        }
        return balance;
    }
}
