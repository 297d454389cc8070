package com.flagship.settlement_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Three-bucket balance of an organizer. Either read from the cache row or
 * produced by replaying the ledger; both must agree.
 */
@Value
public class OrganizerBalance {
    UUID organizerId;
    BigDecimal pending;
    BigDecimal available;
    BigDecimal withdrawn;

    public static OrganizerBalance zero(UUID organizerId) {
        return new OrganizerBalance(organizerId, money(BigDecimal.ZERO), money(BigDecimal.ZERO), money(BigDecimal.ZERO));
    }

    /**
     * Available funds that can be paid out. A refund against matured funds may
     * drive available below zero; nothing is withdrawable until it recovers.
     */
    public BigDecimal getWithdrawable() {
        return available.signum() > 0 ? available : money(BigDecimal.ZERO);
    }

    /**
     * Everything ever credited to the organizer and not reversed.
     */
    public BigDecimal total() {
        return pending.add(available).add(withdrawn);
    }

    /**
     * Compares amounts numerically, ignoring scale.
     */
    public boolean sameAmounts(OrganizerBalance other) {
        return pending.compareTo(other.pending) == 0
            && available.compareTo(other.available) == 0
            && withdrawn.compareTo(other.withdrawn) == 0;
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
