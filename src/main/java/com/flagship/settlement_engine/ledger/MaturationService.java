package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.config.SettlementProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Moves matured sales from pending to available.
 *
 * Maturation is per sale: each TICKET_SALE becomes withdrawable once its own
 * timestamp is older than the holding period. One MATURATION entry is written
 * per sale, so replaying the ledger reproduces the move without any clock input.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaturationService {

    private final LedgerService ledgerService;
    private final SettlementProperties properties;

    /**
     * Matures every eligible sale of one organizer as of {@code now}.
     *
     * @return number of MATURATION entries written
     */
    @Transactional
    public int matureOrganizer(UUID organizerId, Instant now) {
        ledgerService.lockBalance(organizerId);

        List<LedgerEntry> due = ledgerService.salesDueForMaturation(organizerId, cutoff(now));
        for (LedgerEntry sale : due) {
            ledgerService.append(LedgerPosting.maturation(
                organizerId,
                sale.getRelatedPaymentId(),
                sale.getRelatedTicketId(),
                sale.getAmount(),
                "Sale matured: ticket " + sale.getRelatedTicketId()
            ));
        }

        if (!due.isEmpty()) {
            log.info("Matured {} sales for organizerId={}", due.size(), organizerId);
        }
        return due.size();
    }

    public List<UUID> organizersDue(Instant now) {
        return ledgerService.organizersWithMaturingSales(cutoff(now));
    }

    private Timestamp cutoff(Instant now) {
        return Timestamp.from(now.minus(properties.getMaturation().getHoldingPeriod()));
    }
}
