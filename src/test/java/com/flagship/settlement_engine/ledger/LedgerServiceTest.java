package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.IntegrationTestSupport;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.payment.ChargebackService;
import com.flagship.settlement_engine.ticket.Ticket;
import com.flagship.settlement_engine.ticket.TicketEntity;
import com.flagship.settlement_engine.ticket.TicketRepository;
import com.flagship.settlement_engine.ticket.TicketStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LedgerServiceTest extends IntegrationTestSupport {

    @Autowired
    private ChargebackService chargebackService;

    @Autowired
    private TicketRepository ticketRepository;

    private UUID organizerId;
    private UUID eventId;
    private UUID tierId;

    @BeforeEach
    void setUp() {
        organizerId = UUID.randomUUID();
        eventId = createEvent(organizerId, Instant.now().plus(Duration.ofDays(2)));
        tierId = createTier(eventId, "25000.00", 100, true);
    }

    @Nested
    @DisplayName("Replay")
    class Replay {

        @Test
        @DisplayName("Every stored snapshot equals the replay of the entries before it")
        void snapshotsMatchReplayPrefix() {
            purchaseTicket(eventId, tierId, UUID.randomUUID());
            purchaseTicket(eventId, tierId, UUID.randomUUID());
            maturationService.matureOrganizer(organizerId, Instant.now().plus(Duration.ofHours(25)));
            purchaseTicket(eventId, tierId, UUID.randomUUID());

            List<LedgerEntry> entries = ledgerService.history(organizerId);
            assertEquals(5, entries.size());

            OrganizerBalance replayed = OrganizerBalance.zero(organizerId);
            long previousSequence = Long.MIN_VALUE;
            for (LedgerEntry entry : entries) {
                assertTrue(entry.getSequenceNumber() > previousSequence);
                previousSequence = entry.getSequenceNumber();
                replayed = BalanceProjector.apply(replayed, entry);
                assertTrue(replayed.sameAmounts(entry.balanceAfter()), () -> "snapshot drift at " + entry.getId());
            }
            assertTrue(replayed.sameAmounts(balanceOf(organizerId)));

            ReplayReport report = ledgerService.verifyReplay(organizerId);
            assertTrue(report.isConsistent());
            assertEquals(5, report.getEntriesChecked());
            assertNull(report.getFirstMismatchEntryId());
        }

        @Test
        @DisplayName("Drifted cache is reported and rebuilt from the ledger")
        void driftedCacheIsRebuilt() {
            purchaseTicket(eventId, tierId, UUID.randomUUID());
            jdbcTemplate.update("UPDATE organizer_balances SET pending = pending + 100 WHERE organizer_id = ?", organizerId);

            ReplayReport report = ledgerService.verifyReplay(organizerId);
            assertFalse(report.isConsistent());
            assertAmount("23850.00", report.getCached().getPending());

            OrganizerBalance rebuilt = ledgerService.rebuildBalance(organizerId);

            assertAmount("23750.00", rebuilt.getPending());
            assertTrue(ledgerService.verifyReplay(organizerId).isConsistent());
        }

        @Test
        @DisplayName("Verification during a stream of sales never reports drift")
        void verificationDuringAppends() throws Exception {
            fundAvailable(organizerId, "100.00");
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<?> writer = executor.submit(() -> {
                    for (int i = 0; i < 40; i++) {
                        fundAvailable(organizerId, "100.00");
                    }
                });

                int runs = 0;
                while (!writer.isDone() || runs == 0) {
                    ReplayReport report = ledgerService.verifyReplay(organizerId);
                    assertTrue(report.isConsistent(), () -> "drift reported after " + report.getEntriesChecked() + " entries");
                    runs++;
                }
                writer.get(30, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            ReplayReport last = ledgerService.verifyReplay(organizerId);
            assertTrue(last.isConsistent());
            assertEquals(82, last.getEntriesChecked());
            assertAmount("4100.00", balanceOf(organizerId).getAvailable());
        }

        @Test
        @DisplayName("Organizer without entries has a zero balance")
        void unknownOrganizer() {
            OrganizerBalance balance = balanceOf(UUID.randomUUID());

            assertAmount("0", balance.getPending());
            assertAmount("0", balance.getAvailable());
            assertAmount("0", balance.getWithdrawn());
        }
    }

    @Nested
    @DisplayName("Append-only storage")
    class AppendOnly {

        @Test
        @DisplayName("Updating a ledger row is rejected by the database")
        void updateRejected() {
            purchaseTicket(eventId, tierId, UUID.randomUUID());

            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE ledger_entries SET amount = 1 WHERE organizer_id = ?", organizerId));
            assertAmount("23750.00", ledgerService.history(organizerId).get(0).getAmount());
        }

        @Test
        @DisplayName("Deleting a ledger row is rejected by the database")
        void deleteRejected() {
            purchaseTicket(eventId, tierId, UUID.randomUUID());

            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM ledger_entries WHERE organizer_id = ?", organizerId));
            assertEquals(1, ledgerService.history(organizerId).size());
        }
    }

    @Nested
    @DisplayName("Maturation")
    class Maturation {

        @Test
        @DisplayName("Sales inside the holding period stay pending")
        void holdingPeriod() {
            purchaseTicket(eventId, tierId, UUID.randomUUID());

            assertEquals(0, maturationService.matureOrganizer(organizerId, Instant.now()));
            assertAmount("23750.00", balanceOf(organizerId).getPending());
        }

        @Test
        @DisplayName("A sale matures exactly once")
        void maturesOnce() {
            purchaseTicket(eventId, tierId, UUID.randomUUID());
            Instant later = Instant.now().plus(Duration.ofHours(25));

            assertEquals(1, maturationService.matureOrganizer(organizerId, later));
            assertEquals(0, maturationService.matureOrganizer(organizerId, later));

            OrganizerBalance balance = balanceOf(organizerId);
            assertAmount("0", balance.getPending());
            assertAmount("23750.00", balance.getAvailable());
            assertTrue(maturationService.organizersDue(later).stream().noneMatch(organizerId::equals));
        }
    }

    @Nested
    @DisplayName("Chargebacks")
    class Chargebacks {

        @Test
        @DisplayName("Chargeback debits pending and cancels the unused ticket")
        void chargebackOnPendingSale() {
            Ticket ticket = purchaseTicket(eventId, tierId, UUID.randomUUID());

            LedgerEntry entry = chargebackService.recordChargeback(ticket.getId(), "Card reported stolen");

            assertEquals(LedgerEntryType.CHARGEBACK, entry.getEntryType());
            assertEquals(BalanceBucket.PENDING, entry.getBalanceBucket());
            assertAmount("0", balanceOf(organizerId).getPending());
            Ticket after = ticketRepository.findById(ticket.getId()).map(TicketEntity::toDomain).orElseThrow();
            assertEquals(TicketStatus.CANCELLED, after.getStatus());
        }

        @Test
        @DisplayName("Chargeback on a matured sale may take available below zero")
        void chargebackAfterWithdrawalGoesNegative() {
            Ticket ticket = purchaseTicket(eventId, tierId, UUID.randomUUID());
            maturationService.matureOrganizer(organizerId, Instant.now().plus(Duration.ofHours(25)));
            transactionTemplate.executeWithoutResult(status -> ledgerService.append(
                LedgerPosting.withdrawal(organizerId, UUID.randomUUID(), new BigDecimal("20000.00"), "Payout")));

            chargebackService.recordChargeback(ticket.getId(), "Disputed");

            OrganizerBalance balance = balanceOf(organizerId);
            assertAmount("-20000.00", balance.getAvailable());
            assertAmount("0", balance.getWithdrawable());
            assertTrue(ledgerService.verifyReplay(organizerId).isConsistent());
        }

        @Test
        @DisplayName("A sale is reversed at most once")
        void secondChargebackRejected() {
            Ticket ticket = purchaseTicket(eventId, tierId, UUID.randomUUID());
            chargebackService.recordChargeback(ticket.getId(), "Disputed");

            SettlementException e = assertThrows(SettlementException.class,
                () -> chargebackService.recordChargeback(ticket.getId(), "Disputed again"));

            assertEquals(ErrorCode.LEDGER_ALREADY_REVERSED, e.getErrorCode());
        }
    }
}
