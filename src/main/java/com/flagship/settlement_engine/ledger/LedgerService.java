package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only organizer ledger plus its balance cache.
 *
 * Invariants enforced here:
 * 1. Ledger rows are only ever inserted (a database trigger rejects UPDATE, DELETE and TRUNCATE)
 * 2. Appends for one organizer are serialized by a row lock on organizer_balances
 * 3. The cached balance is written in the same transaction as the entry it reflects
 * 4. Every entry carries the balance snapshot produced by {@link BalanceProjector}
 *
 * JDBC is used directly so that locking and ordering are visible in the SQL.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String ENTRY_COLUMNS =
        "id, organizer_id, entry_type, amount, balance_bucket, related_payment_id, related_ticket_id, " +
        "related_withdrawal_id, related_refund_id, description, pending_balance_after, " +
        "available_balance_after, withdrawn_balance_after, sequence_number, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public LedgerService(JdbcTemplate jdbcTemplate, SettlementMetrics metrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Appends one entry and moves the cached balance with it.
     *
     * Must run inside the caller's transaction so that the entry commits or
     * rolls back together with the business change it records.
     *
     * @throws SettlementException INSUFFICIENT_BALANCE when a withdrawal exceeds available funds
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEntry append(LedgerPosting posting) {
        OrganizerBalance current = lockBalance(posting.getOrganizerId());

        if (posting.getEntryType() == LedgerEntryType.WITHDRAWAL
                && current.getAvailable().compareTo(posting.getAmount()) < 0) {
            throw new SettlementException(ErrorCode.INSUFFICIENT_BALANCE,
                String.format("Available balance %s is below requested %s",
                    current.getAvailable(), posting.getAmount()));
        }

        OrganizerBalance next = BalanceProjector.apply(
            current, posting.getEntryType(), posting.getBalanceBucket(), posting.getAmount());

        LedgerEntry entry = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_entries (id, organizer_id, entry_type, amount, balance_bucket, " +
            "related_payment_id, related_ticket_id, related_withdrawal_id, related_refund_id, description, " +
            "pending_balance_after, available_balance_after, withdrawn_balance_after, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING " + ENTRY_COLUMNS,
            ledgerEntryRowMapper(),
            UUID.randomUUID(),
            posting.getOrganizerId(),
            posting.getEntryType().name(),
            posting.getAmount(),
            posting.getBalanceBucket() != null ? posting.getBalanceBucket().name() : null,
            posting.getRelatedPaymentId(),
            posting.getRelatedTicketId(),
            posting.getRelatedWithdrawalId(),
            posting.getRelatedRefundId(),
            posting.getDescription(),
            next.getPending(),
            next.getAvailable(),
            next.getWithdrawn(),
            Timestamp.from(clock.instant())
        );

        jdbcTemplate.update(
            "UPDATE organizer_balances SET pending = ?, available = ?, withdrawn = ?, last_entry_id = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE organizer_id = ?",
            next.getPending(),
            next.getAvailable(),
            next.getWithdrawn(),
            entry.getId(),
            posting.getOrganizerId()
        );

        metrics.recordLedgerEntry(posting.getEntryType());
        log.info("Ledger entry appended: organizerId={}, type={}, amount={}, pending={}, available={}, withdrawn={}",
            posting.getOrganizerId(), posting.getEntryType(), posting.getAmount(),
            next.getPending(), next.getAvailable(), next.getWithdrawn());

        return entry;
    }

    /**
     * Locks the organizer's balance row until the surrounding transaction ends,
     * creating an empty row on first use. Every balance-dependent decision
     * (withdrawal eligibility, maturation, refund bucket) is taken under this lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OrganizerBalance lockBalance(UUID organizerId) {
        jdbcTemplate.update(
            "INSERT INTO organizer_balances (organizer_id) VALUES (?) ON CONFLICT (organizer_id) DO NOTHING",
            organizerId
        );
        return jdbcTemplate.queryForObject(
            "SELECT organizer_id, pending, available, withdrawn FROM organizer_balances " +
            "WHERE organizer_id = ? FOR UPDATE",
            balanceRowMapper(),
            organizerId
        );
    }

    /**
     * Cached balance. Organizers without any entry have a zero balance.
     */
    @Transactional(readOnly = true)
    public OrganizerBalance balanceOf(UUID organizerId) {
        List<OrganizerBalance> rows = jdbcTemplate.query(
            "SELECT organizer_id, pending, available, withdrawn FROM organizer_balances WHERE organizer_id = ?",
            balanceRowMapper(),
            organizerId
        );
        return rows.isEmpty() ? OrganizerBalance.zero(organizerId) : rows.get(0);
    }

    /**
     * Newest entries first.
     */
    @Transactional(readOnly = true)
    public LedgerPage entries(UUID organizerId, int page, int size) {
        if (page < 0 || size < 1 || size > 200) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and 200");
        }
        List<LedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE organizer_id = ? " +
            "ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            ledgerEntryRowMapper(),
            organizerId, size, (long) page * size
        );
        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE organizer_id = ?", Long.class, organizerId);
        return new LedgerPage(entries, total != null ? total : 0, page, size);
    }

    /**
     * All entries of an organizer in append order.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> history(UUID organizerId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE organizer_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            organizerId
        );
    }

    /**
     * Replays the organizer's ledger and checks every stored snapshot and the cache.
     *
     * Entries and cache are read from one snapshot, so an append committing
     * mid-check cannot put the cache ahead of the replay.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ReplayReport verifyReplay(UUID organizerId) {
        List<LedgerEntry> entries = history(organizerId);
        OrganizerBalance replayed = OrganizerBalance.zero(organizerId);
        UUID firstMismatch = null;

        for (LedgerEntry entry : entries) {
            replayed = BalanceProjector.apply(replayed, entry);
            if (firstMismatch == null && !replayed.sameAmounts(entry.balanceAfter())) {
                firstMismatch = entry.getId();
            }
        }

        OrganizerBalance cached = balanceOf(organizerId);
        boolean consistent = firstMismatch == null && replayed.sameAmounts(cached);

        if (!consistent) {
            metrics.recordReplayMismatch();
            log.error("Ledger replay mismatch: organizerId={}, firstMismatchEntryId={}, replayed={}, cached={}",
                organizerId, firstMismatch, replayed, cached);
        }

        return new ReplayReport(organizerId, entries.size(), consistent, firstMismatch, replayed, cached);
    }

    /**
     * Rewrites the cached balance from a full replay. The ledger itself is never touched.
     */
    @Transactional
    public OrganizerBalance rebuildBalance(UUID organizerId) {
        OrganizerBalance before = lockBalance(organizerId);
        List<LedgerEntry> entries = history(organizerId);
        OrganizerBalance replayed = BalanceProjector.replay(organizerId, entries);

        jdbcTemplate.update(
            "UPDATE organizer_balances SET pending = ?, available = ?, withdrawn = ?, last_entry_id = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE organizer_id = ?",
            replayed.getPending(),
            replayed.getAvailable(),
            replayed.getWithdrawn(),
            entries.isEmpty() ? null : entries.get(entries.size() - 1).getId(),
            organizerId
        );

        if (!before.sameAmounts(replayed)) {
            log.warn("Rebuilt organizer balance from ledger: organizerId={}, before={}, after={}",
                organizerId, before, replayed);
        }
        return replayed;
    }

    @Transactional(readOnly = true)
    public List<UUID> organizersWithEntries() {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT organizer_id FROM ledger_entries", UUID.class);
    }

    /**
     * The TICKET_SALE entry recorded for a ticket, if any.
     */
    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findSale(UUID ticketId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE related_ticket_id = ? AND entry_type = 'TICKET_SALE'",
            ledgerEntryRowMapper(),
            ticketId
        ).stream().findFirst();
    }

    /**
     * Bucket that currently holds the proceeds of a ticket's sale:
     * AVAILABLE once the sale has matured, PENDING before.
     * Callers hold the organizer lock so maturation cannot interleave.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceBucket bucketHoldingSale(UUID ticketId) {
        Integer matured = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE related_ticket_id = ? AND entry_type = 'MATURATION'",
            Integer.class,
            ticketId
        );
        return matured != null && matured > 0 ? BalanceBucket.AVAILABLE : BalanceBucket.PENDING;
    }

    /**
     * True once the sale of the ticket has been refunded or charged back.
     */
    @Transactional(readOnly = true)
    public boolean isSaleReversed(UUID ticketId) {
        Integer reversed = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE related_ticket_id = ? AND entry_type IN ('REFUND', 'CHARGEBACK')",
            Integer.class,
            ticketId
        );
        return reversed != null && reversed > 0;
    }

    /**
     * Records a chargeback against a ticket's sale, debiting whichever bucket
     * currently holds the proceeds. Corrections are new entries; the sale row stays as written.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEntry recordChargeback(UUID ticketId, String reason) {
        LedgerEntry sale = findSale(ticketId)
            .orElseThrow(() -> new SettlementException(ErrorCode.LEDGER_SALE_NOT_FOUND,
                "No sale recorded for ticket " + ticketId));

        lockBalance(sale.getOrganizerId());
        if (isSaleReversed(ticketId)) {
            throw new SettlementException(ErrorCode.LEDGER_ALREADY_REVERSED,
                "Sale for ticket " + ticketId + " has already been reversed");
        }

        BalanceBucket bucket = bucketHoldingSale(ticketId);
        return append(LedgerPosting.chargeback(
            sale.getOrganizerId(),
            sale.getRelatedPaymentId(),
            ticketId,
            sale.getAmount(),
            bucket,
            "Chargeback: " + reason
        ));
    }

    private RowMapper<OrganizerBalance> balanceRowMapper() {
        return (rs, rowNum) -> new OrganizerBalance(
            UUID.fromString(rs.getString("organizer_id")),
            rs.getBigDecimal("pending"),
            rs.getBigDecimal("available"),
            rs.getBigDecimal("withdrawn")
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> {
            String bucket = rs.getString("balance_bucket");
            return new LedgerEntry(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("organizer_id")),
                LedgerEntryType.valueOf(rs.getString("entry_type")),
                rs.getBigDecimal("amount"),
                bucket != null ? BalanceBucket.valueOf(bucket) : null,
                uuidOrNull(rs, "related_payment_id"),
                uuidOrNull(rs, "related_ticket_id"),
                uuidOrNull(rs, "related_withdrawal_id"),
                uuidOrNull(rs, "related_refund_id"),
                rs.getString("description"),
                rs.getBigDecimal("pending_balance_after"),
                rs.getBigDecimal("available_balance_after"),
                rs.getBigDecimal("withdrawn_balance_after"),
                rs.getLong("sequence_number"),
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }

    private static UUID uuidOrNull(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }

    /**
     * Sales of the organizer that are old enough to mature and have not been
     * matured, refunded or charged back. Read under the organizer lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<LedgerEntry> salesDueForMaturation(UUID organizerId, Timestamp soldBefore) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries s " +
            "WHERE s.organizer_id = ? AND s.entry_type = 'TICKET_SALE' AND s.created_at <= ? " +
            "AND NOT EXISTS (SELECT 1 FROM ledger_entries o WHERE o.related_ticket_id = s.related_ticket_id " +
            "AND o.entry_type IN ('MATURATION', 'REFUND', 'CHARGEBACK')) " +
            "ORDER BY s.sequence_number",
            ledgerEntryRowMapper(),
            organizerId, soldBefore
        );
    }

    /**
     * Organizers that have at least one sale old enough to mature.
     */
    @Transactional(readOnly = true)
    public List<UUID> organizersWithMaturingSales(Timestamp soldBefore) {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT s.organizer_id FROM ledger_entries s " +
            "WHERE s.entry_type = 'TICKET_SALE' AND s.created_at <= ? " +
            "AND NOT EXISTS (SELECT 1 FROM ledger_entries o WHERE o.related_ticket_id = s.related_ticket_id " +
            "AND o.entry_type IN ('MATURATION', 'REFUND', 'CHARGEBACK'))",
            UUID.class,
            soldBefore
        );
    }
}
