package com.flagship.settlement_engine.consumer;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-event sales read model, kept up to date from settlement events.
 * Each method is one upsert; duplicate delivery is filtered upstream by
 * {@link IdempotentEventProcessor}.
 */
@Component
@Slf4j
public class SalesSummaryProjector {

    private static final String UPSERT = """
        INSERT INTO event_sales_summary (event_id, tickets_sold, gross_amount, tickets_refunded,
                                         refunded_amount, tickets_checked_in, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (event_id) DO UPDATE SET
            tickets_sold       = event_sales_summary.tickets_sold + EXCLUDED.tickets_sold,
            gross_amount       = event_sales_summary.gross_amount + EXCLUDED.gross_amount,
            tickets_refunded   = event_sales_summary.tickets_refunded + EXCLUDED.tickets_refunded,
            refunded_amount    = event_sales_summary.refunded_amount + EXCLUDED.refunded_amount,
            tickets_checked_in = event_sales_summary.tickets_checked_in + EXCLUDED.tickets_checked_in,
            updated_at         = EXCLUDED.updated_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public SalesSummaryProjector(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Value
    public static class SalesSummary {
        UUID eventId;
        int ticketsSold;
        BigDecimal grossAmount;
        int ticketsRefunded;
        BigDecimal refundedAmount;
        int ticketsCheckedIn;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void onTicketSold(UUID eventId, BigDecimal amount) {
        apply(eventId, 1, amount, 0, BigDecimal.ZERO, 0);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void onTicketRefunded(UUID eventId, BigDecimal refundAmount) {
        apply(eventId, 0, BigDecimal.ZERO, 1, refundAmount, 0);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void onTicketCheckedIn(UUID eventId) {
        apply(eventId, 0, BigDecimal.ZERO, 0, BigDecimal.ZERO, 1);
    }

    @Transactional(readOnly = true)
    public Optional<SalesSummary> find(UUID eventId) {
        return jdbcTemplate.query(
            "SELECT event_id, tickets_sold, gross_amount, tickets_refunded, refunded_amount, tickets_checked_in "
                + "FROM event_sales_summary WHERE event_id = ?",
            (rs, rowNum) -> new SalesSummary(
                UUID.fromString(rs.getString("event_id")),
                rs.getInt("tickets_sold"),
                rs.getBigDecimal("gross_amount"),
                rs.getInt("tickets_refunded"),
                rs.getBigDecimal("refunded_amount"),
                rs.getInt("tickets_checked_in")),
            eventId
        ).stream().findFirst();
    }

    private void apply(UUID eventId, int sold, BigDecimal gross, int refunded, BigDecimal refundedAmount, int checkedIn) {
        jdbcTemplate.update(UPSERT, eventId, sold, gross, refunded, refundedAmount, checkedIn,
            Timestamp.from(clock.instant()));
        log.debug("Sales summary updated: eventId={}", eventId);
    }
}
