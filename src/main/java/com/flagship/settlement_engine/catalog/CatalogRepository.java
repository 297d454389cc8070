package com.flagship.settlement_engine.catalog;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads events and tiers. This service never writes the catalog tables.
 */
@Repository
public class CatalogRepository {

    private final JdbcTemplate jdbcTemplate;

    public CatalogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<EventInfo> findEvent(UUID eventId) {
        List<EventInfo> rows = jdbcTemplate.query(
            "SELECT id, organizer_id, title, start_date, end_date FROM events WHERE id = ?",
            eventRowMapper(),
            eventId
        );
        return rows.stream().findFirst();
    }

    public EventInfo getEvent(UUID eventId) {
        return findEvent(eventId)
            .orElseThrow(() -> new SettlementException(ErrorCode.EVENT_NOT_FOUND, "Event not found: " + eventId));
    }

    public Optional<TierInfo> findTier(UUID tierId) {
        List<TierInfo> rows = jdbcTemplate.query(
            "SELECT id, event_id, name, price, capacity, refund_enabled FROM ticket_tiers WHERE id = ?",
            tierRowMapper(),
            tierId
        );
        return rows.stream().findFirst();
    }

    public TierInfo getTier(UUID tierId) {
        return findTier(tierId)
            .orElseThrow(() -> new SettlementException(ErrorCode.TIER_NOT_FOUND, "Ticket tier not found: " + tierId));
    }

    /**
     * Tickets of the tier that still hold a seat (issued and not refunded or cancelled).
     */
    public int countSeatsTaken(UUID tierId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM tickets WHERE tier_id = ? AND status IN ('ACTIVE', 'CHECKED_IN')",
            Integer.class,
            tierId
        );
        return count != null ? count : 0;
    }

    private RowMapper<EventInfo> eventRowMapper() {
        return (rs, rowNum) -> {
            Timestamp end = rs.getTimestamp("end_date");
            return new EventInfo(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("organizer_id")),
                rs.getString("title"),
                rs.getTimestamp("start_date").toInstant(),
                end != null ? end.toInstant() : null
            );
        };
    }

    private RowMapper<TierInfo> tierRowMapper() {
        return (rs, rowNum) -> new TierInfo(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("event_id")),
            rs.getString("name"),
            rs.getBigDecimal("price"),
            rs.getInt("capacity"),
            rs.getBoolean("refund_enabled")
        );
    }
}
