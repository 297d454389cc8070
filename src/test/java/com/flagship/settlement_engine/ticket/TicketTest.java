package com.flagship.settlement_engine.ticket;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TicketTest {

    private final Instant now = Instant.parse("2026-10-18T18:00:00Z");

    private Ticket issued() {
        return Ticket.issue(UUID.randomUUID(), "TKT-ABCDE12345", UUID.randomUUID(), UUID.randomUUID(),
            UUID.randomUUID(), "buyer@example.com", new BigDecimal("25000.00"), UUID.randomUUID(), now);
    }

    @Test
    @DisplayName("Issued tickets are ACTIVE")
    void issue() {
        assertTrue(issued().isActive());
    }

    @Test
    @DisplayName("Check-in records who and when")
    void checkIn() {
        Ticket checkedIn = issued().checkIn(now, "agent:Gate A");

        assertEquals(TicketStatus.CHECKED_IN, checkedIn.getStatus());
        assertEquals(now, checkedIn.getCheckedInAt());
        assertEquals("agent:Gate A", checkedIn.getCheckedInBy());
    }

    @Test
    @DisplayName("Only ACTIVE tickets leave their state")
    void terminalStates() {
        Ticket checkedIn = issued().checkIn(now, "organizer:x");
        Ticket refunded = issued().refund(now);
        Ticket cancelled = issued().cancel(now);

        assertThrows(IllegalStateException.class, () -> checkedIn.refund(now));
        assertThrows(IllegalStateException.class, () -> checkedIn.checkIn(now, "again"));
        assertThrows(IllegalStateException.class, () -> refunded.checkIn(now, "organizer:x"));
        assertThrows(IllegalStateException.class, () -> cancelled.refund(now));
    }

    @Test
    @DisplayName("Rejection reasons follow the ticket's state")
    void rejectionFor() {
        Ticket checkedIn = issued().checkIn(now, "organizer:x");

        assertEquals("TICKET_ALREADY_CHECKED_IN", CheckInService.rejectionFor(checkedIn).getErrorCode().name());
        assertEquals(now.toString(), CheckInService.rejectionFor(checkedIn).getDetails().get("checkedInAt"));
        assertEquals("TICKET_REFUNDED", CheckInService.rejectionFor(issued().refund(now)).getErrorCode().name());
        assertEquals("TICKET_CANCELLED", CheckInService.rejectionFor(issued().cancel(now)).getErrorCode().name());
    }
}
