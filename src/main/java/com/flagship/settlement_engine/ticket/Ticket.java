package com.flagship.settlement_engine.ticket;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One admission, issued for one successful payment.
 *
 * The transitions here are the rules; the repository applies them as
 * conditional updates so concurrent callers cannot both win.
 */
@Value
public class Ticket {
    UUID id;
    String ticketNumber;
    TicketStatus status;
    UUID eventId;
    UUID tierId;
    UUID buyerId;
    String buyerEmail;
    BigDecimal amountPaid;
    UUID paymentId;
    Instant checkedInAt;
    String checkedInBy;
    Instant createdAt;
    Instant updatedAt;

    public static Ticket issue(UUID id, String ticketNumber, UUID eventId, UUID tierId, UUID buyerId,
                               String buyerEmail, BigDecimal amountPaid, UUID paymentId, Instant now) {
        return new Ticket(id, ticketNumber, TicketStatus.ACTIVE, eventId, tierId, buyerId, buyerEmail,
            amountPaid, paymentId, null, null, now, now);
    }

    public Ticket checkIn(Instant at, String by) {
        requireActive(TicketStatus.CHECKED_IN);
        return new Ticket(id, ticketNumber, TicketStatus.CHECKED_IN, eventId, tierId, buyerId, buyerEmail,
            amountPaid, paymentId, at, by, createdAt, at);
    }

    public Ticket refund(Instant now) {
        requireActive(TicketStatus.REFUNDED);
        return new Ticket(id, ticketNumber, TicketStatus.REFUNDED, eventId, tierId, buyerId, buyerEmail,
            amountPaid, paymentId, checkedInAt, checkedInBy, createdAt, now);
    }

    public Ticket cancel(Instant now) {
        requireActive(TicketStatus.CANCELLED);
        return new Ticket(id, ticketNumber, TicketStatus.CANCELLED, eventId, tierId, buyerId, buyerEmail,
            amountPaid, paymentId, checkedInAt, checkedInBy, createdAt, now);
    }

    public boolean isActive() {
        return status == TicketStatus.ACTIVE;
    }

    private void requireActive(TicketStatus target) {
        if (status != TicketStatus.ACTIVE) {
            throw new IllegalStateException(String.format(
                "Cannot move ticket %s from %s to %s. Only ACTIVE tickets can.", ticketNumber, status, target));
        }
    }
}
