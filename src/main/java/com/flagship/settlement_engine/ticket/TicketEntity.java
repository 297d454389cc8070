package com.flagship.settlement_engine.ticket;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@link Ticket}. Status changes go through the conditional
 * updates on {@link TicketRepository}, never through this entity.
 */
@Entity
@Table(name = "tickets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TicketEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "ticket_number", nullable = false, unique = true, updatable = false, length = 32)
    private String ticketNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TicketStatus status;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "tier_id", nullable = false, updatable = false)
    private UUID tierId;

    @Column(name = "buyer_id", updatable = false)
    private UUID buyerId;

    @Column(name = "buyer_email", nullable = false, updatable = false)
    private String buyerEmail;

    @Column(name = "amount_paid", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amountPaid;

    @Column(name = "payment_id", nullable = false, unique = true, updatable = false)
    private UUID paymentId;

    @Column(name = "checked_in_at")
    private Instant checkedInAt;

    @Column(name = "checked_in_by", length = 100)
    private String checkedInBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static TicketEntity fromDomain(Ticket ticket) {
        return new TicketEntity(
            ticket.getId(),
            ticket.getTicketNumber(),
            ticket.getStatus(),
            ticket.getEventId(),
            ticket.getTierId(),
            ticket.getBuyerId(),
            ticket.getBuyerEmail(),
            ticket.getAmountPaid(),
            ticket.getPaymentId(),
            ticket.getCheckedInAt(),
            ticket.getCheckedInBy(),
            ticket.getCreatedAt(),
            ticket.getUpdatedAt()
        );
    }

    public Ticket toDomain() {
        return new Ticket(
            id,
            ticketNumber,
            status,
            eventId,
            tierId,
            buyerId,
            buyerEmail,
            amountPaid,
            paymentId,
            checkedInAt,
            checkedInBy,
            createdAt,
            updatedAt
        );
    }
}
