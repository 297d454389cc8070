package com.flagship.settlement_engine.ticket.event;

import com.flagship.settlement_engine.outbox.SettlementEvent;
import com.flagship.settlement_engine.ticket.Ticket;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TicketCheckedInEvent implements SettlementEvent {
    UUID eventId;
    UUID ticketId;
    String ticketNumber;
    UUID ticketedEventId;
    UUID tierId;
    String checkedInBy;
    boolean viaAgentCode;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TicketCheckedIn";
    public static final String AGGREGATE_TYPE = "Ticket";

    @Override
    public UUID getAggregateId() {
        return ticketId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    public static TicketCheckedInEvent of(Ticket ticket, boolean viaAgentCode) {
        return new TicketCheckedInEvent(
            UUID.randomUUID(),
            ticket.getId(),
            ticket.getTicketNumber(),
            ticket.getEventId(),
            ticket.getTierId(),
            ticket.getCheckedInBy(),
            viaAgentCode,
            ticket.getCheckedInAt()
        );
    }
}
