package com.flagship.settlement_engine.ticket;

import com.flagship.settlement_engine.catalog.CatalogRepository;
import com.flagship.settlement_engine.catalog.EventInfo;
import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.ticket.event.TicketCheckedInEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Admits a ticket at the door.
 *
 * The ACTIVE to CHECKED_IN move is one conditional UPDATE. Of any number of
 * concurrent scans of the same ticket exactly one updates a row; the others read
 * the winner's state back and get a specific error for it.
 *
 * Authorization comes either from the caller (the event's organizer or an admin)
 * or from an agent code scoped to the event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckInService {

    private final TicketRepository ticketRepository;
    private final AgentCodeRepository agentCodeRepository;
    private final AgentCodeService agentCodeService;
    private final CatalogRepository catalogRepository;
    private final OutboxService outboxService;
    private final SettlementProperties properties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * @param ticketRef ticket number or ticket id, as read from the QR code
     * @param actor     the signed-in caller; may be null when an agent code is given
     * @param agentCode code presented by door staff, or null
     */
    @Transactional
    public Ticket checkIn(String ticketRef, UUID eventId, Actor actor, String agentCode) {
        long start = System.currentTimeMillis();
        try {
            Ticket ticket = doCheckIn(ticketRef, eventId, actor, agentCode);
            metrics.recordCheckIn("checked_in");
            return ticket;
        } catch (SettlementException e) {
            metrics.recordCheckIn(e.getErrorCode().name().toLowerCase(Locale.ROOT));
            throw e;
        } finally {
            metrics.recordLatency("check_in", System.currentTimeMillis() - start);
        }
    }

    private Ticket doCheckIn(String ticketRef, UUID eventId, Actor actor, String agentCode) {
        EventInfo event = catalogRepository.getEvent(eventId);

        AgentCode code = null;
        String checkedInBy;
        if (agentCode != null && !agentCode.isBlank()) {
            code = agentCodeService.findActive(agentCode);
            if (!code.getEventId().equals(eventId)) {
                throw new SettlementException(ErrorCode.AGENT_CODE_EVENT_MISMATCH);
            }
            checkedInBy = "agent:" + code.displayName();
        } else {
            if (actor == null) {
                throw new SettlementException(ErrorCode.FORBIDDEN, "Check-in requires a signed-in organizer or an agent code");
            }
            actor.requireActsFor(event.getOrganizerId());
            checkedInBy = actor.role().name().toLowerCase(Locale.ROOT) + ":" + actor.id();
        }

        Instant now = clock.instant();
        requireWindowOpen(event, now);

        Ticket ticket = resolve(ticketRef)
            .orElseThrow(() -> new SettlementException(ErrorCode.TICKET_NOT_FOUND, "Ticket not found: " + ticketRef));

        try (MDC.MDCCloseable ignored = CorrelationContext.put(CorrelationContext.TICKET_ID_MDC_KEY, ticket.getId())) {
            if (!ticket.getEventId().equals(eventId)) {
                throw new SettlementException(ErrorCode.TICKET_EVENT_MISMATCH,
                    "Ticket " + ticket.getTicketNumber() + " is for a different event");
            }

            if (ticketRepository.markCheckedIn(ticket.getId(), now, checkedInBy) == 0) {
                Ticket current = ticketRepository.findById(ticket.getId()).map(TicketEntity::toDomain).orElse(ticket);
                log.info("Check-in rejected: ticketNumber={}, status={}", current.getTicketNumber(), current.getStatus());
                throw rejectionFor(current);
            }

            if (code != null && agentCodeRepository.recordCheckIn(code.getId(), now) == 0) {
                // Deactivated between the read and the update; undo the ticket change with the transaction.
                throw new SettlementException(ErrorCode.AGENT_CODE_INACTIVE);
            }

            Ticket checkedIn = ticketRepository.findById(ticket.getId())
                .map(TicketEntity::toDomain)
                .orElseThrow(() -> new IllegalStateException("Ticket vanished after check-in: " + ticket.getId()));
            outboxService.saveEvent(TicketCheckedInEvent.of(checkedIn, code != null));

            log.info("Ticket checked in: ticketNumber={}, by={}", checkedIn.getTicketNumber(), checkedInBy);
            return checkedIn;
        }
    }

    /**
     * The specific error for a ticket that could not be checked in.
     */
    static SettlementException rejectionFor(Ticket ticket) {
        return switch (ticket.getStatus()) {
            case CHECKED_IN -> new SettlementException(ErrorCode.TICKET_ALREADY_CHECKED_IN,
                "Ticket " + ticket.getTicketNumber() + " was already checked in",
                Map.of("checkedInAt", String.valueOf(ticket.getCheckedInAt()),
                       "checkedInBy", String.valueOf(ticket.getCheckedInBy())));
            case REFUNDED -> new SettlementException(ErrorCode.TICKET_REFUNDED);
            case CANCELLED -> new SettlementException(ErrorCode.TICKET_CANCELLED);
            case ACTIVE -> new SettlementException(ErrorCode.TICKET_NOT_ACTIVE,
                "Ticket " + ticket.getTicketNumber() + " changed state during check-in; retry");
        };
    }

    private void requireWindowOpen(EventInfo event, Instant now) {
        Instant opens = event.getStartDate().minus(properties.getCheckIn().getOpensBeforeStart());
        Instant closes = event.effectiveEnd().plus(properties.getCheckIn().getClosesAfterEnd());
        if (now.isBefore(opens)) {
            throw new SettlementException(ErrorCode.CHECK_IN_NOT_OPEN,
                "Check-in opens at " + opens, Map.of("opensAt", opens.toString()));
        }
        if (now.isAfter(closes)) {
            throw new SettlementException(ErrorCode.CHECK_IN_CLOSED,
                "Check-in closed at " + closes, Map.of("closedAt", closes.toString()));
        }
    }

    private Optional<Ticket> resolve(String ticketRef) {
        if (ticketRef == null || ticketRef.isBlank()) {
            return Optional.empty();
        }
        String trimmed = ticketRef.trim();
        try {
            return ticketRepository.findById(UUID.fromString(trimmed)).map(TicketEntity::toDomain);
        } catch (IllegalArgumentException notAnId) {
            return ticketRepository.findByTicketNumber(trimmed.toUpperCase(Locale.ROOT)).map(TicketEntity::toDomain);
        }
    }
}
