package com.flagship.settlement_engine.ticket;

import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.ticket.dto.CheckInRequest;
import com.flagship.settlement_engine.ticket.dto.TicketResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Door scanning. Actor headers are optional because agent-code scanners have no account.
 */
@RestController
@RequiredArgsConstructor
public class CheckInController {

    private final CheckInService checkInService;

    @PostMapping("/api/events/{eventId}/check-in")
    public ResponseEntity<TicketResponse> checkIn(
            @PathVariable("eventId") UUID eventId,
            @Valid @RequestBody CheckInRequest request,
            @RequestHeader(name = Actor.ID_HEADER, required = false) UUID actorId,
            @RequestHeader(name = Actor.ROLE_HEADER, required = false) String actorRole) {
        Actor actor = actorId != null ? Actor.of(actorId, actorRole) : null;
        Ticket ticket = checkInService.checkIn(request.getTicket(), eventId, actor, request.getAgentCode());
        return ResponseEntity.ok(TicketResponse.from(ticket));
    }
}
