package com.flagship.settlement_engine.ticket;

import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.ticket.dto.ActivateAgentCodeRequest;
import com.flagship.settlement_engine.ticket.dto.AgentCodeRequest;
import com.flagship.settlement_engine.ticket.dto.AgentCodeResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class AgentCodeController {

    private final AgentCodeService agentCodeService;

    @PostMapping("/api/events/{eventId}/agent-codes")
    public ResponseEntity<AgentCodeResponse> create(
            @PathVariable("eventId") UUID eventId,
            @Valid @RequestBody AgentCodeRequest request,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        AgentCode created = agentCodeService.create(eventId, request.getLabel(), Actor.of(actorId, actorRole));
        return ResponseEntity.status(HttpStatus.CREATED).body(AgentCodeResponse.from(created));
    }

    @GetMapping("/api/events/{eventId}/agent-codes")
    public ResponseEntity<List<AgentCodeResponse>> list(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        List<AgentCodeResponse> codes = agentCodeService.list(eventId, Actor.of(actorId, actorRole)).stream()
            .map(AgentCodeResponse::from)
            .toList();
        return ResponseEntity.ok(codes);
    }

    @PostMapping("/api/agent-codes/{id}/deactivate")
    public ResponseEntity<AgentCodeResponse> deactivate(
            @PathVariable("id") UUID id,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        return ResponseEntity.ok(AgentCodeResponse.from(agentCodeService.deactivate(id, Actor.of(actorId, actorRole))));
    }

    @PostMapping("/api/agent-codes/{id}/reactivate")
    public ResponseEntity<AgentCodeResponse> reactivate(
            @PathVariable("id") UUID id,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        return ResponseEntity.ok(AgentCodeResponse.from(agentCodeService.reactivate(id, Actor.of(actorId, actorRole))));
    }

    @DeleteMapping("/api/agent-codes/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable("id") UUID id,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        agentCodeService.delete(id, Actor.of(actorId, actorRole));
        return ResponseEntity.noContent().build();
    }

    /**
     * Called by the scanner app when staff type in their code. No account needed.
     */
    @PostMapping("/api/agent-codes/activate")
    public ResponseEntity<AgentCodeResponse> activate(@Valid @RequestBody ActivateAgentCodeRequest request) {
        return ResponseEntity.ok(AgentCodeResponse.from(agentCodeService.activate(request.getCode())));
    }
}
