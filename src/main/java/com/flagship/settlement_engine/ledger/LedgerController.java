package com.flagship.settlement_engine.ledger;

import com.flagship.settlement_engine.common.actor.Actor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Read side of the ledger for organizers and admins.
 */
@RestController
@RequestMapping("/api/organizers/{organizerId}")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerService ledgerService;

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> balance(
            @PathVariable("organizerId") UUID organizerId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireActsFor(organizerId);
        return ResponseEntity.ok(BalanceResponse.from(ledgerService.balanceOf(organizerId)));
    }

    @GetMapping("/ledger")
    public ResponseEntity<LedgerPage> ledger(
            @PathVariable("organizerId") UUID organizerId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireActsFor(organizerId);
        return ResponseEntity.ok(ledgerService.entries(organizerId, page, size));
    }
}
