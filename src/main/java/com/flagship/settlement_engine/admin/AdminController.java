package com.flagship.settlement_engine.admin;

import com.flagship.settlement_engine.admin.dto.ChargebackRequest;
import com.flagship.settlement_engine.admin.dto.SalesSummaryResponse;
import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.consumer.SalesSummaryProjector;
import com.flagship.settlement_engine.ledger.BalanceResponse;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.ledger.ReplayReport;
import com.flagship.settlement_engine.payment.BulkVerificationReport;
import com.flagship.settlement_engine.payment.ChargebackService;
import com.flagship.settlement_engine.payment.PaymentPersistenceService;
import com.flagship.settlement_engine.payment.PaymentReconciler;
import com.flagship.settlement_engine.payment.dto.PaymentResponse;
import com.flagship.settlement_engine.payment.dto.VerificationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Operator endpoints for manual recovery and inspection. Admin role only.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final PaymentPersistenceService paymentPersistenceService;
    private final PaymentReconciler reconciler;
    private final ChargebackService chargebackService;
    private final LedgerService ledgerService;
    private final SalesSummaryProjector salesSummaryProjector;

    @GetMapping("/payments/pending")
    public ResponseEntity<List<PaymentResponse>> pendingPayments(
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireAdmin();
        List<PaymentResponse> pending = paymentPersistenceService.findPending().stream()
            .map(PaymentResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(pending);
    }

    @PostMapping("/payments/verify-all")
    public ResponseEntity<BulkVerificationReport> verifyAll(
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireAdmin();
        log.info("Bulk verification requested by admin {}", actorId);
        return ResponseEntity.ok(reconciler.verifyAll());
    }

    @PostMapping("/payments/{reference}/verify")
    public ResponseEntity<VerificationResponse> verify(
            @PathVariable("reference") String reference,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireAdmin();
        return ResponseEntity.ok(VerificationResponse.from(reconciler.verify(reference)));
    }

    @GetMapping("/organizers/{organizerId}/ledger/verify")
    public ResponseEntity<ReplayReport> verifyLedger(
            @PathVariable("organizerId") UUID organizerId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireAdmin();
        return ResponseEntity.ok(ledgerService.verifyReplay(organizerId));
    }

    /**
     * Rewrites the cached balance from a full replay of the organizer's ledger.
     */
    @PostMapping("/organizers/{organizerId}/ledger/rebuild")
    public ResponseEntity<BalanceResponse> rebuildBalance(
            @PathVariable("organizerId") UUID organizerId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireAdmin();
        log.warn("Balance rebuild requested for organizerId={} by admin {}", organizerId, actorId);
        return ResponseEntity.ok(BalanceResponse.from(ledgerService.rebuildBalance(organizerId)));
    }

    @PostMapping("/tickets/{ticketId}/chargeback")
    public ResponseEntity<LedgerEntry> chargeback(
            @PathVariable("ticketId") UUID ticketId,
            @Valid @RequestBody ChargebackRequest request,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireAdmin();
        return ResponseEntity.ok(chargebackService.recordChargeback(ticketId, request.getReason()));
    }

    @GetMapping("/events/{eventId}/sales-summary")
    public ResponseEntity<SalesSummaryResponse> salesSummary(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireAdmin();
        return ResponseEntity.ok(salesSummaryProjector.find(eventId)
            .map(SalesSummaryResponse::from)
            .orElseGet(() -> SalesSummaryResponse.empty(eventId)));
    }
}
