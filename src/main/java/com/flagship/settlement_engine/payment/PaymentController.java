package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.common.actor.ActorRole;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.payment.dto.CheckoutRequest;
import com.flagship.settlement_engine.payment.dto.PaymentResponse;
import com.flagship.settlement_engine.payment.dto.VerificationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Buyer-facing payment endpoints.
 *
 * Checkout requires an Idempotency-Key header and returns the original payment
 * (200 instead of 201) when the key is replayed.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CheckoutService checkoutService;
    private final PaymentReconciler reconciler;
    private final PaymentPersistenceService persistenceService;

    @PostMapping("/checkout")
    public ResponseEntity<PaymentResponse> checkout(
            @Valid @RequestBody CheckoutRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor actor = Actor.of(actorId, actorRole);
        log.info("Checkout requested: eventId={}, tierId={}, idempotencyKey={}",
            request.getEventId(), request.getTierId(), idempotencyKey);

        CheckoutService.CheckoutResult result = checkoutService.initiateCheckout(
            request.getEventId(), request.getTierId(), actor.id(), request.getBuyerEmail(), idempotencyKey);

        return ResponseEntity.status(result.replayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(PaymentResponse.from(result.payment()));
    }

    @GetMapping("/{reference}")
    public ResponseEntity<PaymentResponse> getPayment(
            @PathVariable("reference") String reference,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Payment payment = persistenceService.getByReference(reference);
        requireBuyerOrStaff(Actor.of(actorId, actorRole), payment);
        return ResponseEntity.ok(PaymentResponse.from(payment));
    }

    /**
     * Polled by the buyer after returning from the gateway. A still-pending payment is a 200, not an error.
     */
    @PostMapping("/{reference}/verify")
    public ResponseEntity<VerificationResponse> verify(
            @PathVariable("reference") String reference,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Payment payment = persistenceService.getByReference(reference);
        requireBuyerOrStaff(Actor.of(actorId, actorRole), payment);
        return ResponseEntity.ok(VerificationResponse.from(reconciler.verify(reference)));
    }

    private static void requireBuyerOrStaff(Actor actor, Payment payment) {
        boolean buyer = actor.role() == ActorRole.BUYER && actor.id().equals(payment.getBuyerId());
        if (!buyer && !actor.actsFor(payment.getOrganizerId())) {
            throw new SettlementException(ErrorCode.FORBIDDEN, "Payment " + payment.getReference() + " belongs to another buyer");
        }
    }
}
