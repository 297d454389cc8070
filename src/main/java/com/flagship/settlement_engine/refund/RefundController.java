package com.flagship.settlement_engine.refund;

import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.refund.dto.RefundRequestBody;
import com.flagship.settlement_engine.refund.dto.RefundResponse;
import com.flagship.settlement_engine.refund.dto.RejectRefundRequest;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/refunds")
@RequiredArgsConstructor
@Slf4j
public class RefundController {

    private final RefundService refundService;

    @PostMapping
    public ResponseEntity<RefundResponse> requestRefund(
            @Valid @RequestBody RefundRequestBody request,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        RefundRequest refund = refundService.request(request.getTicketId(), request.getReason(), Actor.of(actorId, actorRole));
        return ResponseEntity.status(HttpStatus.CREATED).body(RefundResponse.from(refund));
    }

    @GetMapping
    public ResponseEntity<List<RefundResponse>> listRefunds(
            @RequestParam(value = "status", defaultValue = "PENDING") RefundStatus status,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        List<RefundResponse> refunds = refundService.listByStatus(status, Actor.of(actorId, actorRole)).stream()
            .map(RefundResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(refunds);
    }

    @GetMapping("/{refundId}")
    public ResponseEntity<RefundResponse> getRefund(
            @PathVariable("refundId") UUID refundId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        return ResponseEntity.ok(RefundResponse.from(refundService.get(refundId, Actor.of(actorId, actorRole))));
    }

    @PostMapping("/{refundId}/approve")
    public ResponseEntity<RefundResponse> approve(
            @PathVariable("refundId") UUID refundId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        return ResponseEntity.ok(RefundResponse.from(refundService.approve(refundId, Actor.of(actorId, actorRole))));
    }

    @PostMapping("/{refundId}/reject")
    public ResponseEntity<RefundResponse> reject(
            @PathVariable("refundId") UUID refundId,
            @Valid @RequestBody RejectRefundRequest request,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        RefundRequest refund = refundService.reject(refundId, request.getNote(), Actor.of(actorId, actorRole));
        return ResponseEntity.ok(RefundResponse.from(refund));
    }

    /**
     * Admin only. A gateway failure leaves the request APPROVED; call again to retry.
     */
    @PostMapping("/{refundId}/process")
    public ResponseEntity<RefundResponse> process(
            @PathVariable("refundId") UUID refundId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        log.info("Refund processing requested: refundId={}", refundId);
        return ResponseEntity.ok(RefundResponse.from(refundService.process(refundId, Actor.of(actorId, actorRole))));
    }
}
