package com.flagship.settlement_engine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.settlement_engine.payment.PaymentReconciler;
import com.flagship.settlement_engine.withdrawal.WithdrawalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Webhook receiver for the payment gateway.
 *
 * Always answers 200 so the gateway stops redelivering; failures are logged
 * and left to the sweep and reconciliation jobs. The payload only says which
 * reference to look at. Status and amount always come from a fresh gateway query.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class GatewayWebhookController {

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentReconciler reconciler;
    private final WithdrawalService withdrawalService;

    @PostMapping("/gateway")
    public ResponseEntity<String> handle(@RequestBody JsonNode body) {
        String eventType = body.path("eventType").asText("");
        JsonNode eventData = body.path("eventData");
        if (eventType.isEmpty() || eventData.isMissingNode()) {
            log.warn("Webhook without eventType or eventData ignored");
            return ResponseEntity.ok("OK");
        }
        log.info("Gateway webhook received: eventType={}", eventType);

        try {
            switch (eventType) {
                case "SUCCESSFUL_TRANSACTION", "FAILED_TRANSACTION" -> handleTransaction(eventData);
                case "SUCCESSFUL_DISBURSEMENT", "FAILED_DISBURSEMENT", "REVERSED_DISBURSEMENT" ->
                    withdrawalService.handleDisbursementWebhook(eventData.path("reference").asText());
                default -> log.info("Unhandled webhook event type: {}", eventType);
            }
        } catch (RuntimeException e) {
            log.error("Webhook processing failed for eventType={}", eventType, e);
        }
        return ResponseEntity.ok("OK");
    }

    private void handleTransaction(JsonNode eventData) {
        String paymentReference = eventData.path("paymentReference").asText();
        boolean valid = signatureVerifier.isValid(
            paymentReference,
            amountText(eventData.path("amountPaid")),
            eventData.path("paidOn").asText(),
            eventData.path("transactionReference").asText(),
            eventData.path("transactionHash").asText(null));
        if (!valid) {
            log.warn("Rejected webhook with invalid transaction hash for reference={}", paymentReference);
            return;
        }
        reconciler.verify(paymentReference);
    }

    /**
     * The gateway signs amounts the way JavaScript prints numbers: {@code 25000}, not {@code 25000.00}.
     */
    static String amountText(JsonNode amount) {
        if (amount.isNumber()) {
            return amount.decimalValue().stripTrailingZeros().toPlainString();
        }
        return amount.asText();
    }
}
