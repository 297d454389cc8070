package com.flagship.settlement_engine.gateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the transaction hash the gateway attaches to payment webhooks:
 * SHA-512 over {@code secret|paymentReference|amountPaid|paidOn|transactionReference}, hex encoded.
 *
 * Fails closed: without a configured secret every webhook is rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private final GatewayProperties properties;

    public boolean isValid(String paymentReference, String amountPaid, String paidOn,
                           String transactionReference, String transactionHash) {
        String secret = properties.getSecretKey();
        if (secret == null || secret.isBlank()) {
            log.error("Webhook secret is not configured; rejecting webhook for reference={}", paymentReference);
            return false;
        }
        if (transactionHash == null || transactionHash.isBlank()) {
            log.warn("Webhook without transaction hash for reference={}", paymentReference);
            return false;
        }

        String expected = sign(secret, paymentReference, amountPaid, paidOn, transactionReference);
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            transactionHash.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }

    static String sign(String secret, String paymentReference, String amountPaid,
                       String paidOn, String transactionReference) {
        String material = String.join("|", secret, paymentReference, amountPaid, paidOn, transactionReference);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }
}
