package com.flagship.settlement_engine.gateway;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTest {

    private static final String REFERENCE = "HD-1760781600000-K3P9QZ";
    private static final String AMOUNT = "25000";
    private static final String PAID_ON = "2026-10-18 10:15:00.000";
    private static final String TRANSACTION = "MNFY|20261018101500|000123";

    private GatewayProperties properties;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.setSecretKey("webhook-secret");
        verifier = new WebhookSignatureVerifier(properties);
    }

    private String signed() {
        return WebhookSignatureVerifier.sign("webhook-secret", REFERENCE, AMOUNT, PAID_ON, TRANSACTION);
    }

    @Test
    @DisplayName("Hash computed with the shared secret is accepted, in either case")
    void validHash() {
        assertTrue(verifier.isValid(REFERENCE, AMOUNT, PAID_ON, TRANSACTION, signed()));
        assertTrue(verifier.isValid(REFERENCE, AMOUNT, PAID_ON, TRANSACTION, signed().toUpperCase()));
    }

    @Test
    @DisplayName("Any changed field invalidates the hash")
    void tamperedPayload() {
        String hash = signed();

        assertFalse(verifier.isValid(REFERENCE, "2500", PAID_ON, TRANSACTION, hash));
        assertFalse(verifier.isValid("HD-other", AMOUNT, PAID_ON, TRANSACTION, hash));
        assertFalse(verifier.isValid(REFERENCE, AMOUNT, PAID_ON, TRANSACTION,
            WebhookSignatureVerifier.sign("wrong-secret", REFERENCE, AMOUNT, PAID_ON, TRANSACTION)));
    }

    @Test
    @DisplayName("Missing hash or missing secret rejects the webhook")
    void failsClosed() {
        assertFalse(verifier.isValid(REFERENCE, AMOUNT, PAID_ON, TRANSACTION, null));
        assertFalse(verifier.isValid(REFERENCE, AMOUNT, PAID_ON, TRANSACTION, " "));

        properties.setSecretKey("");
        assertFalse(verifier.isValid(REFERENCE, AMOUNT, PAID_ON, TRANSACTION, signed()));
    }

    @Test
    @DisplayName("Hash is hex SHA-512")
    void format() {
        assertTrue(signed().matches("[0-9a-f]{128}"));
    }
}
