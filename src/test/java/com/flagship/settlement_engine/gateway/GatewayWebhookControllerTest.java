package com.flagship.settlement_engine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.settlement_engine.IntegrationTestSupport;
import com.flagship.settlement_engine.payment.Payment;
import com.flagship.settlement_engine.payment.PaymentPersistenceService;
import com.flagship.settlement_engine.payment.PaymentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class GatewayWebhookControllerTest extends IntegrationTestSupport {

    private static final String SECRET = "test-webhook-secret";
    private static final String PAID_ON = "2026-10-18 10:15:00.000";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PaymentPersistenceService persistenceService;

    private Payment payment;

    @BeforeEach
    void setUp() {
        UUID eventId = createEvent(UUID.randomUUID(), Instant.now().plus(Duration.ofDays(2)));
        payment = checkout(eventId, createTier(eventId, "25000.00", 10, false), UUID.randomUUID());
    }

    private ObjectNode transactionWebhook(String hash) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("paymentReference", payment.getReference());
        data.put("transactionReference", "MNFY|" + payment.getReference());
        data.put("amountPaid", new BigDecimal("25000.00"));
        data.put("paidOn", PAID_ON);
        data.put("transactionHash", hash);
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("eventType", "SUCCESSFUL_TRANSACTION");
        body.set("eventData", data);
        return body;
    }

    private void deliver(ObjectNode body) throws Exception {
        mockMvc.perform(post("/api/webhooks/gateway")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isOk())
            .andExpect(content().string("OK"));
    }

    @Test
    @DisplayName("Signed webhook triggers verification against the gateway")
    void signedWebhookVerifies() throws Exception {
        gatewayReportsPaid(payment, new BigDecimal("25000.00"));
        String hash = WebhookSignatureVerifier.sign(SECRET, payment.getReference(), "25000", PAID_ON,
            "MNFY|" + payment.getReference());

        deliver(transactionWebhook(hash));

        assertEquals(PaymentStatus.SUCCESS, persistenceService.getByReference(payment.getReference()).getStatus());
    }

    @Test
    @DisplayName("Forged webhook is acknowledged but ignored")
    void forgedWebhookIgnored() throws Exception {
        deliver(transactionWebhook("0".repeat(128)));

        assertEquals(PaymentStatus.PENDING, persistenceService.getByReference(payment.getReference()).getStatus());
        verify(gateway, never()).verifyTransaction(anyString());
    }

    @Test
    @DisplayName("Malformed and unknown webhooks still get a 200")
    void malformedWebhook() throws Exception {
        deliver(JsonNodeFactory.instance.objectNode().put("eventType", "SUCCESSFUL_TRANSACTION"));
        deliver(JsonNodeFactory.instance.objectNode().put("eventType", "MANDATE_UPDATE").set("eventData",
            JsonNodeFactory.instance.objectNode()));

        verify(gateway, never()).verifyTransaction(anyString());
    }

    @Test
    @DisplayName("Amounts are signed without trailing zeros")
    void amountText() {
        assertEquals("25000", GatewayWebhookController.amountText(JsonNodeFactory.instance.numberNode(new BigDecimal("25000.00"))));
        assertEquals("25000.5", GatewayWebhookController.amountText(JsonNodeFactory.instance.numberNode(new BigDecimal("25000.50"))));
        assertEquals("25000.00", GatewayWebhookController.amountText(JsonNodeFactory.instance.textNode("25000.00")));
    }
}
