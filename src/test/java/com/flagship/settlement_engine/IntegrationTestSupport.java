package com.flagship.settlement_engine;

import com.flagship.settlement_engine.gateway.GatewayTransaction;
import com.flagship.settlement_engine.gateway.PaymentGateway;
import com.flagship.settlement_engine.gateway.TransactionStatus;
import com.flagship.settlement_engine.ledger.LedgerPosting;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.ledger.MaturationService;
import com.flagship.settlement_engine.ledger.OrganizerBalance;
import com.flagship.settlement_engine.payment.CheckoutService;
import com.flagship.settlement_engine.payment.Payment;
import com.flagship.settlement_engine.payment.PaymentReconciler;
import com.flagship.settlement_engine.payment.VerificationResult;
import com.flagship.settlement_engine.ticket.Ticket;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.when;

/**
 * Shared Spring context for the database-backed tests: one PostgreSQL 16
 * container for the whole run (started with the first context and reused by
 * every cached one), the test profile, and a mocked gateway.
 *
 * Tests never clean up. Every fixture uses fresh ids, and ledger rows cannot be
 * deleted anyway.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class IntegrationTestSupport {

    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        POSTGRES.start();
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @MockBean
    protected PaymentGateway gateway;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected TransactionTemplate transactionTemplate;

    @Autowired
    protected CheckoutService checkoutService;

    @Autowired
    protected PaymentReconciler reconciler;

    @Autowired
    protected LedgerService ledgerService;

    @Autowired
    protected MaturationService maturationService;

    protected UUID createEvent(UUID organizerId, Instant startDate) {
        UUID eventId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO events (id, organizer_id, title, start_date, end_date) VALUES (?, ?, ?, ?, ?)",
            eventId, organizerId, "Lagos Jazz Night", Timestamp.from(startDate),
            Timestamp.from(startDate.plus(Duration.ofHours(4))));
        return eventId;
    }

    /**
     * An event that opened for check-in an hour ago.
     */
    protected UUID createEventStartingSoon(UUID organizerId) {
        return createEvent(organizerId, Instant.now().plus(Duration.ofHours(4)));
    }

    protected UUID createTier(UUID eventId, String price, int capacity, boolean refundEnabled) {
        UUID tierId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ticket_tiers (id, event_id, name, price, capacity, refund_enabled) VALUES (?, ?, ?, ?, ?, ?)",
            tierId, eventId, "Regular", new BigDecimal(price), capacity, refundEnabled);
        return tierId;
    }

    protected Payment checkout(UUID eventId, UUID tierId, UUID buyerId) {
        return checkoutService.initiateCheckout(eventId, tierId, buyerId, "buyer@example.com",
            "idem-" + UUID.randomUUID()).payment();
    }

    protected void gatewayReportsPaid(Payment payment, BigDecimal amountPaid) {
        when(gateway.verifyTransaction(payment.getReference())).thenReturn(new GatewayTransaction(
            payment.getReference(), "MNFY|" + payment.getReference(), TransactionStatus.PAID, "PAID",
            amountPaid, "2026-10-18 10:15:00.000"));
    }

    /**
     * Checkout plus a successful verification: an ACTIVE ticket and its TICKET_SALE entry.
     */
    protected Ticket purchaseTicket(UUID eventId, UUID tierId, UUID buyerId) {
        Payment payment = checkout(eventId, tierId, buyerId);
        gatewayReportsPaid(payment, payment.getAmount());
        VerificationResult result = reconciler.verify(payment.getReference());
        assertEquals(VerificationResult.Outcome.VERIFIED, result.getOutcome());
        assertNotNull(result.getTicket());
        return result.getTicket();
    }

    /**
     * Credits the organizer's available balance directly through the ledger: a sale
     * and its maturation, with no payment or ticket behind them.
     */
    protected void fundAvailable(UUID organizerId, String amount) {
        BigDecimal value = new BigDecimal(amount);
        UUID paymentId = UUID.randomUUID();
        UUID ticketId = UUID.randomUUID();
        transactionTemplate.executeWithoutResult(status -> {
            ledgerService.lockBalance(organizerId);
            ledgerService.append(LedgerPosting.ticketSale(organizerId, paymentId, ticketId, value, "Seeded sale"));
            ledgerService.append(LedgerPosting.maturation(organizerId, paymentId, ticketId, value, "Seeded maturation"));
        });
    }

    protected OrganizerBalance balanceOf(UUID organizerId) {
        return ledgerService.balanceOf(organizerId);
    }

    protected static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            () -> "expected " + expected + " but was " + actual);
    }
}
