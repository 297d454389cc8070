package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.IntegrationTestSupport;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.GatewayUnavailableException;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.gateway.GatewayTransaction;
import com.flagship.settlement_engine.gateway.TransactionStatus;
import com.flagship.settlement_engine.ledger.OrganizerBalance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class PaymentReconcilerTest extends IntegrationTestSupport {

    @Autowired
    private PaymentPersistenceService persistenceService;

    private UUID organizerId;
    private UUID eventId;
    private UUID tierId;

    @BeforeEach
    void setUp() {
        organizerId = UUID.randomUUID();
        eventId = createEventStartingSoon(organizerId);
        tierId = createTier(eventId, "25000.00", 100, true);
    }

    private int ticketsFor(Payment payment) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tickets WHERE payment_id = ?", Integer.class, payment.getId());
    }

    private int salesFor(Payment payment) {
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE related_payment_id = ? AND entry_type = 'TICKET_SALE'",
            Integer.class, payment.getId());
    }

    @Nested
    @DisplayName("Successful payments")
    class SuccessfulPayments {

        @Test
        @DisplayName("Verified payment issues one ticket and credits the net amount to pending")
        void verifiedPaymentCreditsPending() {
            Payment payment = checkout(eventId, tierId, UUID.randomUUID());
            gatewayReportsPaid(payment, new BigDecimal("25000"));

            VerificationResult result = reconciler.verify(payment.getReference());

            assertEquals(VerificationResult.Outcome.VERIFIED, result.getOutcome());
            assertEquals(PaymentStatus.SUCCESS, persistenceService.getByReference(payment.getReference()).getStatus());
            assertEquals(1, ticketsFor(payment));

            OrganizerBalance balance = balanceOf(organizerId);
            assertAmount("23750.00", balance.getPending());
            assertAmount("0", balance.getAvailable());
        }

        @Test
        @DisplayName("Verifying again returns the same ticket without a second ledger entry")
        void repeatedVerificationIsIdempotent() {
            Payment payment = checkout(eventId, tierId, UUID.randomUUID());
            gatewayReportsPaid(payment, new BigDecimal("25000"));

            VerificationResult first = reconciler.verify(payment.getReference());
            VerificationResult second = reconciler.verify(payment.getReference());

            assertEquals(VerificationResult.Outcome.ALREADY_VERIFIED, second.getOutcome());
            assertEquals(first.getTicket().getId(), second.getTicket().getId());
            assertEquals(1, salesFor(payment));
            assertAmount("23750.00", balanceOf(organizerId).getPending());
        }

        @Test
        @DisplayName("Concurrent verifications of one reference settle it exactly once")
        void concurrentVerificationSettlesOnce() throws Exception {
            Payment payment = checkout(eventId, tierId, UUID.randomUUID());
            gatewayReportsPaid(payment, new BigDecimal("25000"));

            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<VerificationResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return reconciler.verify(payment.getReference());
                }));
            }
            start.countDown();

            int verified = 0;
            for (Future<VerificationResult> future : futures) {
                VerificationResult result = future.get(30, TimeUnit.SECONDS);
                assertTrue(result.isSuccessful());
                if (result.getOutcome() == VerificationResult.Outcome.VERIFIED) {
                    verified++;
                }
            }
            executor.shutdown();

            assertEquals(1, verified);
            assertEquals(1, ticketsFor(payment));
            assertEquals(1, salesFor(payment));
        }
    }

    @Nested
    @DisplayName("Payments that do not settle")
    class UnsettledPayments {

        @Test
        @DisplayName("Amount mismatch fails the payment for review and writes nothing to the ledger")
        void amountMismatchIsFlagged() {
            Payment payment = checkout(eventId, tierId, UUID.randomUUID());
            gatewayReportsPaid(payment, new BigDecimal("20000"));

            SettlementException e = assertThrows(SettlementException.class,
                () -> reconciler.verify(payment.getReference()));

            assertEquals(ErrorCode.PAYMENT_AMOUNT_MISMATCH, e.getErrorCode());
            assertEquals("25000.00", e.getDetails().get("expected"));
            Payment stored = persistenceService.getByReference(payment.getReference());
            assertEquals(PaymentStatus.FAILED, stored.getStatus());
            assertTrue(stored.isRequiresReview());
            assertEquals(0, ticketsFor(payment));
            assertEquals(0, salesFor(payment));
        }

        @Test
        @DisplayName("Unreachable gateway leaves the payment pending")
        void gatewayUnavailableLeavesPending() {
            Payment payment = checkout(eventId, tierId, UUID.randomUUID());
            when(gateway.verifyTransaction(payment.getReference()))
                .thenThrow(new GatewayUnavailableException("connect timed out"));

            VerificationResult result = reconciler.verify(payment.getReference());

            assertEquals(VerificationResult.Outcome.STILL_PENDING, result.getOutcome());
            assertEquals(PaymentStatus.PENDING, persistenceService.getByReference(payment.getReference()).getStatus());
        }

        @Test
        @DisplayName("Gateway failure status fails the payment")
        void gatewayFailureFailsPayment() {
            Payment payment = checkout(eventId, tierId, UUID.randomUUID());
            when(gateway.verifyTransaction(payment.getReference())).thenReturn(new GatewayTransaction(
                payment.getReference(), null, TransactionStatus.FAILED, "EXPIRED", null, null));

            VerificationResult result = reconciler.verify(payment.getReference());

            assertEquals(VerificationResult.Outcome.FAILED, result.getOutcome());
            assertEquals(PaymentStatus.FAILED, persistenceService.getByReference(payment.getReference()).getStatus());
            assertEquals(0, salesFor(payment));
        }

        @Test
        @DisplayName("Unknown reference is NOT_FOUND")
        void unknownReference() {
            SettlementException e = assertThrows(SettlementException.class,
                () -> reconciler.verify("HD-0-NOSUCH"));
            assertEquals(ErrorCode.PAYMENT_NOT_FOUND, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("Checkout")
    class Checkout {

        @Test
        @DisplayName("Replaying an idempotency key returns the original payment")
        void idempotencyKeyReplay() {
            UUID buyerId = UUID.randomUUID();
            String key = "idem-" + UUID.randomUUID();

            CheckoutService.CheckoutResult first = checkoutService.initiateCheckout(eventId, tierId, buyerId, "a@example.com", key);
            CheckoutService.CheckoutResult second = checkoutService.initiateCheckout(eventId, tierId, buyerId, "a@example.com", key);

            assertFalse(first.replayed());
            assertTrue(second.replayed());
            assertEquals(first.payment().getReference(), second.payment().getReference());
        }

        @Test
        @DisplayName("A sold-out tier rejects checkout")
        void soldOutTier() {
            UUID smallTier = createTier(eventId, "5000.00", 1, false);
            purchaseTicket(eventId, smallTier, UUID.randomUUID());

            SettlementException e = assertThrows(SettlementException.class,
                () -> checkout(eventId, smallTier, UUID.randomUUID()));
            assertEquals(ErrorCode.TIER_SOLD_OUT, e.getErrorCode());
        }

        @Test
        @DisplayName("Checkout creates a pending payment for the tier price")
        void checkoutCreatesPendingPayment() {
            Payment payment = checkout(eventId, tierId, UUID.randomUUID());

            assertEquals(PaymentStatus.PENDING, payment.getStatus());
            assertAmount("25000.00", payment.getAmount());
            assertTrue(payment.getReference().startsWith("HD-"));
            assertEquals(organizerId, payment.getOrganizerId());
        }
    }

    @Nested
    @DisplayName("Batch verification")
    class BatchVerification {

        @Test
        @DisplayName("The sweep only picks up payments pending longer than the staleness threshold")
        void sweepSkipsFreshPayments() {
            Payment stale = checkout(eventId, tierId, UUID.randomUUID());
            Payment fresh = checkout(eventId, tierId, UUID.randomUUID());
            jdbcTemplate.update("UPDATE payments SET created_at = created_at - INTERVAL '10 minutes' WHERE id = ?", stale.getId());
            gatewayReportsPaid(stale, new BigDecimal("25000"));
            gatewayReportsPaid(fresh, new BigDecimal("25000"));

            BulkVerificationReport report = reconciler.sweepStalePayments();

            assertTrue(report.getVerified() >= 1);
            assertEquals(PaymentStatus.SUCCESS, persistenceService.getByReference(stale.getReference()).getStatus());
            assertEquals(PaymentStatus.PENDING, persistenceService.getByReference(fresh.getReference()).getStatus());
        }

        @Test
        @DisplayName("One broken verification does not stop the rest of the batch")
        void verifyAllToleratesFailures() {
            Payment broken = checkout(eventId, tierId, UUID.randomUUID());
            Payment paid = checkout(eventId, tierId, UUID.randomUUID());
            when(gateway.verifyTransaction(broken.getReference())).thenThrow(new IllegalStateException("unexpected payload"));
            gatewayReportsPaid(paid, new BigDecimal("25000"));

            BulkVerificationReport report = reconciler.verifyAll();

            assertTrue(report.getFailed() >= 1);
            assertTrue(report.getVerified() >= 1);
            assertEquals(PaymentStatus.PENDING, persistenceService.getByReference(broken.getReference()).getStatus());
            assertEquals(PaymentStatus.SUCCESS, persistenceService.getByReference(paid.getReference()).getStatus());
        }
    }
}
