package com.flagship.settlement_engine.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentTest {

    private final Instant now = Instant.parse("2026-10-18T10:00:00Z");

    private Payment pending() {
        return Payment.create(UUID.randomUUID(), "HD-1-ABCDEF", new BigDecimal("25000.00"), UUID.randomUUID(),
            UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), "buyer@example.com", now);
    }

    @Test
    @DisplayName("New payments are PENDING and need a positive amount")
    void create() {
        assertEquals(PaymentStatus.PENDING, pending().getStatus());
        assertThrows(IllegalArgumentException.class, () -> Payment.create(UUID.randomUUID(), "HD-2", BigDecimal.ZERO,
            UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), null, now));
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("PENDING to SUCCESS records the gateway reference and payment time")
        void succeed() {
            Instant paidAt = now.plusSeconds(30);
            Payment paid = pending().succeed("MNFY|123", paidAt);

            assertEquals(PaymentStatus.SUCCESS, paid.getStatus());
            assertEquals("MNFY|123", paid.getGatewayTransactionRef());
            assertEquals(paidAt, paid.getPaidAt());
        }

        @Test
        @DisplayName("SUCCESS is reached at most once")
        void succeedTwice() {
            Payment paid = pending().succeed("MNFY|123", now);

            assertThrows(IllegalStateException.class, () -> paid.succeed("MNFY|456", now));
            assertThrows(IllegalStateException.class, () -> paid.fail("late failure", false, now));
        }

        @Test
        @DisplayName("Failed payments keep the reason and review flag and are terminal")
        void fail() {
            Payment failed = pending().fail("Amount mismatch", true, now);

            assertEquals(PaymentStatus.FAILED, failed.getStatus());
            assertTrue(failed.isRequiresReview());
            assertTrue(failed.isTerminal());
            assertThrows(IllegalStateException.class, () -> failed.succeed("MNFY|1", now));
            assertThrows(IllegalStateException.class, () -> failed.refund(now));
        }

        @Test
        @DisplayName("Only successful payments can be refunded")
        void refund() {
            assertThrows(IllegalStateException.class, () -> pending().refund(now));

            Payment refunded = pending().succeed("MNFY|1", now).refund(now);
            assertEquals(PaymentStatus.REFUNDED, refunded.getStatus());
            assertTrue(refunded.isTerminal());
        }

        @Test
        @DisplayName("Allowed transitions match the lifecycle")
        void canTransitionTo() {
            Payment payment = pending();
            assertTrue(payment.canTransitionTo(PaymentStatus.SUCCESS));
            assertTrue(payment.canTransitionTo(PaymentStatus.FAILED));
            assertFalse(payment.canTransitionTo(PaymentStatus.REFUNDED));
            assertTrue(payment.succeed("MNFY|1", now).canTransitionTo(PaymentStatus.REFUNDED));
        }
    }
}
