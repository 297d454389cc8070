package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.ticket.Ticket;
import lombok.Value;

/**
 * Outcome of one verification call. "Still pending" is a normal result, not an error,
 * so webhooks, polls and sweeps can all call verify without special-casing it.
 */
@Value
public class VerificationResult {

    public enum Outcome {
        /** This call moved the payment to SUCCESS. */
        VERIFIED,
        /** An earlier call already did; the original ticket is returned. */
        ALREADY_VERIFIED,
        STILL_PENDING,
        FAILED,
        REFUNDED
    }

    Outcome outcome;
    Payment payment;
    Ticket ticket;
    String message;

    public static VerificationResult verified(Payment payment, Ticket ticket) {
        return new VerificationResult(Outcome.VERIFIED, payment, ticket, "Payment verified");
    }

    public static VerificationResult alreadyVerified(Payment payment, Ticket ticket) {
        return new VerificationResult(Outcome.ALREADY_VERIFIED, payment, ticket, "Payment already verified");
    }

    public static VerificationResult stillPending(Payment payment, String message) {
        return new VerificationResult(Outcome.STILL_PENDING, payment, null, message);
    }

    public static VerificationResult failed(Payment payment) {
        return new VerificationResult(Outcome.FAILED, payment, null,
            payment.getFailureReason() != null ? payment.getFailureReason() : "Payment failed");
    }

    public static VerificationResult refunded(Payment payment, Ticket ticket) {
        return new VerificationResult(Outcome.REFUNDED, payment, ticket, "Payment has been refunded");
    }

    public boolean isSuccessful() {
        return outcome == Outcome.VERIFIED || outcome == Outcome.ALREADY_VERIFIED;
    }
}
