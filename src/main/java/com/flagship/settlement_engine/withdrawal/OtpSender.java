package com.flagship.settlement_engine.withdrawal;

import java.time.Instant;
import java.util.UUID;

/**
 * Delivers withdrawal OTPs to the organizer. Delivery (email, SMS) lives outside this service.
 */
public interface OtpSender {

    void send(UUID organizerId, UUID withdrawalId, String otp, Instant expiresAt);
}
