package com.flagship.settlement_engine.withdrawal;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;

/**
 * Default sender used until a delivery channel is wired in. Logs that a code was
 * issued, never the code itself.
 */
@Slf4j
public class LoggingOtpSender implements OtpSender {

    @Override
    public void send(UUID organizerId, UUID withdrawalId, String otp, Instant expiresAt) {
        log.info("Withdrawal OTP issued: organizerId={}, withdrawalId={}, expiresAt={}",
            organizerId, withdrawalId, expiresAt);
    }
}
