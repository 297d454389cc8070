package com.flagship.settlement_engine.withdrawal;

import com.flagship.settlement_engine.common.random.RandomCodes;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Six-digit withdrawal OTPs. Only {@code SHA-256(withdrawalId:otp)} is stored, so
 * the same code hashes differently for every withdrawal.
 */
final class OtpCodes {

    static final int LENGTH = 6;

    private OtpCodes() {
    }

    static String generate() {
        return RandomCodes.digits(LENGTH);
    }

    static String hash(UUID withdrawalId, String otp) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest((withdrawalId + ":" + otp).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static boolean matches(String storedHash, UUID withdrawalId, String otp) {
        if (storedHash == null || otp == null) {
            return false;
        }
        return MessageDigest.isEqual(
            storedHash.getBytes(StandardCharsets.US_ASCII),
            hash(withdrawalId, otp.trim()).getBytes(StandardCharsets.US_ASCII));
    }
}
