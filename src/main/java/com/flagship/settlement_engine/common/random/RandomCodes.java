package com.flagship.settlement_engine.common.random;

import java.security.SecureRandom;

/**
 * Human-facing random codes. The alphabet leaves out 0, O, 1 and I so codes
 * survive being read aloud or typed from a printed ticket.
 */
public final class RandomCodes {

    public static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomCodes() {
    }

    public static String alphanumeric(int length) {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    public static String digits(int length) {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(RANDOM.nextInt(10));
        }
        return code.toString();
    }
}
