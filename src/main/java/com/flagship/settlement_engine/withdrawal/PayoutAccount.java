package com.flagship.settlement_engine.withdrawal;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Where an organizer's withdrawals are paid. The account name comes from the
 * gateway's lookup, not from the organizer.
 */
@Value
public class PayoutAccount {
    UUID organizerId;
    String bankCode;
    String accountNumber;
    String accountName;
    Instant verifiedAt;
}
