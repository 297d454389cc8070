package com.flagship.settlement_engine.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only view of a ticket tier. Price and capacity are fixed once a payment references the tier.
 */
@Value
public class TierInfo {
    UUID id;
    UUID eventId;
    String name;
    BigDecimal price;
    int capacity;
    boolean refundEnabled;
}
