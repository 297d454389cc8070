package com.flagship.settlement_engine.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain fact written to the outbox. Every payload carries its own event id
 * so consumers can deduplicate redeliveries.
 */
public interface SettlementEvent {

    UUID getEventId();

    UUID getAggregateId();

    Instant getOccurredAt();

    String getEventType();

    String getAggregateType();
}
