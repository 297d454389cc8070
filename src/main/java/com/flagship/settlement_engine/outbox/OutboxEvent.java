package com.flagship.settlement_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A settlement fact waiting in the outbox table.
 *
 * An event is publishable while it is neither published nor dead-lettered.
 * Dead-lettered events stay in the table for an operator to inspect.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Instant lastAttemptAt;
    Instant deadLetteredAt;
    Long sequenceNumber;

    static OutboxEvent pending(SettlementEvent event, String payload, Instant now) {
        return new OutboxEvent(UUID.randomUUID(), event.getAggregateType(), event.getAggregateId(),
            event.getEventType(), payload, now, null, 0, null, null, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered() {
        return deadLetteredAt != null;
    }
}
