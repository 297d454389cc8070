package com.flagship.settlement_engine.consumer;

import java.util.UUID;

/**
 * The fields every outbox payload carries, read before the type-specific body.
 */
public record EventEnvelope(UUID eventId, String eventType, String aggregateType, UUID aggregateId) {
}
