package com.flagship.settlement_engine.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that one consumer group has handled one event. Its presence is what
 * makes redelivery after a crash or rebalance a no-op.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(EventEnvelope envelope, String consumerGroup, Instant now) {
        return new ProcessedEvent(envelope.eventId(), envelope.eventType(), envelope.aggregateType(),
            envelope.aggregateId(), consumerGroup, now, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(EventEnvelope envelope, String consumerGroup, String reason, Instant now) {
        return new ProcessedEvent(envelope.eventId(), envelope.eventType(), envelope.aggregateType(),
            envelope.aggregateId(), consumerGroup, now, ProcessingResult.SKIPPED, reason);
    }
}
