package com.flagship.settlement_engine.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    private static final int MAX_ERROR_LENGTH = 2000;

    @Id
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, updatable = false)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error")
    private String lastError;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "dead_lettered_at")
    private Instant deadLetteredAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static OutboxEventEntity of(OutboxEvent event) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.id = event.getId();
        entity.aggregateType = event.getAggregateType();
        entity.aggregateId = event.getAggregateId();
        entity.eventType = event.getEventType();
        entity.payload = event.getPayload();
        entity.createdAt = event.getCreatedAt();
        return entity;
    }

    OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload, createdAt,
            publishedAt, retryCount, lastError, lastAttemptAt, deadLetteredAt, sequenceNumber);
    }

    void published(Instant at) {
        publishedAt = at;
        lastAttemptAt = at;
        lastError = null;
    }

    /**
     * Counts a failed attempt. Returns true when this attempt used up the last retry.
     */
    boolean failed(String error, Instant at, int maxRetries) {
        retryCount++;
        lastAttemptAt = at;
        lastError = truncate(error);
        if (retryCount >= maxRetries) {
            deadLetteredAt = at;
            return true;
        }
        return false;
    }

    void deadLettered(String error, Instant at) {
        retryCount++;
        lastAttemptAt = at;
        lastError = truncate(error);
        deadLetteredAt = at;
    }

    private static String truncate(String error) {
        if (error == null) {
            return "unknown error";
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
