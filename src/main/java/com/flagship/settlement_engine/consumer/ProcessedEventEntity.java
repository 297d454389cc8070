package com.flagship.settlement_engine.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * Insert-only. Marked new so saving it never issues a merge SELECT; a
 * concurrent duplicate fails on the primary key instead.
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEventEntity implements Persistable<ProcessedEventKey> {

    @EmbeddedId
    private ProcessedEventKey key;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @Column(name = "aggregate_type", nullable = false, updatable = false)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", nullable = false, updatable = false)
    private ProcessedEvent.ProcessingResult result;

    @Column(name = "note", updatable = false)
    private String note;

    @Transient
    private boolean fresh;

    static ProcessedEventEntity record(ProcessedEvent event) {
        ProcessedEventEntity entity = new ProcessedEventEntity();
        entity.key = new ProcessedEventKey(event.getEventId(), event.getConsumerGroup());
        entity.eventType = event.getEventType();
        entity.aggregateType = event.getAggregateType();
        entity.aggregateId = event.getAggregateId();
        entity.processedAt = event.getProcessedAt();
        entity.result = event.getResult();
        entity.note = event.getNote();
        entity.fresh = true;
        return entity;
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(key.getEventId(), eventType, aggregateType, aggregateId,
            key.getConsumerGroup(), processedAt, result, note);
    }

    @Override
    public ProcessedEventKey getId() {
        return key;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }
}
