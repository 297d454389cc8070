package com.flagship.settlement_engine.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes settlement events to the outbox inside the caller's transaction, so a
 * rolled-back sale, refund or payout never leaves an event behind.
 * The publisher-side methods each run in their own short transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(SettlementEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getEventType(), e);
        }
        OutboxEvent saved = repository.save(OutboxEventEntity.of(OutboxEvent.pending(event, payload, clock.instant())))
            .toDomain();
        log.debug("Outbox event written: type={}, aggregate={}/{}",
            saved.getEventType(), saved.getAggregateType(), saved.getAggregateId());
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> nextBatch(int limit) {
        return repository.lockPublishable(limit).stream()
            .map(OutboxEventEntity::toDomain)
            .collect(Collectors.toList());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.published(clock.instant()));
    }

    /**
     * Records a failed send. Returns true when the event has now been dead-lettered.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID eventId, String error, int maxRetries) {
        return repository.findById(eventId)
            .map(entity -> {
                boolean exhausted = entity.failed(error, clock.instant(), maxRetries);
                log.warn("Outbox send failed: eventId={}, attempt={}, deadLettered={}, error={}",
                    eventId, entity.getRetryCount(), exhausted, error);
                return exhausted;
            })
            .orElse(false);
    }

    /**
     * Parks an event that can never be published, without spending its retries.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDeadLettered(UUID eventId, String error) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.deadLettered(error, clock.instant());
            log.error("Outbox event dead-lettered: eventId={}, eventType={}, error={}",
                eventId, entity.getEventType(), error);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId).stream()
            .map(OutboxEventEntity::toDomain)
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long countPublishable() {
        return repository.countPublishable();
    }

    @Transactional(readOnly = true)
    public OutboxBacklog backlog() {
        return new OutboxBacklog(repository.countPublishable(), repository.countDeadLettered(),
            repository.findOldestPublishableCreatedAt().orElse(null));
    }
}
