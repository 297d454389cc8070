package com.flagship.settlement_engine.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Runs an event handler at most once per consumer group.
 *
 * The handler's writes and the processed_events row commit in one transaction.
 * A handler failure rolls both back so the redelivered record is tried again.
 * Two consumers racing on the same event collide on the (event_id, consumer_group)
 * primary key and the loser rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false if the event had already been processed
     */
    @Transactional
    public boolean process(EventEnvelope envelope, String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(envelope, consumerGroup)) {
            log.debug("Event {} already processed by {}, skipping", envelope.eventId(), consumerGroup);
            return false;
        }

        handler.run();
        repository.saveAndFlush(ProcessedEventEntity.record(
            ProcessedEvent.success(envelope, consumerGroup, clock.instant())));
        return true;
    }

    /**
     * Records an event this consumer has no handler for, so it is not looked at again.
     */
    @Transactional
    public void skip(EventEnvelope envelope, String consumerGroup, String reason) {
        if (isAlreadyProcessed(envelope, consumerGroup)) {
            return;
        }
        repository.saveAndFlush(ProcessedEventEntity.record(
            ProcessedEvent.skipped(envelope, consumerGroup, reason, clock.instant())));
        log.debug("Skipped event {} ({}): {}", envelope.eventId(), envelope.eventType(), reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(EventEnvelope envelope, String consumerGroup) {
        return repository.existsById(new ProcessedEventKey(envelope.eventId(), consumerGroup));
    }
}
