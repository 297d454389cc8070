package com.flagship.settlement_engine.outbox;

import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains the outbox to Kafka with at-least-once delivery.
 *
 * Each aggregate type has its own topic and the aggregate id is the record key,
 * so one payment's or withdrawal's events keep their order on a partition.
 * An event is marked published only after the broker acknowledged it. Events
 * whose aggregate type has no topic are dead-lettered on the first pass.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final SettlementProperties properties;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.nextBatch(batchSize);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox", e);
            return;
        }
        if (!batch.isEmpty()) {
            log.debug("Publishing {} outbox events", batch.size());
        }
        for (OutboxEvent event : batch) {
            publish(event);
        }
    }

    private void publish(OutboxEvent event) {
        Optional<String> topic = topicOf(event.getAggregateType());
        if (topic.isEmpty()) {
            outboxService.markDeadLettered(event.getId(), "No topic for aggregate type " + event.getAggregateType());
            outboxMetrics.record(event.getEventType(), OutboxMetrics.Delivery.DEAD_LETTERED);
            return;
        }

        try {
            RecordMetadata metadata = kafkaTemplate
                .send(topic.get(), event.getAggregateId().toString(), event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS)
                .getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.record(event.getEventType(), OutboxMetrics.Delivery.PUBLISHED);
            log.debug("Published {} {} to {}-{}@{}", event.getEventType(), event.getId(),
                metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(event, "Interrupted while waiting for the broker");
        } catch (ExecutionException e) {
            failed(event, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (TimeoutException e) {
            failed(event, "No broker acknowledgement within " + sendTimeoutMs + "ms");
        } catch (RuntimeException e) {
            failed(event, e.getMessage());
        }
    }

    private void failed(OutboxEvent event, String error) {
        outboxMetrics.record(event.getEventType(), OutboxMetrics.Delivery.FAILED);
        if (outboxService.markFailed(event.getId(), error, maxRetries)) {
            log.error("Outbox event {} dead-lettered after {} attempts: eventType={}, aggregateId={}",
                event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.record(event.getEventType(), OutboxMetrics.Delivery.DEAD_LETTERED);
        }
    }

    Optional<String> topicOf(String aggregateType) {
        SettlementProperties.Kafka.Topics topics = properties.getKafka().getTopics();
        return switch (aggregateType) {
            case "Payment" -> Optional.of(topics.getPayments());
            case "Ticket" -> Optional.of(topics.getTickets());
            case "Refund" -> Optional.of(topics.getRefunds());
            case "Withdrawal" -> Optional.of(topics.getWithdrawals());
            default -> Optional.empty();
        };
    }

    /**
     * Runs one publishing pass now instead of waiting for the next poll.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
