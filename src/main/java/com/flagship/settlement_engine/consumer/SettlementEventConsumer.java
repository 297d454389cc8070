package com.flagship.settlement_engine.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.payment.event.PaymentVerifiedEvent;
import com.flagship.settlement_engine.refund.event.RefundProcessedEvent;
import com.flagship.settlement_engine.ticket.event.TicketCheckedInEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Consumes settlement events and maintains the per-event sales summary.
 *
 * Offsets are acknowledged only after the record is processed (or recorded as
 * skipped). A handler failure leaves the record unacknowledged for redelivery.
 * Unparseable records are acknowledged and dropped since redelivery cannot fix them.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementEventConsumer {

    static final String CONSUMER_GROUP = "sales-summary-projector";

    private final IdempotentEventProcessor eventProcessor;
    private final SalesSummaryProjector projector;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = {
            "${settlement.kafka.topics.payments}",
            "${settlement.kafka.topics.tickets}",
            "${settlement.kafka.topics.refunds}"
        },
        groupId = "${spring.kafka.consumer.group-id:settlement-engine-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received record: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        JsonNode payload;
        EventEnvelope envelope;
        try {
            payload = objectMapper.readTree(record.value());
            envelope = envelopeOf(payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping unparseable record at {}-{}@{}: {}",
                record.topic(), record.partition(), record.offset(), e.getMessage());
            ack.acknowledge();
            return;
        }

        boolean processed = route(envelope, payload);
        ack.acknowledge();
        if (processed) {
            log.info("Processed event: type={}, eventId={}, aggregateId={}",
                envelope.eventType(), envelope.eventId(), envelope.aggregateId());
        }
    }

    private boolean route(EventEnvelope envelope, JsonNode payload) {
        return switch (envelope.eventType()) {
            case PaymentVerifiedEvent.EVENT_TYPE -> eventProcessor.process(envelope, CONSUMER_GROUP, () ->
                projector.onTicketSold(uuid(payload, "ticketedEventId"), payload.path("amount").decimalValue()));
            case RefundProcessedEvent.EVENT_TYPE -> eventProcessor.process(envelope, CONSUMER_GROUP, () ->
                projector.onTicketRefunded(uuid(payload, "ticketedEventId"), payload.path("refundAmount").decimalValue()));
            case TicketCheckedInEvent.EVENT_TYPE -> eventProcessor.process(envelope, CONSUMER_GROUP, () ->
                projector.onTicketCheckedIn(uuid(payload, "ticketedEventId")));
            default -> {
                eventProcessor.skip(envelope, CONSUMER_GROUP, "No projection for " + envelope.eventType());
                yield false;
            }
        };
    }

    static EventEnvelope envelopeOf(JsonNode payload) {
        return new EventEnvelope(
            uuid(payload, "eventId"),
            text(payload, "eventType"),
            text(payload, "aggregateType"),
            uuid(payload, "aggregateId"));
    }

    private static UUID uuid(JsonNode payload, String field) {
        return UUID.fromString(text(payload, field));
    }

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing field " + field);
        }
        return node.asText();
    }
}
