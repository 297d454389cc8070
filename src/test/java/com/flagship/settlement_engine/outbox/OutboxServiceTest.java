package com.flagship.settlement_engine.outbox;

import com.flagship.settlement_engine.IntegrationTestSupport;
import com.flagship.settlement_engine.payment.event.PaymentVerifiedEvent;
import com.flagship.settlement_engine.ticket.Ticket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OutboxServiceTest extends IntegrationTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Test
    @DisplayName("Verification writes its event in the same transaction as the sale")
    void eventWrittenWithSale() {
        UUID organizerId = UUID.randomUUID();
        UUID eventId = createEvent(organizerId, Instant.now().plus(Duration.ofDays(1)));
        Ticket ticket = purchaseTicket(eventId, createTier(eventId, "25000.00", 10, false), UUID.randomUUID());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(PaymentVerifiedEvent.AGGREGATE_TYPE, ticket.getPaymentId());

        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertEquals(PaymentVerifiedEvent.EVENT_TYPE, event.getEventType());
        assertNotNull(event.getSequenceNumber());
        assertTrue(event.getPayload().contains("\"netAmount\""));
        assertTrue(event.getPayload().contains(ticket.getId().toString()));
    }

    @Test
    @DisplayName("Rolled back business change leaves no event behind")
    void rollbackDiscardsEvent() {
        UUID aggregateId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent(new OutboxPublisherTest.UnroutableEvent(aggregateId));
            throw new IllegalStateException("business rule failed");
        }));

        assertTrue(outboxService.getEventsForAggregate("Invoice", aggregateId).isEmpty());
    }

    @Test
    @DisplayName("Events can only be written inside a transaction")
    void requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent(new OutboxPublisherTest.UnroutableEvent(UUID.randomUUID())));
    }
}
