package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.outbox.OutboxBacklog;
import com.flagship.settlement_engine.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OutboxObservabilityTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        outboxService = mock(OutboxService.class);
    }

    @Nested
    @DisplayName("Outbox health")
    class BacklogHealth {

        private Health check(OutboxBacklog backlog) {
            when(outboxService.backlog()).thenReturn(backlog);
            return new HealthIndicators.OutboxHealthIndicator(outboxService, clock, 100, 1000).health();
        }

        @Test
        @DisplayName("An empty outbox is UP with no lag")
        void emptyIsUp() {
            Health health = check(OutboxBacklog.EMPTY);

            assertEquals(Status.UP, health.getStatus());
            assertEquals(0L, health.getDetails().get("lagSeconds"));
        }

        @Test
        @DisplayName("A single dead-lettered event is a warning even with no backlog")
        void deadLetterWarns() {
            Health health = check(new OutboxBacklog(0, 1, null));

            assertEquals("WARNING", health.getStatus().getCode());
            assertEquals(1L, health.getDetails().get("deadLettered"));
        }

        @Test
        @DisplayName("Backlog thresholds move the status to WARNING then DOWN")
        void backlogThresholds() {
            Instant oldest = NOW.minusSeconds(90);

            assertEquals("WARNING", check(new OutboxBacklog(100, 0, oldest)).getStatus().getCode());

            Health critical = check(new OutboxBacklog(1000, 0, oldest));
            assertEquals(Status.DOWN, critical.getStatus());
            assertEquals(90L, critical.getDetails().get("lagSeconds"));
        }

        @Test
        @DisplayName("A failing backlog query reports DOWN with the error")
        void queryFailureIsDown() {
            when(outboxService.backlog()).thenThrow(new QueryTimeoutException("statement timeout"));

            Health health = new HealthIndicators.OutboxHealthIndicator(outboxService, clock, 100, 1000).health();

            assertEquals(Status.DOWN, health.getStatus());
            assertEquals("statement timeout", health.getDetails().get("error"));
        }
    }

    @Nested
    @DisplayName("Outbox metrics")
    class DeliveryMetrics {

        private SimpleMeterRegistry registry;
        private OutboxMetrics metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new OutboxMetrics(outboxService, registry, clock);
            metrics.registerGauges();
        }

        @Test
        @DisplayName("Gauges show the last refreshed backlog, not a live query")
        void gaugesFollowRefresh() {
            assertEquals(0.0, registry.get("settlement.outbox.publishable").gauge().value());

            when(outboxService.backlog()).thenReturn(new OutboxBacklog(7, 2, NOW.minusSeconds(30)));
            metrics.refreshMetrics();

            assertEquals(7.0, registry.get("settlement.outbox.publishable").gauge().value());
            assertEquals(2.0, registry.get("settlement.outbox.dead_lettered").gauge().value());
            assertEquals(30.0, registry.get("settlement.outbox.lag.seconds").gauge().value());
        }

        @Test
        @DisplayName("Deliveries are counted per event type and outcome")
        void deliveriesTagged() {
            metrics.record("PaymentVerified", OutboxMetrics.Delivery.PUBLISHED);
            metrics.record("PaymentVerified", OutboxMetrics.Delivery.PUBLISHED);
            metrics.record("PaymentVerified", OutboxMetrics.Delivery.DEAD_LETTERED);

            assertEquals(2.0, registry.get("settlement.outbox.deliveries")
                .tags("event_type", "PaymentVerified", "outcome", "published").counter().count());
            assertEquals(1.0, registry.get("settlement.outbox.deliveries")
                .tags("event_type", "PaymentVerified", "outcome", "dead_lettered").counter().count());
        }
    }
}
