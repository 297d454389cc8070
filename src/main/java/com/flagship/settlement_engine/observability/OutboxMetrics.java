package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.outbox.OutboxBacklog;
import com.flagship.settlement_engine.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Delivery counters and backlog gauges for the settlement outbox.
 *
 * The gauges read the last {@link OutboxBacklog} taken by {@link MetricsScheduler},
 * so a Prometheus scrape never reaches the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    public enum Delivery {
        PUBLISHED,
        FAILED,
        DEAD_LETTERED
    }

    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicReference<OutboxBacklog> lastBacklog = new AtomicReference<>(OutboxBacklog.EMPTY);

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("settlement.outbox.publishable", lastBacklog, ref -> ref.get().publishable())
            .description("Settlement events not yet on the broker")
            .register(meterRegistry);
        Gauge.builder("settlement.outbox.dead_lettered", lastBacklog, ref -> ref.get().deadLettered())
            .description("Settlement events the publisher gave up on")
            .register(meterRegistry);
        Gauge.builder("settlement.outbox.lag.seconds", lastBacklog, ref -> ref.get().oldestAgeSeconds(clock.instant()))
            .description("How long the oldest unpublished settlement event has waited")
            .register(meterRegistry);
    }

    public void refreshMetrics() {
        OutboxBacklog backlog = outboxService.backlog();
        lastBacklog.set(backlog);
        log.debug("Outbox backlog: publishable={}, deadLettered={}", backlog.publishable(), backlog.deadLettered());
    }

    public void record(String eventType, Delivery delivery) {
        meterRegistry.counter("settlement.outbox.deliveries",
            "event_type", eventType,
            "outcome", delivery.name().toLowerCase(Locale.ROOT)).increment();
    }
}
