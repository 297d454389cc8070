package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.ledger.LedgerReplayVerifier;
import com.flagship.settlement_engine.outbox.OutboxBacklog;
import com.flagship.settlement_engine.outbox.OutboxService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Actuator health indicators for the settlement engine.
 */
public class HealthIndicators {

    private HealthIndicators() {
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * DOWN past the critical backlog. WARNING past the warning backlog or as soon
     * as one event is dead-lettered, since downstream projections then miss a fact.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxService outboxService;
        private final Clock clock;
        private final long warningBacklog;
        private final long criticalBacklog;

        public OutboxHealthIndicator(OutboxService outboxService, Clock clock,
                                     @Value("${outbox.health.warning-backlog:1000}") long warningBacklog,
                                     @Value("${outbox.health.critical-backlog:10000}") long criticalBacklog) {
            this.outboxService = outboxService;
            this.clock = clock;
            this.warningBacklog = warningBacklog;
            this.criticalBacklog = criticalBacklog;
        }

        @Override
        public Health health() {
            OutboxBacklog backlog;
            try {
                backlog = outboxService.backlog();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }

            Health.Builder builder = Health.up();
            if (backlog.publishable() >= criticalBacklog) {
                builder = Health.down();
            } else if (backlog.publishable() >= warningBacklog || backlog.deadLettered() > 0) {
                builder = Health.status("WARNING");
            }
            return builder
                .withDetail("publishable", backlog.publishable())
                .withDetail("deadLettered", backlog.deadLettered())
                .withDetail("lagSeconds", backlog.oldestAgeSeconds(clock.instant()))
                .build();
        }
    }

    /**
     * Redis only holds the checkout idempotency fast path; without it the database
     * lookup answers alone, so the service is DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;
        private final SettlementProperties properties;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate, SettlementProperties properties) {
            this.redisTemplate = redisTemplate;
            this.properties = properties;
        }

        @Override
        public Health health() {
            if (!properties.getIdempotency().isRedisEnabled()) {
                return Health.up().withDetail("fastPath", "disabled").build();
            }
            RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
            if (factory == null) {
                return degraded("no connection factory");
            }
            try (RedisConnection connection = factory.getConnection()) {
                String reply = connection.ping();
                return "PONG".equals(reply)
                    ? Health.up().withDetail("fastPath", "enabled").build()
                    : degraded("ping answered " + reply);
            } catch (Exception e) {
                return degraded(describe(e));
            }
        }

        private Health degraded(String reason) {
            return Health.status("DEGRADED")
                .withDetail("fastPath", "unavailable")
                .withDetail("reason", reason)
                .build();
        }
    }

    /**
     * UP once the producer has connected; the outbox keeps events safe while it is DOWN.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final SettlementProperties properties;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate, SettlementProperties properties) {
            this.kafkaTemplate = kafkaTemplate;
            this.properties = properties;
        }

        @Override
        public Health health() {
            SettlementProperties.Kafka.Topics topics = properties.getKafka().getTopics();
            List<String> topicNames = List.of(topics.getPayments(), topics.getTickets(),
                topics.getRefunds(), topics.getWithdrawals());
            try {
                if (kafkaTemplate.metrics().isEmpty()) {
                    return Health.down().withDetail("producer", "not connected").withDetail("topics", topicNames).build();
                }
                return Health.up().withDetail("producer", "connected").withDetail("topics", topicNames).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).withDetail("topics", topicNames).build();
            }
        }
    }

    /**
     * Reflects the last scheduled replay: DOWN when any organizer's snapshots or
     * cached balance disagreed with the ledger.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final LedgerReplayVerifier verifier;

        public LedgerHealthIndicator(LedgerReplayVerifier verifier) {
            this.verifier = verifier;
        }

        @Override
        public Health health() {
            LedgerReplayVerifier.VerificationRun run = verifier.getLastRun();
            if (run == null) {
                return Health.unknown().withDetail("lastRun", "none").build();
            }
            return (run.isConsistent() ? Health.up() : Health.down())
                .withDetail("lastRun", run.completedAt().toString())
                .withDetail("organizersChecked", run.organizersChecked())
                .withDetail("inconsistentOrganizers", run.inconsistentOrganizers())
                .build();
        }
    }
}
