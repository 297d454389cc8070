package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.config.SettlementProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Checkout idempotency keys.
 *
 * Redis is a fast path only. The unique idempotency_key column on payments is
 * the source of truth, so a Redis outage degrades latency, never correctness.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "checkout:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<StringRedisTemplate> redisTemplate,
                              SettlementProperties properties) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = properties.getIdempotency().isRedisEnabled() ? redisTemplate : Optional.empty();
    }

    /**
     * @return id of the payment created earlier under this key
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String paymentId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (paymentId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(paymentId));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> paymentId = paymentRepository.findByIdempotencyKey(idempotencyKey).map(PaymentEntity::getId);
        paymentId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return paymentId;
    }

    /**
     * Caches the mapping in Redis. The database row written at checkout already holds the key.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID paymentId) {
        requireKey(idempotencyKey);
        if (paymentId == null) {
            throw new IllegalArgumentException("Payment id cannot be null");
        }
        cache(idempotencyKey, paymentId);
    }

    private void cache(String idempotencyKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, paymentId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
