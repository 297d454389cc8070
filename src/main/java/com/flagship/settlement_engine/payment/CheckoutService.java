package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.catalog.CatalogRepository;
import com.flagship.settlement_engine.catalog.EventInfo;
import com.flagship.settlement_engine.catalog.TierInfo;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.common.random.RandomCodes;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Starts a purchase: validates the tier and creates a PENDING payment the buyer then pays at the gateway.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutService {

    private final CatalogRepository catalogRepository;
    private final PaymentPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Result of a checkout call. {@code replayed} is true when the idempotency key
     * had already been used and the original payment is returned.
     */
    public record CheckoutResult(Payment payment, boolean replayed) {
    }

    @Transactional
    public CheckoutResult initiateCheckout(UUID eventId, UUID tierId, UUID buyerId, String buyerEmail,
                                           String idempotencyKey) {
        long start = System.currentTimeMillis();

        Optional<UUID> existing = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            metrics.recordIdempotencyHit();
            Payment payment = persistenceService.findById(existing.get())
                .orElseThrow(() -> new IllegalStateException(
                    "Payment found by idempotency key but not by id: " + existing.get()));
            log.info("Checkout replayed for idempotency key {}: reference={}", idempotencyKey, payment.getReference());
            return new CheckoutResult(payment, true);
        }
        metrics.recordIdempotencyMiss();

        EventInfo event = catalogRepository.getEvent(eventId);
        TierInfo tier = catalogRepository.getTier(tierId);
        if (!tier.getEventId().equals(event.getId())) {
            throw new SettlementException(ErrorCode.TIER_NOT_FOUND,
                "Tier " + tierId + " does not belong to event " + eventId);
        }
        if (tier.getPrice().signum() <= 0) {
            throw new SettlementException(ErrorCode.INVALID_REQUEST, "Free tiers do not go through checkout");
        }

        int taken = catalogRepository.countSeatsTaken(tierId);
        if (taken >= tier.getCapacity()) {
            throw new SettlementException(ErrorCode.TIER_SOLD_OUT, "Tier " + tier.getName() + " is sold out",
                Map.of("capacity", String.valueOf(tier.getCapacity()), "taken", String.valueOf(taken)));
        }

        Instant now = clock.instant();
        Payment payment = Payment.create(UUID.randomUUID(), newReference(now), tier.getPrice(), event.getId(),
            tier.getId(), event.getOrganizerId(), buyerId, buyerEmail, now);

        Payment saved = persistenceService.save(payment, idempotencyKey);
        idempotencyService.storeIdempotencyKey(idempotencyKey, saved.getId());

        try (MDC.MDCCloseable ignored = CorrelationContext.put(CorrelationContext.REFERENCE_MDC_KEY, saved.getReference())) {
            long duration = System.currentTimeMillis() - start;
            metrics.recordLatency("checkout", duration);
            log.info("Checkout created: eventId={}, tierId={}, amount={}, duration={}ms",
                eventId, tierId, saved.getAmount(), duration);
        }
        return new CheckoutResult(saved, false);
    }

    static String newReference(Instant now) {
        return "HD-" + now.toEpochMilli() + "-" + RandomCodes.alphanumeric(6);
    }
}
