package com.flagship.settlement_engine.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Periodically matures sales. Each organizer is handled in its own
 * transaction so one failure does not hold back the others.
 */
@Component
@ConditionalOnProperty(name = "settlement.jobs.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MaturationJob {

    private final MaturationService maturationService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${settlement.jobs.maturation-interval-ms:300000}")
    public void matureDueSales() {
        Instant now = clock.instant();
        int matured = 0;
        for (UUID organizerId : maturationService.organizersDue(now)) {
            try {
                matured += maturationService.matureOrganizer(organizerId, now);
            } catch (Exception e) {
                log.error("Maturation failed for organizerId={}: {}", organizerId, e.getMessage(), e);
            }
        }
        if (matured > 0) {
            log.info("Maturation run complete: {} sales matured", matured);
        }
    }
}
