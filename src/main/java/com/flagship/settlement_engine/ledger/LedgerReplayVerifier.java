package com.flagship.settlement_engine.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Replays every organizer's ledger and remembers the outcome of the last run
 * for the ledger health indicator.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerReplayVerifier {

    private final LedgerService ledgerService;
    private final Clock clock;

    private final AtomicReference<VerificationRun> lastRun = new AtomicReference<>();

    public VerificationRun verifyAll() {
        List<UUID> inconsistent = new ArrayList<>();
        List<UUID> organizers = ledgerService.organizersWithEntries();

        for (UUID organizerId : organizers) {
            ReplayReport report = ledgerService.verifyReplay(organizerId);
            if (!report.isConsistent()) {
                inconsistent.add(organizerId);
            }
        }

        VerificationRun run = new VerificationRun(clock.instant(), organizers.size(), List.copyOf(inconsistent));
        lastRun.set(run);

        if (inconsistent.isEmpty()) {
            log.info("Ledger replay verified for {} organizers", organizers.size());
        } else {
            log.error("Ledger replay found {} inconsistent organizers out of {}: {}",
                inconsistent.size(), organizers.size(), inconsistent);
        }
        return run;
    }

    /**
     * Null until the first run has finished.
     */
    public VerificationRun getLastRun() {
        return lastRun.get();
    }

    public record VerificationRun(Instant completedAt, int organizersChecked, List<UUID> inconsistentOrganizers) {
        public boolean isConsistent() {
            return inconsistentOrganizers.isEmpty();
        }
    }
}
