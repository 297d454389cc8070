package com.flagship.settlement_engine.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "settlement.jobs.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class LedgerVerificationJob {

    private final LedgerReplayVerifier verifier;

    @Scheduled(fixedDelayString = "${settlement.jobs.ledger-verification-interval-ms:3600000}",
               initialDelayString = "${settlement.jobs.ledger-verification-initial-delay-ms:60000}")
    public void verifyLedger() {
        verifier.verifyAll();
    }
}
