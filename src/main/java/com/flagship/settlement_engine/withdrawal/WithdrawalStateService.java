package com.flagship.settlement_engine.withdrawal;

import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.ledger.LedgerPosting;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.ledger.OrganizerBalance;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.withdrawal.event.WithdrawalCompletedEvent;
import com.flagship.settlement_engine.withdrawal.event.WithdrawalFailedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The local, transactional steps of the withdrawal saga. Each method is one
 * short transaction; the payout call happens between them with no lock held.
 *
 * Lock order is always organizer balance row, then withdrawal row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalStateService {

    private final WithdrawalRepository repository;
    private final PayoutAccountService payoutAccountService;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final SettlementProperties properties;
    private final Clock clock;

    /**
     * A newly opened withdrawal and the plain OTP to deliver. The OTP exists nowhere else.
     */
    public record OpenedWithdrawal(Withdrawal withdrawal, String otp) {
    }

    public enum ConfirmationOutcome {
        DEBITED,
        OTP_INVALID,
        OTP_EXPIRED,
        OTP_ATTEMPTS_EXCEEDED,
        INSUFFICIENT_BALANCE
    }

    /**
     * Result of an OTP check. Rejections are returned rather than thrown so the
     * attempt counter or the FAILED transition commits.
     */
    public record Confirmation(ConfirmationOutcome outcome, Withdrawal withdrawal) {
    }

    /**
     * Checks the amount against the available balance under the organizer lock and
     * opens a PENDING_OTP withdrawal. Nothing is debited yet.
     */
    @Transactional
    public OpenedWithdrawal open(UUID organizerId, BigDecimal amount) {
        SettlementProperties.Withdrawal limits = properties.getWithdrawal();
        if (amount.compareTo(limits.getMinimumAmount()) < 0 || amount.compareTo(limits.getMaximumAmount()) > 0) {
            throw new SettlementException(ErrorCode.WITHDRAWAL_AMOUNT_OUT_OF_RANGE,
                String.format("Amount must be between %s and %s", limits.getMinimumAmount(), limits.getMaximumAmount()),
                Map.of("minimum", limits.getMinimumAmount().toPlainString(),
                       "maximum", limits.getMaximumAmount().toPlainString()));
        }
        PayoutAccount account = payoutAccountService.get(organizerId);

        OrganizerBalance balance = ledgerService.lockBalance(organizerId);
        Instant now = clock.instant();

        Optional<WithdrawalEntity> open = repository.findFirstByOrganizerIdAndStatus(organizerId, WithdrawalStatus.PENDING_OTP);
        if (open.isPresent()) {
            Withdrawal existing = open.get().toDomain();
            if (!existing.isOtpExpired(now)) {
                throw new SettlementException(ErrorCode.WITHDRAWAL_ALREADY_OPEN,
                    "Withdrawal " + existing.getId() + " is still waiting for its OTP",
                    Map.of("withdrawalId", existing.getId().toString()));
            }
            Withdrawal expired = existing.abandon("OTP expired", now);
            save(open.get(), expired);
            outboxService.saveEvent(WithdrawalFailedEvent.of(expired, false));
            log.info("Expired withdrawal {} closed before opening a new one", existing.getId());
        }

        if (balance.getAvailable().compareTo(amount) < 0) {
            throw insufficient(balance.getAvailable(), amount);
        }

        UUID id = UUID.randomUUID();
        String otp = OtpCodes.generate();
        Withdrawal withdrawal = Withdrawal.open(id, organizerId, amount, OtpCodes.hash(id, otp),
            now.plus(limits.getOtpTtl()), account, now);
        Withdrawal saved = repository.saveAndFlush(WithdrawalEntity.fromDomain(withdrawal)).toDomain();

        log.info("Withdrawal opened: amount={}, available={}, otpExpiresAt={}",
            amount, balance.getAvailable(), saved.getOtpExpiresAt());
        return new OpenedWithdrawal(saved, otp);
    }

    /**
     * Checks the OTP and, when it matches, re-checks the available balance and
     * appends the WITHDRAWAL debit. The withdrawal leaves this method PROCESSING
     * only if the debit was written.
     */
    @Transactional
    public Confirmation verifyOtpAndDebit(UUID withdrawalId, String otp, Actor actor) {
        Withdrawal snapshot = find(withdrawalId);
        actor.requireActsFor(snapshot.getOrganizerId());

        OrganizerBalance balance = ledgerService.lockBalance(snapshot.getOrganizerId());
        WithdrawalEntity entity = lock(withdrawalId);
        Withdrawal withdrawal = entity.toDomain();

        if (withdrawal.getStatus() != WithdrawalStatus.PENDING_OTP) {
            throw new SettlementException(ErrorCode.WITHDRAWAL_INVALID_STATE,
                "Withdrawal is " + withdrawal.getStatus() + " and cannot be confirmed");
        }

        Instant now = clock.instant();
        int maxAttempts = properties.getWithdrawal().getMaxOtpAttempts();

        if (withdrawal.isOtpExpired(now)) {
            return new Confirmation(ConfirmationOutcome.OTP_EXPIRED, abandon(entity, withdrawal, "OTP expired", now));
        }
        if (withdrawal.remainingAttempts(maxAttempts) == 0) {
            return new Confirmation(ConfirmationOutcome.OTP_ATTEMPTS_EXCEEDED,
                abandon(entity, withdrawal, "Too many invalid OTP attempts", now));
        }

        if (!OtpCodes.matches(withdrawal.getOtpHash(), withdrawalId, otp)) {
            Withdrawal attempted = withdrawal.recordFailedAttempt(now);
            if (attempted.remainingAttempts(maxAttempts) == 0) {
                return new Confirmation(ConfirmationOutcome.OTP_ATTEMPTS_EXCEEDED,
                    abandon(entity, attempted, "Too many invalid OTP attempts", now));
            }
            save(entity, attempted);
            log.info("Invalid OTP: attempts={}, remaining={}", attempted.getOtpAttempts(),
                attempted.remainingAttempts(maxAttempts));
            return new Confirmation(ConfirmationOutcome.OTP_INVALID, attempted);
        }

        if (balance.getAvailable().compareTo(withdrawal.getAmount()) < 0) {
            log.warn("Available balance dropped below the withdrawal amount before confirmation: available={}, amount={}",
                balance.getAvailable(), withdrawal.getAmount());
            return new Confirmation(ConfirmationOutcome.INSUFFICIENT_BALANCE,
                abandon(entity, withdrawal, "Insufficient available balance at confirmation", now));
        }

        ledgerService.append(LedgerPosting.withdrawal(withdrawal.getOrganizerId(), withdrawalId,
            withdrawal.getAmount(), "Withdrawal " + Withdrawal.payoutReference(withdrawalId)));
        Withdrawal processing = withdrawal.startProcessing(now);
        save(entity, processing);

        log.info("Withdrawal debited and processing: amount={}, reference={}",
            processing.getAmount(), processing.getGatewayReference());
        return new Confirmation(ConfirmationOutcome.DEBITED, processing);
    }

    /**
     * PROCESSING to COMPLETED. Already-terminal withdrawals are returned unchanged.
     */
    @Transactional
    public Withdrawal complete(UUID withdrawalId) {
        WithdrawalEntity entity = lock(withdrawalId);
        Withdrawal withdrawal = entity.toDomain();
        if (withdrawal.getStatus() != WithdrawalStatus.PROCESSING) {
            log.debug("Not completing withdrawal in {} status", withdrawal.getStatus());
            return withdrawal;
        }

        Withdrawal completed = withdrawal.complete(clock.instant());
        save(entity, completed);
        outboxService.saveEvent(WithdrawalCompletedEvent.of(completed));
        log.info("Withdrawal completed: amount={}, reference={}", completed.getAmount(), completed.getGatewayReference());
        return completed;
    }

    /**
     * PROCESSING to FAILED with a WITHDRAWAL_REVERSAL that returns the amount to
     * available. Runs at most once per withdrawal; later calls see FAILED and return.
     */
    @Transactional
    public Withdrawal failAndCompensate(UUID withdrawalId, String reason) {
        Withdrawal snapshot = find(withdrawalId);
        ledgerService.lockBalance(snapshot.getOrganizerId());
        WithdrawalEntity entity = lock(withdrawalId);
        Withdrawal withdrawal = entity.toDomain();

        if (withdrawal.getStatus() != WithdrawalStatus.PROCESSING) {
            log.debug("Not failing withdrawal in {} status", withdrawal.getStatus());
            return withdrawal;
        }

        ledgerService.append(LedgerPosting.withdrawalReversal(withdrawal.getOrganizerId(), withdrawalId,
            withdrawal.getAmount(), "Reversal of " + withdrawal.getGatewayReference() + ": " + reason));
        Withdrawal failed = withdrawal.failPayout(reason, clock.instant());
        save(entity, failed);
        outboxService.saveEvent(WithdrawalFailedEvent.of(failed, true));

        log.warn("Withdrawal failed and compensated: amount={}, reason={}", failed.getAmount(), reason);
        return failed;
    }

    @Transactional(readOnly = true)
    public Withdrawal find(UUID withdrawalId) {
        return repository.findById(withdrawalId)
            .map(WithdrawalEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.WITHDRAWAL_NOT_FOUND, "Withdrawal not found: " + withdrawalId));
    }

    private Withdrawal abandon(WithdrawalEntity entity, Withdrawal withdrawal, String reason, Instant now) {
        Withdrawal failed = withdrawal.abandon(reason, now);
        save(entity, failed);
        outboxService.saveEvent(WithdrawalFailedEvent.of(failed, false));
        log.info("Withdrawal abandoned before debit: reason={}", reason);
        return failed;
    }

    private WithdrawalEntity lock(UUID withdrawalId) {
        return repository.findByIdForUpdate(withdrawalId)
            .orElseThrow(() -> new SettlementException(ErrorCode.WITHDRAWAL_NOT_FOUND, "Withdrawal not found: " + withdrawalId));
    }

    private void save(WithdrawalEntity entity, Withdrawal withdrawal) {
        entity.updateFromDomain(withdrawal);
        repository.saveAndFlush(entity);
    }

    static SettlementException insufficient(BigDecimal available, BigDecimal requested) {
        return new SettlementException(ErrorCode.INSUFFICIENT_BALANCE,
            String.format("Available balance %s is below requested %s", available, requested),
            Map.of("available", available.toPlainString(), "requested", requested.toPlainString()));
    }
}
