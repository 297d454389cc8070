package com.flagship.settlement_engine.withdrawal;

import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.GatewayRejectedException;
import com.flagship.settlement_engine.common.exception.GatewayUnavailableException;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.gateway.PaymentGateway;
import com.flagship.settlement_engine.gateway.PayoutRequest;
import com.flagship.settlement_engine.gateway.PayoutResult;
import com.flagship.settlement_engine.gateway.PayoutStatus;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Organizer withdrawals: request, OTP confirmation, payout dispatch and
 * reconciliation of payouts whose outcome was not known at dispatch time.
 *
 * Not transactional. Each local step runs in its own transaction in
 * {@link WithdrawalStateService}; the gateway is called between them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalService {

    private final WithdrawalStateService state;
    private final WithdrawalRepository repository;
    private final PaymentGateway gateway;
    private final LedgerService ledgerService;
    private final OtpSender otpSender;
    private final SettlementProperties properties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Opens a withdrawal and sends the OTP. Nothing is debited until the OTP is confirmed.
     */
    public Withdrawal request(UUID organizerId, BigDecimal amount, Actor actor) {
        actor.requireActsFor(organizerId);
        try (MDC.MDCCloseable ignored = CorrelationContext.put(CorrelationContext.ORGANIZER_ID_MDC_KEY, organizerId)) {
            WithdrawalStateService.OpenedWithdrawal opened = state.open(organizerId, amount);
            Withdrawal withdrawal = opened.withdrawal();
            otpSender.send(organizerId, withdrawal.getId(), opened.otp(), withdrawal.getOtpExpiresAt());
            metrics.recordWithdrawal("requested");
            return withdrawal;
        }
    }

    /**
     * Confirms the OTP, debits the ledger and dispatches the payout. The returned
     * withdrawal is COMPLETED, FAILED (compensated) or still PROCESSING when the
     * gateway outcome is not yet known.
     */
    public Withdrawal confirm(UUID withdrawalId, String otp, Actor actor) {
        long start = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = CorrelationContext.put(CorrelationContext.WITHDRAWAL_ID_MDC_KEY, withdrawalId)) {
            WithdrawalStateService.Confirmation confirmation = state.verifyOtpAndDebit(withdrawalId, otp, actor);
            Withdrawal withdrawal = confirmation.withdrawal();
            metrics.recordWithdrawal(confirmation.outcome().name().toLowerCase(Locale.ROOT));

            switch (confirmation.outcome()) {
                case OTP_INVALID:
                    int remaining = withdrawal.remainingAttempts(properties.getWithdrawal().getMaxOtpAttempts());
                    throw new SettlementException(ErrorCode.OTP_INVALID, "Invalid OTP",
                        Map.of("remainingAttempts", String.valueOf(remaining)));
                case OTP_EXPIRED:
                    throw new SettlementException(ErrorCode.OTP_EXPIRED, "OTP has expired; request a new withdrawal");
                case OTP_ATTEMPTS_EXCEEDED:
                    throw new SettlementException(ErrorCode.OTP_ATTEMPTS_EXCEEDED,
                        "Too many invalid OTP attempts; request a new withdrawal");
                case INSUFFICIENT_BALANCE:
                    throw WithdrawalStateService.insufficient(
                        currentAvailable(withdrawal), withdrawal.getAmount());
                default:
                    break;
            }

            return dispatch(withdrawal);
        } finally {
            metrics.recordLatency("withdrawal_confirm", System.currentTimeMillis() - start);
        }
    }

    private Withdrawal dispatch(Withdrawal withdrawal) {
        PayoutRequest request = new PayoutRequest(withdrawal.getGatewayReference(), withdrawal.getAmount(),
            withdrawal.getBankCode(), withdrawal.getAccountNumber(), withdrawal.getAccountName(),
            "Ticket sales payout " + withdrawal.getGatewayReference());

        PayoutResult result;
        try {
            result = gateway.initiatePayout(request);
        } catch (GatewayRejectedException e) {
            log.warn("Gateway rejected payout: {}", e.getMessage());
            return state.failAndCompensate(withdrawal.getId(), "Payout rejected: " + e.getMessage());
        } catch (GatewayUnavailableException e) {
            log.warn("Payout outcome unknown, leaving withdrawal PROCESSING for reconciliation: {}", e.getMessage());
            return withdrawal;
        }

        return applyPayoutStatus(withdrawal, result);
    }

    /**
     * Re-queries the gateway for one PROCESSING withdrawal.
     */
    public Withdrawal reconcile(UUID withdrawalId) {
        try (MDC.MDCCloseable ignored = CorrelationContext.put(CorrelationContext.WITHDRAWAL_ID_MDC_KEY, withdrawalId)) {
            Withdrawal withdrawal = state.find(withdrawalId);
            if (withdrawal.getStatus() != WithdrawalStatus.PROCESSING && withdrawal.getStatus() != WithdrawalStatus.COMPLETED) {
                return withdrawal;
            }
            PayoutResult result = gateway.getPayoutStatus(withdrawal.getGatewayReference());
            return applyPayoutStatus(withdrawal, result);
        }
    }

    /**
     * Reconciles PROCESSING withdrawals that have not moved for the configured interval.
     *
     * @return how many reached a terminal state
     */
    public int reconcileProcessing() {
        Instant cutoff = clock.instant().minus(properties.getWithdrawal().getPayoutStatusCheckAfter());
        List<WithdrawalEntity> stuck = repository.findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(
            WithdrawalStatus.PROCESSING, cutoff);

        int settled = 0;
        for (WithdrawalEntity entity : stuck) {
            try {
                if (reconcile(entity.getId()).isTerminal()) {
                    settled++;
                }
            } catch (RuntimeException e) {
                log.warn("Payout reconciliation failed for withdrawalId={}: {}", entity.getId(), e.getMessage());
            }
        }
        if (!stuck.isEmpty()) {
            log.info("Payout reconciliation finished: checked={}, settled={}", stuck.size(), settled);
        }
        return settled;
    }

    /**
     * Disbursement webhooks only trigger a status query; the payload itself is not trusted.
     */
    public Optional<Withdrawal> handleDisbursementWebhook(String reference) {
        Optional<WithdrawalEntity> entity = repository.findByGatewayReference(reference);
        if (entity.isEmpty()) {
            log.warn("Disbursement webhook for unknown reference={}", reference);
            return Optional.empty();
        }
        return Optional.of(reconcile(entity.get().getId()));
    }

    Withdrawal applyPayoutStatus(Withdrawal withdrawal, PayoutResult result) {
        PayoutStatus status = result.getStatus();

        if (withdrawal.getStatus() == WithdrawalStatus.COMPLETED) {
            if (status == PayoutStatus.REVERSED) {
                log.error("Payout {} was reversed by the gateway after completion. Manual review required.",
                    withdrawal.getGatewayReference());
                metrics.recordPayoutReversedAfterCompletion();
            }
            return withdrawal;
        }

        if (status == PayoutStatus.SUCCESS) {
            metrics.recordWithdrawal("completed");
            return state.complete(withdrawal.getId());
        }
        if (status.isFailure()) {
            metrics.recordWithdrawal("payout_failed");
            String reason = result.getMessage() != null ? result.getMessage() : "Gateway reported " + status;
            return state.failAndCompensate(withdrawal.getId(), reason);
        }

        log.debug("Payout still pending at gateway");
        return withdrawal;
    }

    @Transactional(readOnly = true)
    public Withdrawal get(UUID withdrawalId, Actor actor) {
        Withdrawal withdrawal = state.find(withdrawalId);
        actor.requireActsFor(withdrawal.getOrganizerId());
        return withdrawal;
    }

    @Transactional(readOnly = true)
    public List<Withdrawal> list(UUID organizerId, Actor actor) {
        actor.requireActsFor(organizerId);
        return repository.findByOrganizerIdOrderByCreatedAtDesc(organizerId).stream()
            .map(WithdrawalEntity::toDomain)
            .collect(Collectors.toList());
    }

    private BigDecimal currentAvailable(Withdrawal withdrawal) {
        return ledgerService.balanceOf(withdrawal.getOrganizerId()).getAvailable();
    }
}
