package com.flagship.settlement_engine.withdrawal;

import com.flagship.settlement_engine.IntegrationTestSupport;
import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.common.actor.ActorRole;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.GatewayRejectedException;
import com.flagship.settlement_engine.common.exception.GatewayUnavailableException;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.gateway.PayoutResult;
import com.flagship.settlement_engine.gateway.PayoutStatus;
import com.flagship.settlement_engine.gateway.ResolvedAccount;
import com.flagship.settlement_engine.ledger.BalanceBucket;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerEntryType;
import com.flagship.settlement_engine.ledger.LedgerPosting;
import com.flagship.settlement_engine.ledger.OrganizerBalance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WithdrawalServiceTest extends IntegrationTestSupport {

    @Autowired
    private WithdrawalService withdrawalService;

    @Autowired
    private PayoutAccountService payoutAccountService;

    @MockBean
    private OtpSender otpSender;

    private UUID organizerId;
    private Actor organizer;

    @BeforeEach
    void setUp() {
        organizerId = UUID.randomUUID();
        organizer = new Actor(organizerId, ActorRole.ORGANIZER);
        when(gateway.resolveAccount(anyString(), anyString()))
            .thenReturn(new ResolvedAccount("0123456789", "ADA OKAFOR EVENTS", "058"));
        payoutAccountService.register(organizerId, "058", "0123456789");
        fundAvailable(organizerId, "50000.00");
    }

    /**
     * Opens a withdrawal and returns it with the OTP that was sent for it.
     */
    private Opened open(String amount) {
        Withdrawal withdrawal = withdrawalService.request(organizerId, new BigDecimal(amount), organizer);
        ArgumentCaptor<String> otp = ArgumentCaptor.forClass(String.class);
        verify(otpSender).send(eq(organizerId), eq(withdrawal.getId()), otp.capture(), any(Instant.class));
        return new Opened(withdrawal, otp.getValue());
    }

    private record Opened(Withdrawal withdrawal, String otp) {
    }

    private static String wrong(String otp) {
        return otp.equals("000000") ? "111111" : "000000";
    }

    private List<LedgerEntryType> entryTypes() {
        return ledgerService.history(organizerId).stream().map(LedgerEntry::getEntryType).toList();
    }

    @Nested
    @DisplayName("Requesting a withdrawal")
    class Requesting {

        @Test
        @DisplayName("More than the available balance is refused before any OTP is sent")
        void insufficientBalance() {
            SettlementException e = assertThrows(SettlementException.class,
                () -> withdrawalService.request(organizerId, new BigDecimal("60000.00"), organizer));

            assertEquals(ErrorCode.INSUFFICIENT_BALANCE, e.getErrorCode());
            assertAmount("50000.00", balanceOf(organizerId).getAvailable());
        }

        @Test
        @DisplayName("Opening a withdrawal debits nothing")
        void openingDebitsNothing() {
            Opened opened = open("10000.00");

            assertEquals(WithdrawalStatus.PENDING_OTP, opened.withdrawal().getStatus());
            assertEquals(6, opened.otp().length());
            assertAmount("50000.00", balanceOf(organizerId).getAvailable());
        }

        @Test
        @DisplayName("Only one withdrawal may wait for its OTP at a time")
        void oneOpenWithdrawal() {
            open("10000.00");

            SettlementException e = assertThrows(SettlementException.class,
                () -> withdrawalService.request(organizerId, new BigDecimal("5000.00"), organizer));

            assertEquals(ErrorCode.WITHDRAWAL_ALREADY_OPEN, e.getErrorCode());
        }

        @Test
        @DisplayName("Amounts below the minimum are refused")
        void belowMinimum() {
            SettlementException e = assertThrows(SettlementException.class,
                () -> withdrawalService.request(organizerId, new BigDecimal("500.00"), organizer));

            assertEquals(ErrorCode.WITHDRAWAL_AMOUNT_OUT_OF_RANGE, e.getErrorCode());
        }

        @Test
        @DisplayName("Another organizer cannot withdraw these funds")
        void foreignOrganizer() {
            Actor stranger = new Actor(UUID.randomUUID(), ActorRole.ORGANIZER);

            SettlementException e = assertThrows(SettlementException.class,
                () -> withdrawalService.request(organizerId, new BigDecimal("1000.00"), stranger));

            assertEquals(ErrorCode.FORBIDDEN, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("Confirming with the OTP")
    class Confirming {

        @Test
        @DisplayName("Successful payout moves funds from available to withdrawn")
        void successfulPayout() {
            Opened opened = open("10000.00");
            when(gateway.initiatePayout(any()))
                .thenReturn(new PayoutResult(Withdrawal.payoutReference(opened.withdrawal().getId()), PayoutStatus.SUCCESS, "SUCCESS"));

            Withdrawal confirmed = withdrawalService.confirm(opened.withdrawal().getId(), opened.otp(), organizer);

            assertEquals(WithdrawalStatus.COMPLETED, confirmed.getStatus());
            OrganizerBalance balance = balanceOf(organizerId);
            assertAmount("40000.00", balance.getAvailable());
            assertAmount("10000.00", balance.getWithdrawn());
            assertTrue(ledgerService.verifyReplay(organizerId).isConsistent());
        }

        @Test
        @DisplayName("Rejected payout is compensated and the funds return to available")
        void rejectedPayoutIsCompensated() {
            Opened opened = open("10000.00");
            when(gateway.initiatePayout(any())).thenThrow(new GatewayRejectedException("Invalid destination account"));

            Withdrawal failed = withdrawalService.confirm(opened.withdrawal().getId(), opened.otp(), organizer);

            assertEquals(WithdrawalStatus.FAILED, failed.getStatus());
            assertNotNull(failed.getFailureReason());
            OrganizerBalance balance = balanceOf(organizerId);
            assertAmount("50000.00", balance.getAvailable());
            assertAmount("0", balance.getWithdrawn());
            List<LedgerEntryType> types = entryTypes();
            assertTrue(types.contains(LedgerEntryType.WITHDRAWAL));
            assertTrue(types.contains(LedgerEntryType.WITHDRAWAL_REVERSAL));
        }

        @Test
        @DisplayName("Unknown payout outcome stays PROCESSING until reconciliation settles it")
        void unavailableGatewayIsReconciledLater() {
            Opened opened = open("10000.00");
            UUID id = opened.withdrawal().getId();
            when(gateway.initiatePayout(any())).thenThrow(new GatewayUnavailableException("Read timed out"));

            Withdrawal processing = withdrawalService.confirm(id, opened.otp(), organizer);

            assertEquals(WithdrawalStatus.PROCESSING, processing.getStatus());
            assertAmount("40000.00", balanceOf(organizerId).getAvailable());

            when(gateway.getPayoutStatus(Withdrawal.payoutReference(id)))
                .thenReturn(new PayoutResult(Withdrawal.payoutReference(id), PayoutStatus.SUCCESS, "SUCCESS"));

            Withdrawal reconciled = withdrawalService.reconcile(id);

            assertEquals(WithdrawalStatus.COMPLETED, reconciled.getStatus());
            assertAmount("10000.00", balanceOf(organizerId).getWithdrawn());
        }

        @Test
        @DisplayName("Payout the gateway has never heard of is compensated")
        void unknownPayoutIsCompensated() {
            Opened opened = open("10000.00");
            UUID id = opened.withdrawal().getId();
            when(gateway.initiatePayout(any())).thenThrow(new GatewayUnavailableException("Connection reset"));
            withdrawalService.confirm(id, opened.otp(), organizer);
            when(gateway.getPayoutStatus(anyString()))
                .thenReturn(new PayoutResult(Withdrawal.payoutReference(id), PayoutStatus.NOT_FOUND, "not found"));

            Withdrawal failed = withdrawalService.handleDisbursementWebhook(Withdrawal.payoutReference(id)).orElseThrow();

            assertEquals(WithdrawalStatus.FAILED, failed.getStatus());
            assertAmount("50000.00", balanceOf(organizerId).getAvailable());
        }

        @Test
        @DisplayName("Balance lost between request and confirmation fails the withdrawal without a debit")
        void availableDroppedBeforeConfirmation() {
            Opened opened = open("40000.00");
            UUID id = opened.withdrawal().getId();
            transactionTemplate.executeWithoutResult(status -> ledgerService.append(LedgerPosting.chargeback(
                organizerId, UUID.randomUUID(), UUID.randomUUID(), new BigDecimal("20000.00"),
                BalanceBucket.AVAILABLE, "Chargeback while withdrawal waits for OTP")));

            SettlementException e = assertThrows(SettlementException.class,
                () -> withdrawalService.confirm(id, opened.otp(), organizer));

            assertEquals(ErrorCode.INSUFFICIENT_BALANCE, e.getErrorCode());
            assertEquals("30000.00", e.getDetails().get("available"));
            assertEquals(WithdrawalStatus.FAILED, withdrawalService.get(id, organizer).getStatus());
            assertFalse(entryTypes().contains(LedgerEntryType.WITHDRAWAL));
            assertAmount("30000.00", balanceOf(organizerId).getAvailable());
            assertAmount("0", balanceOf(organizerId).getWithdrawn());
            verify(gateway, never()).initiatePayout(any());
        }

        @Test
        @DisplayName("Correct OTP after expiry fails the withdrawal and leaves available untouched")
        void expiredOtp() {
            Opened opened = open("10000.00");
            UUID id = opened.withdrawal().getId();
            jdbcTemplate.update("UPDATE withdrawals SET otp_expires_at = ? WHERE id = ?",
                Timestamp.from(Instant.now().minus(Duration.ofMinutes(1))), id);

            SettlementException e = assertThrows(SettlementException.class,
                () -> withdrawalService.confirm(id, opened.otp(), organizer));

            assertEquals(ErrorCode.OTP_EXPIRED, e.getErrorCode());
            assertEquals(WithdrawalStatus.FAILED, withdrawalService.get(id, organizer).getStatus());
            assertFalse(entryTypes().contains(LedgerEntryType.WITHDRAWAL));
            assertAmount("50000.00", balanceOf(organizerId).getAvailable());

            SettlementException again = assertThrows(SettlementException.class,
                () -> withdrawalService.confirm(id, opened.otp(), organizer));
            assertEquals(ErrorCode.WITHDRAWAL_INVALID_STATE, again.getErrorCode());
        }

        @Test
        @DisplayName("Wrong OTP reports the attempts left and debits nothing")
        void wrongOtp() {
            Opened opened = open("10000.00");

            SettlementException e = assertThrows(SettlementException.class,
                () -> withdrawalService.confirm(opened.withdrawal().getId(), wrong(opened.otp()), organizer));

            assertEquals(ErrorCode.OTP_INVALID, e.getErrorCode());
            assertEquals("4", e.getDetails().get("remainingAttempts"));
            assertAmount("50000.00", balanceOf(organizerId).getAvailable());
        }

        @Test
        @DisplayName("Exhausting the attempts fails the withdrawal for good")
        void attemptsExhausted() {
            Opened opened = open("10000.00");
            UUID id = opened.withdrawal().getId();
            for (int i = 0; i < 4; i++) {
                assertThrows(SettlementException.class, () -> withdrawalService.confirm(id, wrong(opened.otp()), organizer));
            }

            SettlementException last = assertThrows(SettlementException.class,
                () -> withdrawalService.confirm(id, wrong(opened.otp()), organizer));
            assertEquals(ErrorCode.OTP_ATTEMPTS_EXCEEDED, last.getErrorCode());

            SettlementException afterwards = assertThrows(SettlementException.class,
                () -> withdrawalService.confirm(id, opened.otp(), organizer));
            assertEquals(ErrorCode.WITHDRAWAL_INVALID_STATE, afterwards.getErrorCode());
            assertEquals(WithdrawalStatus.FAILED, withdrawalService.get(id, organizer).getStatus());
        }

        @Test
        @DisplayName("A completed withdrawal cannot be confirmed again")
        void confirmTwice() {
            Opened opened = open("10000.00");
            when(gateway.initiatePayout(any()))
                .thenReturn(new PayoutResult(Withdrawal.payoutReference(opened.withdrawal().getId()), PayoutStatus.SUCCESS, "SUCCESS"));
            withdrawalService.confirm(opened.withdrawal().getId(), opened.otp(), organizer);

            SettlementException e = assertThrows(SettlementException.class,
                () -> withdrawalService.confirm(opened.withdrawal().getId(), opened.otp(), organizer));

            assertEquals(ErrorCode.WITHDRAWAL_INVALID_STATE, e.getErrorCode());
            assertAmount("40000.00", balanceOf(organizerId).getAvailable());
        }

        @Test
        @DisplayName("Reversal reported after completion leaves the ledger untouched")
        void reversalAfterCompletion() {
            Opened opened = open("10000.00");
            UUID id = opened.withdrawal().getId();
            when(gateway.initiatePayout(any()))
                .thenReturn(new PayoutResult(Withdrawal.payoutReference(id), PayoutStatus.SUCCESS, "SUCCESS"));
            withdrawalService.confirm(id, opened.otp(), organizer);
            when(gateway.getPayoutStatus(anyString()))
                .thenReturn(new PayoutResult(Withdrawal.payoutReference(id), PayoutStatus.REVERSED, "REVERSED"));

            Withdrawal after = withdrawalService.reconcile(id);

            assertEquals(WithdrawalStatus.COMPLETED, after.getStatus());
            assertAmount("10000.00", balanceOf(organizerId).getWithdrawn());
            assertFalse(entryTypes().contains(LedgerEntryType.WITHDRAWAL_REVERSAL));
        }
    }
}
