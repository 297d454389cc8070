package com.flagship.settlement_engine.withdrawal;

import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.withdrawal.dto.ConfirmWithdrawalRequest;
import com.flagship.settlement_engine.withdrawal.dto.PayoutAccountRequest;
import com.flagship.settlement_engine.withdrawal.dto.PayoutAccountResponse;
import com.flagship.settlement_engine.withdrawal.dto.WithdrawalRequest;
import com.flagship.settlement_engine.withdrawal.dto.WithdrawalResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class WithdrawalController {

    private final WithdrawalService withdrawalService;
    private final PayoutAccountService payoutAccountService;

    @PutMapping("/organizers/{organizerId}/payout-account")
    public ResponseEntity<PayoutAccountResponse> registerPayoutAccount(
            @PathVariable("organizerId") UUID organizerId,
            @Valid @RequestBody PayoutAccountRequest request,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor.of(actorId, actorRole).requireActsFor(organizerId);
        PayoutAccount account = payoutAccountService.register(organizerId, request.getBankCode(), request.getAccountNumber());
        return ResponseEntity.ok(PayoutAccountResponse.from(account));
    }

    /**
     * Opens a withdrawal and sends the OTP. Funds stay available until confirmation.
     */
    @PostMapping("/organizers/{organizerId}/withdrawals")
    public ResponseEntity<WithdrawalResponse> requestWithdrawal(
            @PathVariable("organizerId") UUID organizerId,
            @Valid @RequestBody WithdrawalRequest request,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        log.info("Withdrawal requested: organizerId={}, amount={}", organizerId, request.getAmount());
        Withdrawal withdrawal = withdrawalService.request(organizerId, request.getAmount(), Actor.of(actorId, actorRole));
        return ResponseEntity.status(HttpStatus.CREATED).body(WithdrawalResponse.from(withdrawal));
    }

    @GetMapping("/organizers/{organizerId}/withdrawals")
    public ResponseEntity<List<WithdrawalResponse>> listWithdrawals(
            @PathVariable("organizerId") UUID organizerId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        List<WithdrawalResponse> withdrawals = withdrawalService.list(organizerId, Actor.of(actorId, actorRole)).stream()
            .map(WithdrawalResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(withdrawals);
    }

    @GetMapping("/withdrawals/{withdrawalId}")
    public ResponseEntity<WithdrawalResponse> getWithdrawal(
            @PathVariable("withdrawalId") UUID withdrawalId,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        return ResponseEntity.ok(WithdrawalResponse.from(withdrawalService.get(withdrawalId, Actor.of(actorId, actorRole))));
    }

    @PostMapping("/withdrawals/{withdrawalId}/confirm")
    public ResponseEntity<WithdrawalResponse> confirmWithdrawal(
            @PathVariable("withdrawalId") UUID withdrawalId,
            @Valid @RequestBody ConfirmWithdrawalRequest request,
            @RequestHeader(Actor.ID_HEADER) UUID actorId,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Withdrawal withdrawal = withdrawalService.confirm(withdrawalId, request.getOtp(), Actor.of(actorId, actorRole));
        return ResponseEntity.ok(WithdrawalResponse.from(withdrawal));
    }
}
