package com.flagship.settlement_engine.withdrawal;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.GatewayRejectedException;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.gateway.PaymentGateway;
import com.flagship.settlement_engine.gateway.ResolvedAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Registers the bank account withdrawals are paid to. The gateway resolves the
 * account holder's name before anything is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutAccountService {

    private final PayoutAccountRepository repository;
    private final PaymentGateway gateway;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public PayoutAccount register(UUID organizerId, String bankCode, String accountNumber) {
        ResolvedAccount resolved = gateway.resolveAccount(accountNumber, bankCode);
        if (resolved.getAccountName() == null || resolved.getAccountName().isBlank()) {
            throw new GatewayRejectedException("Gateway could not resolve account " + accountNumber + " at bank " + bankCode);
        }

        Instant now = clock.instant();
        PayoutAccount account = new PayoutAccount(organizerId, bankCode, resolved.getAccountNumber(),
            resolved.getAccountName(), now);

        PayoutAccount saved = transactionTemplate.execute(status -> {
            PayoutAccountEntity entity = repository.findById(organizerId)
                .orElseGet(() -> PayoutAccountEntity.create(organizerId));
            entity.apply(account, now);
            return repository.save(entity).toDomain();
        });

        log.info("Payout account registered: organizerId={}, bankCode={}, accountName={}",
            organizerId, bankCode, account.getAccountName());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<PayoutAccount> find(UUID organizerId) {
        return repository.findById(organizerId).map(PayoutAccountEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public PayoutAccount get(UUID organizerId) {
        return find(organizerId)
            .orElseThrow(() -> new SettlementException(ErrorCode.PAYOUT_ACCOUNT_MISSING,
                "Register a payout account before withdrawing"));
    }
}
