package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Payment} and {@link PaymentEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    /**
     * Inserts a new payment. Flushes so that a duplicate idempotency key or
     * reference fails here rather than at commit.
     */
    @Transactional
    public Payment save(Payment payment, String idempotencyKey) {
        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment, idempotencyKey));
        log.debug("Saved payment {} with idempotency key {}", saved.getReference(), idempotencyKey);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByReference(String reference) {
        return paymentRepository.findByReference(reference).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Payment getByReference(String reference) {
        return findByReference(reference)
            .orElseThrow(() -> new SettlementException(ErrorCode.PAYMENT_NOT_FOUND, "Payment not found: " + reference));
    }

    @Transactional(readOnly = true)
    public List<Payment> findPending() {
        return paymentRepository.findByStatusOrderByCreatedAtAsc(PaymentStatus.PENDING).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    /**
     * Oldest PENDING payments created before the cutoff.
     */
    @Transactional(readOnly = true)
    public List<Payment> findStalePending(Instant createdBefore, int limit) {
        return paymentRepository.findByStatusCreatedBefore(PaymentStatus.PENDING, createdBefore, PageRequest.of(0, limit))
            .stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    /**
     * Loads the payment with a row lock held until the surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment lockByReference(String reference) {
        return paymentRepository.findByReferenceForUpdate(reference)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.PAYMENT_NOT_FOUND, "Payment not found: " + reference));
    }

    /**
     * Writes a transition computed by the domain object. Flushes so that later JDBC
     * statements in the same transaction see the new status.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> new SettlementException(ErrorCode.PAYMENT_NOT_FOUND, "Payment not found: " + payment.getId()));
        existing.updateFromDomain(payment);
        PaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated payment {} to {}", updated.getReference(), updated.getStatus());
        return updated.toDomain();
    }
}
