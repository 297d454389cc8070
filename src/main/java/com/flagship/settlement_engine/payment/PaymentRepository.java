package com.flagship.settlement_engine.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByReference(String reference);

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Row lock on the payment. Concurrent confirmations of one reference queue here
     * and the second one finds the payment already SUCCESS.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.reference = :reference")
    Optional<PaymentEntity> findByReferenceForUpdate(@Param("reference") String reference);

    long countByStatus(PaymentStatus status);

    List<PaymentEntity> findByStatusOrderByCreatedAtAsc(PaymentStatus status);

    @Query("SELECT p FROM PaymentEntity p WHERE p.status = :status AND p.createdAt < :before ORDER BY p.createdAt")
    List<PaymentEntity> findByStatusCreatedBefore(@Param("status") PaymentStatus status,
                                                  @Param("before") Instant before,
                                                  Pageable pageable);
}
