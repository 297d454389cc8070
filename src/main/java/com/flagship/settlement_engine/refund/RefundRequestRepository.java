package com.flagship.settlement_engine.refund;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RefundRequestRepository extends JpaRepository<RefundRequestEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RefundRequestEntity r WHERE r.id = :id")
    Optional<RefundRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByTicketIdAndStatusNot(UUID ticketId, RefundStatus status);

    List<RefundRequestEntity> findByTicketIdOrderByCreatedAtDesc(UUID ticketId);

    List<RefundRequestEntity> findByStatusOrderByCreatedAtAsc(RefundStatus status);
}
