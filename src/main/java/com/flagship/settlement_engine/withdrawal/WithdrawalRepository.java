package com.flagship.settlement_engine.withdrawal;

import jakarta.persistence.LockModeType;
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
public interface WithdrawalRepository extends JpaRepository<WithdrawalEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WithdrawalEntity w WHERE w.id = :id")
    Optional<WithdrawalEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<WithdrawalEntity> findFirstByOrganizerIdAndStatus(UUID organizerId, WithdrawalStatus status);

    Optional<WithdrawalEntity> findByGatewayReference(String gatewayReference);

    List<WithdrawalEntity> findByOrganizerIdOrderByCreatedAtDesc(UUID organizerId);

    List<WithdrawalEntity> findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(WithdrawalStatus status, Instant before);

    long countByStatus(WithdrawalStatus status);
}
