package com.flagship.settlement_engine.ticket;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AgentCodeRepository extends JpaRepository<AgentCodeEntity, UUID> {

    Optional<AgentCodeEntity> findByCode(String code);

    boolean existsByCode(String code);

    List<AgentCodeEntity> findByEventIdOrderByCreatedAtAsc(UUID eventId);

    /**
     * Counts one check-in against the code, only while it is still active.
     * Returns 0 if the code was deactivated after it was read.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCodeEntity a SET a.lastUsedAt = :at, a.checkInCount = a.checkInCount + 1 " +
           "WHERE a.id = :id AND a.active = true")
    int recordCheckIn(@Param("id") UUID id, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCodeEntity a SET a.active = :active WHERE a.id = :id")
    int updateActive(@Param("id") UUID id, @Param("active") boolean active);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCodeEntity a SET a.activatedAt = :at WHERE a.id = :id AND a.activatedAt IS NULL")
    int markActivated(@Param("id") UUID id, @Param("at") Instant at);
}
