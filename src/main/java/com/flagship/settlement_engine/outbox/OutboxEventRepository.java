package com.flagship.settlement_engine.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Next publishable batch in write order. SKIP LOCKED lets several publisher
     * instances drain the table without picking the same row.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND dead_lettered_at IS NULL
        ORDER BY sequence_number
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> lockPublishable(@Param("limit") int limit);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(String aggregateType, UUID aggregateId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.deadLetteredAt IS NULL")
    long countPublishable();

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.deadLetteredAt IS NOT NULL")
    long countDeadLettered();

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.deadLetteredAt IS NULL")
    Optional<Instant> findOldestPublishableCreatedAt();
}
