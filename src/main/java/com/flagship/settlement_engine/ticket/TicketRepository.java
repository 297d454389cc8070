package com.flagship.settlement_engine.ticket;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Ticket persistence. Every status change is a single {@code UPDATE ... WHERE status = ACTIVE}
 * that returns the number of rows moved: 1 for the winner, 0 for everyone else.
 */
@Repository
public interface TicketRepository extends JpaRepository<TicketEntity, UUID> {

    Optional<TicketEntity> findByTicketNumber(String ticketNumber);

    Optional<TicketEntity> findByPaymentId(UUID paymentId);

    boolean existsByTicketNumber(String ticketNumber);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TicketEntity t SET t.status = :target, t.checkedInAt = :at, t.checkedInBy = :by, t.updatedAt = :at " +
           "WHERE t.id = :id AND t.status = :active")
    int updateCheckedIn(@Param("id") UUID id,
                        @Param("at") Instant at,
                        @Param("by") String by,
                        @Param("active") TicketStatus active,
                        @Param("target") TicketStatus target);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TicketEntity t SET t.status = :target, t.updatedAt = :at WHERE t.id = :id AND t.status = :active")
    int updateFromActive(@Param("id") UUID id,
                         @Param("at") Instant at,
                         @Param("active") TicketStatus active,
                         @Param("target") TicketStatus target);

    default int markCheckedIn(UUID id, Instant at, String by) {
        return updateCheckedIn(id, at, by, TicketStatus.ACTIVE, TicketStatus.CHECKED_IN);
    }

    default int markRefunded(UUID id, Instant at) {
        return updateFromActive(id, at, TicketStatus.ACTIVE, TicketStatus.REFUNDED);
    }

    default int markCancelled(UUID id, Instant at) {
        return updateFromActive(id, at, TicketStatus.ACTIVE, TicketStatus.CANCELLED);
    }
}
