package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.Ticket;
import com.cred.freestyle.storefront.domain.model.Ticket.TicketState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Ticket entity.
 *
 * @author Storefront Team
 */
@Repository
public interface TicketRepository extends JpaRepository<Ticket, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Ticket t WHERE t.ticketId = :ticketId")
    Optional<Ticket> findByIdWithLock(@Param("ticketId") String ticketId);

    Optional<Ticket> findByOwnerIdAndState(String ownerId, TicketState state);

    List<Ticket> findByStateOrderByOpenedAtAsc(TicketState state);

    /**
     * Find closed tickets whose purge time has elapsed.
     *
     * @param now Current timestamp
     * @return IDs of tickets due for purge
     */
    @Query("SELECT t.ticketId FROM Ticket t WHERE t.state = 'CLOSED' AND t.purgeAt <= :now " +
           "ORDER BY t.purgeAt ASC")
    List<String> findDueForPurge(@Param("now") Instant now);

    /**
     * Guarded CLOSED -> PURGED transition.
     * The state re-check is part of the update itself, so a ticket is purged by exactly one caller.
     *
     * @return Number of rows updated (1 if this caller purged it, 0 if someone else already did)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Ticket t SET t.state = 'PURGED', t.purgedAt = :now, t.version = t.version + 1 " +
           "WHERE t.ticketId = :ticketId AND t.state = 'CLOSED' AND t.purgeAt <= :now")
    int markPurged(@Param("ticketId") String ticketId, @Param("now") Instant now);
}
