package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.Cart;
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
 * Repository interface for Cart entity.
 *
 * @author Storefront Team
 */
@Repository
public interface CartRepository extends JpaRepository<Cart, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Cart c WHERE c.ownerId = :ownerId")
    Optional<Cart> findByIdWithLock(@Param("ownerId") String ownerId);

    /**
     * Carts that hold at least one line, most recently active first.
     */
    @Query("SELECT c FROM Cart c WHERE c.lines IS NOT EMPTY ORDER BY c.lastActivityAt DESC")
    List<Cart> findNonEmpty();

    /**
     * Find owners of non-empty carts idle since before the cutoff that have not been
     * reminded since their last activity.
     *
     * @param cutoff Carts last active before this instant are inactive
     * @return Owner IDs
     */
    @Query("SELECT c.ownerId FROM Cart c WHERE c.lines IS NOT EMPTY AND c.lastActivityAt < :cutoff " +
           "AND (c.lastRemindedAt IS NULL OR c.lastRemindedAt < c.lastActivityAt)")
    List<String> findOwnersDueForReminder(@Param("cutoff") Instant cutoff);

    /**
     * Guarded reminder stamp. Re-checks the reminder condition in the same statement,
     * so concurrent sweeps remind an owner at most once per idle period.
     *
     * @return Number of rows updated (1 if this caller won, 0 otherwise)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Cart c SET c.lastRemindedAt = :now WHERE c.ownerId = :ownerId " +
           "AND c.lastActivityAt < :cutoff " +
           "AND (c.lastRemindedAt IS NULL OR c.lastRemindedAt < c.lastActivityAt)")
    int markReminded(@Param("ownerId") String ownerId, @Param("cutoff") Instant cutoff, @Param("now") Instant now);
}
