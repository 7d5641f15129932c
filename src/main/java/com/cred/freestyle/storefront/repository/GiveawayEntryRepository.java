package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.GiveawayEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for GiveawayEntry entity.
 *
 * @author Storefront Team
 */
@Repository
public interface GiveawayEntryRepository extends JpaRepository<GiveawayEntry, String> {

    boolean existsByRoundIdAndOwnerId(String roundId, String ownerId);

    long countByRoundId(String roundId);

    /**
     * Entrants of a round in a stable order, so a random index maps to one owner.
     */
    @Query("SELECT e.ownerId FROM GiveawayEntry e WHERE e.roundId = :roundId ORDER BY e.ownerId ASC")
    List<String> findEntrantIds(@Param("roundId") String roundId);
}
