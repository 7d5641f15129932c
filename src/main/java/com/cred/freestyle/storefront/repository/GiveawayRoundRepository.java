package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.GiveawayRound;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for GiveawayRound entity.
 *
 * @author Storefront Team
 */
@Repository
public interface GiveawayRoundRepository extends JpaRepository<GiveawayRound, String> {

    @Query("SELECT r.roundId FROM GiveawayRound r WHERE r.state = 'OPEN' AND r.endsAt <= :now " +
           "ORDER BY r.endsAt ASC")
    List<String> findDueForSelection(@Param("now") Instant now);

    List<GiveawayRound> findTop10ByOrderByStartedAtDesc();

    /**
     * Guarded OPEN -> ENDED transition that records the winner.
     * Selection counts as executed only for the caller that gets 1 back.
     *
     * @return Number of rows updated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GiveawayRound r SET r.state = 'ENDED', r.winnerId = :winnerId, r.endedAt = :now, " +
           "r.version = r.version + 1 " +
           "WHERE r.roundId = :roundId AND r.state = 'OPEN'")
    int markEnded(@Param("roundId") String roundId, @Param("winnerId") String winnerId, @Param("now") Instant now);
}
