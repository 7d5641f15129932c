package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One giveaway cycle. Rounds are chained: ending one starts the next.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "giveaway_rounds", indexes = {
    @Index(name = "idx_round_state_ends", columnList = "state, ends_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GiveawayRound {

    @Id
    @Column(name = "round_id", nullable = false, length = 36)
    private String roundId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Column(name = "prize_minor", nullable = false)
    private Long prizeMinor;

    /**
     * Null until selection, and stays null when the round had no entrants.
     */
    @Column(name = "winner_id", length = 64)
    private String winnerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 10)
    private RoundState state;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (roundId == null) {
            roundId = UUID.randomUUID().toString();
        }
        if (state == null) {
            state = RoundState.OPEN;
        }
    }

    public boolean acceptsEntriesAt(Instant now) {
        return state == RoundState.OPEN && now.isBefore(endsAt);
    }

    public enum RoundState {
        OPEN,
        ENDED
    }
}
