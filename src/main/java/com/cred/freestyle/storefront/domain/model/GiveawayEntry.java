package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * An entrant of a giveaway round. Unique per (round, owner).
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "giveaway_entries",
    uniqueConstraints = @UniqueConstraint(name = "uk_entry_round_owner", columnNames = {"round_id", "owner_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GiveawayEntry {

    @Id
    @Column(name = "entry_id", nullable = false, length = 36)
    private String entryId;

    @Column(name = "round_id", nullable = false, length = 36)
    private String roundId;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "entered_at", nullable = false, updatable = false)
    private Instant enteredAt;

    @PrePersist
    protected void onCreate() {
        if (entryId == null) {
            entryId = UUID.randomUUID().toString();
        }
        enteredAt = Instant.now();
    }
}
