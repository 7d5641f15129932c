package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Support ticket bound to a private channel.
 * Lifecycle: OPEN -> CLOSED -> PURGED.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "tickets", indexes = {
    @Index(name = "idx_ticket_owner", columnList = "owner_id"),
    @Index(name = "idx_ticket_state_purge", columnList = "state, purge_at"),
    @Index(name = "idx_ticket_open_owner_unique", columnList = "open_owner_key", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ticket {

    @Id
    @Column(name = "ticket_id", nullable = false, length = 36)
    private String ticketId;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "channel_ref", nullable = false, length = 100)
    private String channelRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 10)
    private TicketState state;

    /**
     * Equals owner_id while the ticket is open, null otherwise.
     * The unique index on it allows one open ticket per owner.
     */
    @Column(name = "open_owner_key", unique = true, length = 64)
    private String openOwnerKey;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "closed_by", length = 64)
    private String closedBy;

    @Column(name = "purge_at")
    private Instant purgeAt;

    @Column(name = "purged_at")
    private Instant purgedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (ticketId == null) {
            ticketId = UUID.randomUUID().toString();
        }
        openedAt = Instant.now();
        if (state == null) {
            state = TicketState.OPEN;
        }
        if (state == TicketState.OPEN && openOwnerKey == null) {
            openOwnerKey = ownerId;
        }
    }

    public void close(String closedBy, Instant now, Duration purgeDelay) {
        this.state = TicketState.CLOSED;
        this.closedBy = closedBy;
        this.closedAt = now;
        this.purgeAt = now.plus(purgeDelay);
        this.openOwnerKey = null;
    }

    public enum TicketState {
        OPEN,
        CLOSED,
        PURGED
    }
}
