package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Single-row store-wide state shared by all workers: shop status, the active
 * giveaway round and the ticket panel channel.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "store_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreState {

    public static final String SINGLETON_ID = "store";

    @Id
    @Column(name = "state_id", nullable = false, length = 16)
    private String stateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "shop_status", nullable = false, length = 10)
    private ShopStatus shopStatus;

    @Column(name = "active_round_id", length = 36)
    private String activeRoundId;

    @Column(name = "ticket_panel_channel_ref", length = 100)
    private String ticketPanelChannelRef;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }

    public static StoreState initial() {
        return StoreState.builder()
                .stateId(SINGLETON_ID)
                .shopStatus(ShopStatus.OPEN)
                .build();
    }

    public boolean isOpen() {
        return shopStatus == ShopStatus.OPEN;
    }

    public enum ShopStatus {
        OPEN,
        CLOSED
    }
}
