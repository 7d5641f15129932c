package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Catalog item and its stock ledger row.
 * This is the source of truth for inventory availability.
 *
 * available-for-sale = quantity_available - quantity_reserved.
 * Reservations only move quantity_reserved; a commit decrements both counters,
 * a release decrements quantity_reserved alone.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "items", indexes = {
    @Index(name = "idx_item_name_unique", columnList = "name", unique = true),
    @Index(name = "idx_item_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Item {

    @Id
    @Column(name = "item_id", nullable = false, length = 36)
    private String itemId;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    /**
     * Price in minor currency units (cents).
     */
    @Column(name = "price_minor", nullable = false)
    private Long priceMinor;

    /**
     * Units physically in stock. Only a commit decrements it, only a restock increments it.
     */
    @Column(name = "quantity_available", nullable = false)
    private Integer quantityAvailable;

    /**
     * Units held by in-flight orders.
     */
    @Column(name = "quantity_reserved", nullable = false)
    private Integer quantityReserved;

    /**
     * Display only. Never consulted by reservation logic.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "stock_visibility", nullable = false, length = 10)
    private StockVisibility stockVisibility;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private ItemStatus status;

    /**
     * Digital items are delivered automatically from the digital asset pool.
     */
    @Column(name = "digital", nullable = false)
    private boolean digital;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (itemId == null) {
            itemId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (quantityAvailable == null) quantityAvailable = 0;
        if (quantityReserved == null) quantityReserved = 0;
        if (stockVisibility == null) stockVisibility = StockVisibility.EXACT;
        if (status == null) status = ItemStatus.ACTIVE;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public int availableForSale() {
        return quantityAvailable - quantityReserved;
    }

    /**
     * Whether the item can be put in a cart or checked out.
     */
    public boolean isPurchasable() {
        return status == ItemStatus.ACTIVE;
    }

    /**
     * How stock is shown to buyers.
     */
    public enum StockVisibility {
        /** Show the exact available-for-sale count. */
        EXACT,
        /** Show only "in stock" / "out of stock". */
        BINARY
    }

    public enum ItemStatus {
        ACTIVE,
        HIDDEN,
        /** Removed from the catalog; kept for order history. */
        REMOVED
    }
}
