package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One (item, quantity) selection in a cart.
 * The price snapshot is fixed when the line is first added.
 *
 * @author Storefront Team
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLine {

    @Column(name = "item_id", nullable = false, length = 36)
    private String itemId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "price_snapshot_minor", nullable = false)
    private Long priceSnapshotMinor;

    @Column(name = "added_at", nullable = false)
    private Instant addedAt;

    public long lineTotalMinor() {
        return priceSnapshotMinor * quantity;
    }
}
