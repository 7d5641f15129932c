package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per-owner selection of items prior to checkout.
 * A cart holds at most one line per item; adding an item again merges the quantity.
 * Nothing in a cart reserves stock.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "carts", indexes = {
    @Index(name = "idx_cart_last_activity", columnList = "last_activity_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cart {

    @Id
    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cart_lines", joinColumns = @JoinColumn(name = "owner_id"))
    @OrderColumn(name = "line_index")
    @Builder.Default
    private List<CartLine> lines = new ArrayList<>();

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    /**
     * Set when an inactivity reminder is sent; a reminder is due again only after new activity.
     */
    @Column(name = "last_reminded_at")
    private Instant lastRemindedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (lastActivityAt == null) {
            lastActivityAt = Instant.now();
        }
    }

    public static Cart emptyFor(String ownerId) {
        return Cart.builder()
                .ownerId(ownerId)
                .lastActivityAt(Instant.now())
                .build();
    }

    public Optional<CartLine> findLine(String itemId) {
        return lines.stream()
                .filter(line -> line.getItemId().equals(itemId))
                .findFirst();
    }

    /**
     * Add quantity for an item, creating the line with the given price snapshot if absent.
     * An existing line keeps its original snapshot.
     *
     * @return the resulting line
     */
    public CartLine addOrMerge(String itemId, int quantity, long priceMinor, Instant now) {
        CartLine line = findLine(itemId).orElse(null);
        if (line == null) {
            line = CartLine.builder()
                    .itemId(itemId)
                    .quantity(quantity)
                    .priceSnapshotMinor(priceMinor)
                    .addedAt(now)
                    .build();
            lines.add(line);
        } else {
            line.setQuantity(line.getQuantity() + quantity);
        }
        touch(now);
        return line;
    }

    /**
     * Remove an item, or decrement it when a quantity is given.
     *
     * @return true if the cart changed
     */
    public boolean remove(String itemId, Integer quantity, Instant now) {
        CartLine line = findLine(itemId).orElse(null);
        if (line == null) {
            return false;
        }
        if (quantity == null || quantity >= line.getQuantity()) {
            lines.remove(line);
        } else {
            line.setQuantity(line.getQuantity() - quantity);
        }
        touch(now);
        return true;
    }

    public void removeItems(Collection<String> itemIds, Instant now) {
        lines.removeIf(line -> itemIds.contains(line.getItemId()));
        touch(now);
    }

    public void clear(Instant now) {
        lines.clear();
        touch(now);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public long totalMinor() {
        return lines.stream().mapToLong(CartLine::lineTotalMinor).sum();
    }

    private void touch(Instant now) {
        lastActivityAt = now;
    }
}
