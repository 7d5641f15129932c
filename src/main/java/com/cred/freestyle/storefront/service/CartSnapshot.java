package com.cred.freestyle.storefront.service;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a cart at one point in time.
 *
 * @author Storefront Team
 */
public final class CartSnapshot {

    private final String ownerId;
    private final List<Line> lines;
    private final long totalMinor;
    private final Instant lastActivityAt;

    public CartSnapshot(String ownerId, List<Line> lines, Instant lastActivityAt) {
        this.ownerId = ownerId;
        this.lines = List.copyOf(lines);
        this.totalMinor = lines.stream().mapToLong(Line::getLineTotalMinor).sum();
        this.lastActivityAt = lastActivityAt;
    }

    public static CartSnapshot empty(String ownerId) {
        return new CartSnapshot(ownerId, List.of(), null);
    }

    public String getOwnerId() { return ownerId; }
    public List<Line> getLines() { return lines; }
    public long getTotalMinor() { return totalMinor; }
    public Instant getLastActivityAt() { return lastActivityAt; }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public static final class Line {

        private final String itemId;
        private final String itemName;
        private final int quantity;
        private final long priceSnapshotMinor;

        public Line(String itemId, String itemName, int quantity, long priceSnapshotMinor) {
            this.itemId = itemId;
            this.itemName = itemName;
            this.quantity = quantity;
            this.priceSnapshotMinor = priceSnapshotMinor;
        }

        public String getItemId() { return itemId; }
        public String getItemName() { return itemName; }
        public int getQuantity() { return quantity; }
        public long getPriceSnapshotMinor() { return priceSnapshotMinor; }

        public long getLineTotalMinor() {
            return priceSnapshotMinor * quantity;
        }
    }
}
