package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Stock held for one order line.
 * The ledger checks commit and release requests against these rows, so the
 * item counters can never drift from the orders that hold them.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "stock_reservations",
    uniqueConstraints = @UniqueConstraint(name = "uk_reservation_order_item", columnNames = {"order_id", "item_id"}),
    indexes = {
        @Index(name = "idx_reservation_order", columnList = "order_id"),
        @Index(name = "idx_reservation_status", columnList = "status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockReservation {

    @Id
    @Column(name = "reservation_id", nullable = false, length = 36)
    private String reservationId;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "item_id", nullable = false, length = 36)
    private String itemId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 12)
    private ReservationStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @PrePersist
    protected void onCreate() {
        if (reservationId == null) {
            reservationId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        if (status == null) {
            status = ReservationStatus.RESERVED;
        }
    }

    public boolean isOutstanding() {
        return status == ReservationStatus.RESERVED;
    }

    public void commit() {
        this.status = ReservationStatus.COMMITTED;
        this.resolvedAt = Instant.now();
    }

    public void release() {
        this.status = ReservationStatus.RELEASED;
        this.resolvedAt = Instant.now();
    }

    public enum ReservationStatus {
        /** Held, counted in the item's quantity_reserved. */
        RESERVED,
        /** Permanently removed from quantity_available. */
        COMMITTED,
        /** Returned to availability. */
        RELEASED
    }
}
