package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A deliverable unit of a digital item (license key, access code, download link).
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "digital_assets", indexes = {
    @Index(name = "idx_asset_item_status", columnList = "item_id, status"),
    @Index(name = "idx_asset_order", columnList = "order_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigitalAsset {

    @Id
    @Column(name = "asset_id", nullable = false, length = 36)
    private String assetId;

    @Column(name = "item_id", nullable = false, length = 36)
    private String itemId;

    @Column(name = "payload", nullable = false, length = 1000)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private AssetStatus status;

    @Column(name = "order_id", length = 36)
    private String orderId;

    @Column(name = "issued_at")
    private Instant issuedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (assetId == null) {
            assetId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        if (status == null) {
            status = AssetStatus.AVAILABLE;
        }
    }

    public void issueTo(String orderId) {
        this.status = AssetStatus.ISSUED;
        this.orderId = orderId;
        this.issuedAt = Instant.now();
    }

    public enum AssetStatus {
        AVAILABLE,
        ISSUED
    }
}
