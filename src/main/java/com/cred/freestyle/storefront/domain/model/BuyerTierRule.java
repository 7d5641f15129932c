package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A role granted once lifetime spend reaches the threshold.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "buyer_tier_rules", indexes = {
    @Index(name = "idx_tier_threshold_unique", columnList = "spend_threshold_minor", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuyerTierRule {

    @Id
    @Column(name = "role_id", nullable = false, length = 64)
    private String roleId;

    @Column(name = "spend_threshold_minor", nullable = false, unique = true)
    private Long spendThresholdMinor;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
