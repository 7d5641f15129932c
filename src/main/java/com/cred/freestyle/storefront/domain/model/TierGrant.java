package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a tier role was granted to a buyer. One row per (owner, role), ever.
 * A revoked grant stays in place so evaluation never grants the role again.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "tier_grants",
    uniqueConstraints = @UniqueConstraint(name = "uk_tier_grant_owner_role", columnNames = {"owner_id", "role_id"}),
    indexes = @Index(name = "idx_tier_grant_owner", columnList = "owner_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierGrant {

    @Id
    @Column(name = "grant_id", nullable = false, length = 36)
    private String grantId;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "role_id", nullable = false, length = 64)
    private String roleId;

    @Column(name = "granted_at", nullable = false)
    private Instant grantedAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revoked_by", length = 64)
    private String revokedBy;

    @PrePersist
    protected void onCreate() {
        if (grantId == null) {
            grantId = UUID.randomUUID().toString();
        }
        if (grantedAt == null) {
            grantedAt = Instant.now();
        }
    }

    public boolean isActive() {
        return revokedAt == null;
    }

    public void revoke(String adminId) {
        this.revokedAt = Instant.now();
        this.revokedBy = adminId;
    }
}
