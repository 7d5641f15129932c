package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-user account row: store credit and spend statistics.
 * lifetime_total is a cache recomputed from fulfilled orders; orders remain the source of truth.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "customers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Customer {

    @Id
    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "lifetime_total_minor", nullable = false)
    private Long lifetimeTotalMinor;

    @Column(name = "credit_balance_minor", nullable = false)
    private Long creditBalanceMinor;

    /**
     * For staff members: total value of orders they completed by hand.
     */
    @Column(name = "delivery_value_handled_minor", nullable = false)
    private Long deliveryValueHandledMinor;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
        if (lifetimeTotalMinor == null) lifetimeTotalMinor = 0L;
        if (creditBalanceMinor == null) creditBalanceMinor = 0L;
        if (deliveryValueHandledMinor == null) deliveryValueHandledMinor = 0L;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public static Customer newCustomer(String ownerId) {
        return Customer.builder()
                .ownerId(ownerId)
                .lifetimeTotalMinor(0L)
                .creditBalanceMinor(0L)
                .deliveryValueHandledMinor(0L)
                .build();
    }

    public void credit(long amountMinor) {
        creditBalanceMinor = creditBalanceMinor + amountMinor;
    }
}
