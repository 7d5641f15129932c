package com.cred.freestyle.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Confirmed payment for an order. At most one per order, enforced by a unique constraint.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "payments", indexes = {
    @Index(name = "idx_payment_order_unique", columnList = "order_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    public static final String SYSTEM_VERIFIER = "system";

    @Id
    @Column(name = "payment_id", nullable = false, length = 36)
    private String paymentId;

    @Column(name = "order_id", nullable = false, unique = true, length = 36)
    private String orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false, length = 10)
    private Order.PaymentMethod method;

    @Column(name = "external_ref", length = 100)
    private String externalRef;

    @Column(name = "verified_amount_minor")
    private Long verifiedAmountMinor;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "verified_at", nullable = false)
    private Instant verifiedAt;

    /**
     * "system" for automated verification, otherwise the attesting staff member's id.
     */
    @Column(name = "verifier_identity", nullable = false, length = 64)
    private String verifierIdentity;

    @Column(name = "evidence", length = 1000)
    private String evidence;

    @PrePersist
    protected void onCreate() {
        if (paymentId == null) {
            paymentId = UUID.randomUUID().toString();
        }
        if (verifiedAt == null) {
            verifiedAt = Instant.now();
        }
    }
}
