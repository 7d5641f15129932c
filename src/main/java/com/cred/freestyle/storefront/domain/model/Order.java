package com.cred.freestyle.storefront.domain.model;

import com.cred.freestyle.storefront.exception.InvalidOrderStateException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Order created from a validated cart snapshot.
 * Lines and total are fixed at creation. Orders are never deleted.
 *
 * State machine (forward only):
 * CREATED -> AWAITING_PAYMENT -> PAID -> FULFILLED -> REVIEWED,
 * with side exits AWAITING_PAYMENT -> CANCELLED and PAID -> REFUNDED.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_order_owner", columnList = "owner_id"),
    @Index(name = "idx_order_state", columnList = "state"),
    @Index(name = "idx_order_payment_ref", columnList = "payment_ref"),
    @Index(name = "idx_order_expires_at", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_lines", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_index")
    @Builder.Default
    private List<OrderLine> lines = new ArrayList<>();

    /**
     * Sum of unit price x quantity over the lines, in minor units.
     */
    @Column(name = "total_minor", nullable = false, updatable = false)
    private Long totalMinor;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private OrderState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 10)
    private PaymentMethod paymentMethod;

    /**
     * Provider-side reference (PayPal order id, or the crypto payment reference).
     */
    @Column(name = "payment_ref", length = 100)
    private String paymentRef;

    @Column(name = "approval_url", length = 500)
    private String approvalUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "state_changed_at", nullable = false)
    private Instant stateChangedAt;

    /**
     * End of the payment window while AWAITING_PAYMENT.
     */
    @Column(name = "expires_at")
    private Instant expiresAt;

    /**
     * Buyer reported a manual (crypto) payment; the order waits for staff instead of expiring.
     */
    @Column(name = "manual_verification_requested_at")
    private Instant manualVerificationRequestedAt;

    /**
     * Last payment verification problem surfaced to staff (amount or currency mismatch).
     */
    @Column(name = "payment_issue", length = 500)
    private String paymentIssue;

    /**
     * Paid but waiting for a staff member to deliver non-digital lines.
     */
    @Column(name = "manual_fulfillment_pending", nullable = false)
    private boolean manualFulfillmentPending;

    @Column(name = "fulfillment_issue", length = 500)
    private String fulfillmentIssue;

    @Column(name = "fulfilled_by", length = 64)
    private String fulfilledBy;

    @Column(name = "fulfillment_note", length = 500)
    private String fulfillmentNote;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "review_rating")
    private Integer reviewRating;

    @Column(name = "review_text", length = 2000)
    private String reviewText;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (orderId == null) {
            orderId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        if (state == null) {
            state = OrderState.CREATED;
        }
        if (stateChangedAt == null) {
            stateChangedAt = createdAt;
        }
    }

    /**
     * Compute the total of a set of lines.
     */
    public static long totalOf(List<OrderLine> lines) {
        return lines.stream().mapToLong(OrderLine::lineTotalMinor).sum();
    }

    /**
     * Apply a forward transition.
     *
     * @param next target state
     * @return true if the state changed, false if the order was already in {@code next}
     * @throws InvalidOrderStateException if the transition is not a legal forward move
     */
    public boolean transitionTo(OrderState next) {
        if (state == next) {
            return false;
        }
        if (!state.canAdvanceTo(next)) {
            throw new InvalidOrderStateException(orderId, state, next);
        }
        state = next;
        stateChangedAt = Instant.now();
        return true;
    }

    /**
     * Whether payment has been confirmed at some point (PAID or any later state reached from it).
     */
    public boolean isPaymentConfirmed() {
        return state == OrderState.PAID || state == OrderState.FULFILLED
                || state == OrderState.REVIEWED || state == OrderState.REFUNDED;
    }

    public boolean isAwaitingManualVerification() {
        return state == OrderState.AWAITING_PAYMENT && manualVerificationRequestedAt != null;
    }

    public boolean hasDigitalLines() {
        return lines.stream().anyMatch(OrderLine::isDigital);
    }

    public boolean hasPhysicalLines() {
        return lines.stream().anyMatch(line -> !line.isDigital());
    }

    /**
     * Order state enum with its legal forward transitions.
     */
    public enum OrderState {
        CREATED,
        AWAITING_PAYMENT,
        PAID,
        FULFILLED,
        REVIEWED,
        CANCELLED,
        REFUNDED;

        private Set<OrderState> successors() {
            switch (this) {
                case CREATED:
                    return EnumSet.of(AWAITING_PAYMENT, CANCELLED);
                case AWAITING_PAYMENT:
                    return EnumSet.of(PAID, CANCELLED);
                case PAID:
                    return EnumSet.of(FULFILLED, REFUNDED);
                case FULFILLED:
                    return EnumSet.of(REVIEWED);
                default:
                    return EnumSet.noneOf(OrderState.class);
            }
        }

        public boolean canAdvanceTo(OrderState next) {
            return successors().contains(next);
        }

        public boolean isTerminal() {
            return successors().isEmpty();
        }
    }

    public enum PaymentMethod {
        /** Automated verification against the PayPal Orders API. */
        PAYPAL,
        /** Manual staff attestation. */
        CRYPTO
    }
}
