package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.domain.model.Payment;
import com.cred.freestyle.storefront.exception.InvalidOrderStateException;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.repository.PaymentRepository;
import com.cred.freestyle.storefront.service.payment.PaymentInitiation;
import com.cred.freestyle.storefront.service.payment.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Order lifecycle after checkout: payment confirmation, cancellation, expiry, refunds, reviews.
 *
 * Every state change locks the order row first. Transitions only move forward along
 * {@link OrderState}; repeating a transition the order already made is a no-op, which is what
 * makes payment confirmation and cancellation safe to retry.
 *
 * @author Storefront Team
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final InventoryLedger inventoryLedger;
    private final ApplicationEventPublisher eventPublisher;
    private final StorefrontMetricsService metricsService;

    public OrderService(
            OrderRepository orderRepository,
            PaymentRepository paymentRepository,
            InventoryLedger inventoryLedger,
            ApplicationEventPublisher eventPublisher,
            StorefrontMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
        this.inventoryLedger = inventoryLedger;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    // ===== Queries =====

    @Transactional(readOnly = true)
    public Order getOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    /**
     * Fetch an order on behalf of its owner. Orders of other users are reported as not found.
     */
    @Transactional(readOnly = true)
    public Order getOrderForOwner(String orderId, String ownerId) {
        Order order = getOrder(orderId);
        if (!order.getOwnerId().equals(ownerId)) {
            throw new ResourceNotFoundException("Order", orderId);
        }
        return order;
    }

    @Transactional(readOnly = true)
    public List<Order> listOrders(String ownerId) {
        return orderRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    @Transactional(readOnly = true)
    public List<Order> listAwaitingManualVerification() {
        return orderRepository.findByStateAndManualVerificationRequestedAtIsNotNullOrderByCreatedAtAsc(
                OrderState.AWAITING_PAYMENT);
    }

    @Transactional(readOnly = true)
    public List<Order> listAwaitingManualFulfillment() {
        return orderRepository.findByStateAndManualFulfillmentPendingTrueOrderByCreatedAtAsc(OrderState.PAID);
    }

    // ===== Payment =====

    /**
     * Store the provider reference of a freshly created order and tell the buyer how to pay.
     */
    @Transactional
    public Order recordPaymentInitiation(String orderId, PaymentInitiation initiation) {
        Order order = lockOrder(orderId);
        order.setPaymentRef(initiation.getPaymentRef());
        order.setApprovalUrl(initiation.getApprovalUrl());
        Order saved = orderRepository.save(order);

        StoreNotification notification = StoreNotification.of(
                        StoreNotification.Type.ORDER_AWAITING_PAYMENT, order.getOwnerId(), orderId)
                .with("method", order.getPaymentMethod().name())
                .with("totalMinor", order.getTotalMinor())
                .with("currency", order.getCurrency())
                .with("expiresAt", String.valueOf(order.getExpiresAt()));
        if (initiation.getApprovalUrl() != null) {
            notification.with("approvalUrl", initiation.getApprovalUrl());
        }
        if (initiation.getInstructions() != null) {
            notification.with("instructions", initiation.getInstructions());
        }
        eventPublisher.publishEvent(notification);
        return saved;
    }

    /**
     * Move an order to PAID and record its Payment.
     * Idempotent: an order whose payment is already confirmed is left untouched.
     *
     * @return true if this call confirmed the payment
     * @throws InvalidOrderStateException if the order can no longer be paid (e.g. cancelled)
     */
    @Transactional
    public boolean markPaid(String orderId, VerificationResult result) {
        if (!result.isConfirmed()) {
            throw new IllegalArgumentException("Only confirmed verifications can mark an order paid");
        }

        Order order = lockOrder(orderId);
        if (order.isPaymentConfirmed() || paymentRepository.existsByOrderId(orderId)) {
            logger.info("Payment for order {} already confirmed, skipping", orderId);
            metricsService.recordDuplicateSkipped("mark_paid");
            return false;
        }

        order.transitionTo(OrderState.PAID);
        order.setExpiresAt(null);
        order.setPaymentIssue(null);
        orderRepository.save(order);

        paymentRepository.save(Payment.builder()
                .orderId(orderId)
                .method(order.getPaymentMethod())
                .externalRef(result.getExternalRef())
                .verifiedAmountMinor(result.getAmountMinor())
                .currency(result.getCurrency())
                .verifiedAt(Instant.now())
                .verifierIdentity(result.getVerifierIdentity())
                .evidence(result.getEvidence())
                .build());

        metricsService.recordOrderTransition(OrderState.PAID.name());
        metricsService.recordPaymentOutcome(order.getPaymentMethod().name(), "confirmed");
        metricsService.recordRevenue(order.getCurrency(), order.getTotalMinor());

        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.ORDER_CONFIRMED, order.getOwnerId(), orderId)
                .with("totalMinor", order.getTotalMinor())
                .with("verifiedBy", result.getVerifierIdentity()));

        logger.info("Order {} paid ({} {} verified by {})", orderId,
                result.getAmountMinor(), result.getCurrency(), result.getVerifierIdentity());
        return true;
    }

    /**
     * Record a payment problem on the order, leaving it in its current state.
     *
     * @return true if the issue differs from the one already recorded
     */
    @Transactional
    public boolean recordPaymentIssue(String orderId, String issue) {
        Order order = lockOrder(orderId);
        if (Objects.equals(order.getPaymentIssue(), issue)) {
            return false;
        }
        order.setPaymentIssue(issue);
        orderRepository.save(order);
        return true;
    }

    /**
     * Flag a crypto order for staff attention. Orders with a pending verification request are
     * not expired by the sweep.
     */
    @Transactional
    public Order requestManualVerification(String orderId, String ownerId) {
        Order order = lockOrder(orderId);
        if (!order.getOwnerId().equals(ownerId)) {
            throw new ResourceNotFoundException("Order", orderId);
        }
        if (order.getPaymentMethod() != PaymentMethod.CRYPTO) {
            throw new IllegalArgumentException("Manual verification is only available for crypto payments");
        }
        if (order.getState() != OrderState.AWAITING_PAYMENT) {
            throw new InvalidOrderStateException(orderId, order.getState(), OrderState.PAID);
        }
        if (order.getManualVerificationRequestedAt() != null) {
            return order;
        }

        order.setManualVerificationRequestedAt(Instant.now());
        Order saved = orderRepository.save(order);

        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.MANUAL_VERIFICATION_REQUESTED, ownerId, orderId)
                .with("totalMinor", order.getTotalMinor())
                .with("currency", order.getCurrency()));
        logger.info("Manual payment verification requested for order {}", orderId);
        return saved;
    }

    // ===== Cancellation =====

    /**
     * Cancel an order and release its reserved stock. Cancelling a cancelled order is a no-op.
     *
     * @throws InvalidOrderStateException if payment has already been confirmed
     */
    @Transactional
    public Order cancel(String orderId, String reason) {
        Order order = lockOrder(orderId);
        if (order.getState() == OrderState.CANCELLED) {
            return order;
        }
        return doCancel(order, reason);
    }

    @Transactional
    public Order cancelByOwner(String orderId, String ownerId) {
        Order order = lockOrder(orderId);
        if (!order.getOwnerId().equals(ownerId)) {
            throw new ResourceNotFoundException("Order", orderId);
        }
        if (order.getState() == OrderState.CANCELLED) {
            return order;
        }
        return doCancel(order, "Cancelled by buyer");
    }

    /**
     * Cancel an order whose payment window has passed.
     *
     * @return true if the order was expired by this call
     */
    @Transactional
    public boolean expire(String orderId, Instant now) {
        Order order = lockOrder(orderId);
        boolean due = order.getState() == OrderState.AWAITING_PAYMENT
                && order.getExpiresAt() != null
                && !order.getExpiresAt().isAfter(now)
                && order.getManualVerificationRequestedAt() == null
                && order.getPaymentIssue() == null;
        if (!due) {
            logger.debug("Order {} no longer due for expiry (state {})", orderId, order.getState());
            return false;
        }
        doCancel(order, "Payment window expired");
        return true;
    }

    private Order doCancel(Order order, String reason) {
        order.transitionTo(OrderState.CANCELLED);
        order.setCancellationReason(reason);
        order.setExpiresAt(null);

        if (inventoryLedger.hasOutstanding(order.getOrderId())) {
            inventoryLedger.releaseAll(order.getOrderId(), order.getLines());
        }

        Order saved = orderRepository.save(order);
        metricsService.recordOrderTransition(OrderState.CANCELLED.name());

        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.ORDER_CANCELLED, order.getOwnerId(), order.getOrderId())
                .with("reason", reason));
        logger.info("Order {} cancelled: {}", order.getOrderId(), reason);
        return saved;
    }

    // ===== After payment =====

    /**
     * Refund a paid order. Stock still held for it is treated as sold; nothing is put back.
     */
    @Transactional
    public Order refund(String orderId, String staffId, String reason) {
        Order order = lockOrder(orderId);
        if (order.getState() == OrderState.REFUNDED) {
            return order;
        }
        order.transitionTo(OrderState.REFUNDED);
        order.setManualFulfillmentPending(false);
        order.setCancellationReason(reason);

        int committed = inventoryLedger.commitOutstanding(orderId);
        Order saved = orderRepository.save(order);
        metricsService.recordOrderTransition(OrderState.REFUNDED.name());

        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.ORDER_REFUNDED, order.getOwnerId(), orderId)
                .with("staffId", staffId)
                .with("reason", reason));
        logger.info("Order {} refunded by {} ({} held reservations committed)", orderId, staffId, committed);
        return saved;
    }

    /**
     * Attach the buyer's review to a fulfilled order. Re-reviewing is a no-op.
     */
    @Transactional
    public Order submitReview(String orderId, String ownerId, int rating, String text) {
        if (rating < 1 || rating > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5");
        }
        Order order = lockOrder(orderId);
        if (!order.getOwnerId().equals(ownerId)) {
            throw new ResourceNotFoundException("Order", orderId);
        }
        if (order.getState() == OrderState.REVIEWED) {
            return order;
        }

        order.transitionTo(OrderState.REVIEWED);
        order.setReviewRating(rating);
        order.setReviewText(text);
        Order saved = orderRepository.save(order);
        metricsService.recordOrderTransition(OrderState.REVIEWED.name());

        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.ORDER_REVIEWED, ownerId, orderId)
                .with("rating", rating)
                .with("text", text == null ? "" : text));
        return saved;
    }

    /**
     * Record why fulfillment failed. Runs in its own transaction so the note survives the
     * rollback of the failed fulfillment attempt.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFulfillmentIssue(String orderId, String issue) {
        Order order = lockOrder(orderId);
        order.setFulfillmentIssue(issue);
        orderRepository.save(order);
    }

    Order lockOrder(String orderId) {
        return orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }
}
