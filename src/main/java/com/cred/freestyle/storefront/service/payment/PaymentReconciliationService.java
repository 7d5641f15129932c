package com.cred.freestyle.storefront.service.payment;

import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.exception.FulfillmentFailureException;
import com.cred.freestyle.storefront.exception.InvalidOrderStateException;
import com.cred.freestyle.storefront.exception.PaymentMismatchException;
import com.cred.freestyle.storefront.exception.ReservationInvariantViolationException;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.service.FulfillmentDispatcher;
import com.cred.freestyle.storefront.service.OrderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Applies payment verification results to orders.
 *
 * Entry points are the payment poller, the provider callback and staff attestation. All three end
 * in the same place: a confirmed payment marks the order PAID (once, however many times the
 * confirmation arrives) and dispatches it; a mismatch is recorded on the order, which stays
 * AWAITING_PAYMENT; a payment the provider reports as failed cancels the order. A pending payment
 * the provider reports inconsistently is recorded as an issue and left for staff.
 *
 * @author Storefront Team
 */
@Service
public class PaymentReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentReconciliationService.class);

    private final OrderService orderService;
    private final OrderRepository orderRepository;
    private final AutomatedPaymentVerifier automatedVerifier;
    private final ManualPaymentVerifier manualVerifier;
    private final FulfillmentDispatcher fulfillmentDispatcher;
    private final ApplicationEventPublisher eventPublisher;
    private final StorefrontMetricsService metricsService;

    public PaymentReconciliationService(
            OrderService orderService,
            OrderRepository orderRepository,
            AutomatedPaymentVerifier automatedVerifier,
            ManualPaymentVerifier manualVerifier,
            FulfillmentDispatcher fulfillmentDispatcher,
            ApplicationEventPublisher eventPublisher,
            StorefrontMetricsService metricsService
    ) {
        this.orderService = orderService;
        this.orderRepository = orderRepository;
        this.automatedVerifier = automatedVerifier;
        this.manualVerifier = manualVerifier;
        this.fulfillmentDispatcher = fulfillmentDispatcher;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Verify the payment of an order and act on the result.
     *
     * @throws PaymentMismatchException if the provider captured a different amount or currency
     */
    public Order reconcile(String orderId) {
        Order order = orderService.getOrder(orderId);
        if (order.isPaymentConfirmed()) {
            logger.debug("Order {} already paid, ignoring repeated confirmation", orderId);
            metricsService.recordDuplicateSkipped("reconcile");
            return order;
        }
        if (order.getState() != OrderState.AWAITING_PAYMENT) {
            logger.info("Order {} is {}, not reconciling payment", orderId, order.getState());
            return order;
        }

        PaymentVerifier verifier = order.getPaymentMethod() == PaymentMethod.PAYPAL ? automatedVerifier : manualVerifier;
        return apply(order, verifier.verify(order));
    }

    /**
     * Provider notification that something happened to a payment. The notification itself is not
     * trusted; the payment is looked up again through the verifier.
     */
    public Order handleProviderCallback(String paymentRef) {
        Order order = orderRepository.findByPaymentRef(paymentRef)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentRef));
        logger.info("Provider callback for payment {} (order {})", paymentRef, order.getOrderId());
        return reconcile(order.getOrderId());
    }

    /**
     * Staff confirmation of a crypto payment.
     */
    public Order attest(String orderId, String staffId, String evidence) {
        Order order = orderService.getOrder(orderId);
        if (order.getPaymentMethod() != PaymentMethod.CRYPTO) {
            throw new IllegalArgumentException("Only crypto payments are attested by staff");
        }
        if (order.isPaymentConfirmed()) {
            metricsService.recordDuplicateSkipped("attest");
            return order;
        }
        return apply(order, manualVerifier.attest(order, staffId, evidence));
    }

    private Order apply(Order order, VerificationResult result) {
        String orderId = order.getOrderId();
        String method = order.getPaymentMethod().name();

        switch (result.getOutcome()) {
            case PENDING:
                if (result.getIssue() != null) {
                    metricsService.recordPaymentOutcome(method, "unresolved");
                    String issue = result.getIssue() + ": " + result.getEvidence();
                    if (orderService.recordPaymentIssue(orderId, issue)) {
                        eventPublisher.publishEvent(StoreNotification.of(
                                        StoreNotification.Type.PAYMENT_MISMATCH, order.getOwnerId(), orderId)
                                .with("issue", issue));
                    }
                    return orderService.getOrder(orderId);
                }
                return order;

            case REJECTED:
                if (result.isMismatch()) {
                    metricsService.recordPaymentOutcome(method, "mismatch");
                    String issue = String.format("%s: expected %d %s, received %s %s",
                            result.getRejectionReason(), order.getTotalMinor(), order.getCurrency(),
                            result.getAmountMinor(), result.getCurrency());
                    if (orderService.recordPaymentIssue(orderId, issue)) {
                        eventPublisher.publishEvent(StoreNotification.of(
                                        StoreNotification.Type.PAYMENT_MISMATCH, order.getOwnerId(), orderId)
                                .with("issue", issue));
                    }
                    throw new PaymentMismatchException(orderId, order.getTotalMinor(), result.getAmountMinor(),
                            order.getCurrency(), result.getCurrency());
                }
                metricsService.recordPaymentOutcome(method, "failed");
                return orderService.cancel(orderId, "Payment failed (" + result.getEvidence() + ")");

            default:
                return confirm(orderId, result);
        }
    }

    private Order confirm(String orderId, VerificationResult result) {
        boolean newlyPaid;
        try {
            newlyPaid = orderService.markPaid(orderId, result);
        } catch (InvalidOrderStateException e) {
            logger.error("Payment {} confirmed for order {} which can no longer be paid",
                    result.getExternalRef(), orderId, e);
            orderService.recordPaymentIssue(orderId, "Payment confirmed after order was " + e.getCurrentState());
            throw e;
        }

        if (newlyPaid) {
            try {
                fulfillmentDispatcher.dispatch(orderId);
            } catch (FulfillmentFailureException | ReservationInvariantViolationException e) {
                logger.warn("Order {} paid but not dispatched: {}", orderId, e.getMessage());
            }
        }
        return orderService.getOrder(orderId);
    }
}
