package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.DigitalAsset;
import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.OrderLine;
import com.cred.freestyle.storefront.domain.model.Payment;
import com.cred.freestyle.storefront.exception.FulfillmentFailureException;
import com.cred.freestyle.storefront.exception.InvalidOrderStateException;
import com.cred.freestyle.storefront.exception.ReservationInvariantViolationException;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.DigitalAssetRepository;
import com.cred.freestyle.storefront.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Delivers paid orders.
 *
 * Dispatch commits the order's reserved stock and issues digital units from the item's asset
 * pool. An all-digital order is FULFILLED right away; an order with physical lines waits for a
 * staff member to complete it. A failed dispatch rolls back entirely and the order stays PAID
 * with the reason recorded, so it can be retried.
 *
 * Tier evaluation runs after the fulfillment transaction has committed, so the new order counts
 * towards the buyer's lifetime spend.
 *
 * @author Storefront Team
 */
@Service
public class FulfillmentDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(FulfillmentDispatcher.class);

    private final OrderRepository orderRepository;
    private final DigitalAssetRepository digitalAssetRepository;
    private final InventoryLedger inventoryLedger;
    private final OrderService orderService;
    private final CustomerService customerService;
    private final BuyerTierEvaluator tierEvaluator;
    private final ApplicationEventPublisher eventPublisher;
    private final StorefrontMetricsService metricsService;
    private final TransactionTemplate transactionTemplate;

    public FulfillmentDispatcher(
            OrderRepository orderRepository,
            DigitalAssetRepository digitalAssetRepository,
            InventoryLedger inventoryLedger,
            OrderService orderService,
            CustomerService customerService,
            BuyerTierEvaluator tierEvaluator,
            ApplicationEventPublisher eventPublisher,
            StorefrontMetricsService metricsService,
            PlatformTransactionManager transactionManager
    ) {
        this.orderRepository = orderRepository;
        this.digitalAssetRepository = digitalAssetRepository;
        this.inventoryLedger = inventoryLedger;
        this.orderService = orderService;
        this.customerService = customerService;
        this.tierEvaluator = tierEvaluator;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Dispatch a PAID order. Orders in any other state, or already handed to staff, are left alone.
     *
     * @throws FulfillmentFailureException if digital stock ran out
     * @throws ReservationInvariantViolationException if the order's reservations are inconsistent
     */
    public Order dispatch(String orderId) {
        Order order;
        try {
            order = transactionTemplate.execute(status -> doDispatch(orderId));
        } catch (FulfillmentFailureException | ReservationInvariantViolationException e) {
            handleFailure(orderId, e);
            throw e;
        }

        if (order.getState() == OrderState.FULFILLED) {
            tierEvaluator.evaluate(order.getOwnerId());
        }
        return order;
    }

    /**
     * Run dispatch again for an order whose previous attempt failed.
     */
    public Order retryFulfillment(String orderId) {
        logger.info("Retrying fulfillment for order {}", orderId);
        return dispatch(orderId);
    }

    /**
     * Staff completion of an order that needs manual delivery.
     * Completing an order that is already FULFILLED or REVIEWED is a no-op.
     */
    public Order completeOrder(String orderId, String staffId, String note) {
        if (staffId == null || staffId.isBlank()) {
            throw new IllegalArgumentException("Staff identity is required");
        }

        Order order = transactionTemplate.execute(status -> {
            Order locked = lockOrder(orderId);
            if (locked.getState() == OrderState.FULFILLED || locked.getState() == OrderState.REVIEWED) {
                logger.info("Order {} already fulfilled, nothing to complete", orderId);
                return locked;
            }
            if (locked.getState() != OrderState.PAID) {
                throw new InvalidOrderStateException(orderId, locked.getState(), OrderState.FULFILLED);
            }

            inventoryLedger.commitOutstanding(orderId);
            locked.transitionTo(OrderState.FULFILLED);
            locked.setFulfilledBy(staffId);
            locked.setFulfillmentNote(note);
            locked.setManualFulfillmentPending(false);
            locked.setFulfillmentIssue(null);
            Order saved = orderRepository.save(locked);

            customerService.recordDeliveryHandled(staffId, saved.getTotalMinor());
            metricsService.recordOrderTransition(OrderState.FULFILLED.name());
            metricsService.recordFulfillment("manual");

            eventPublisher.publishEvent(StoreNotification.of(
                            StoreNotification.Type.ORDER_FULFILLED, saved.getOwnerId(), orderId)
                    .with("fulfilledBy", staffId)
                    .with("note", note == null ? "" : note));
            logger.info("Order {} completed by {}", orderId, staffId);
            return saved;
        });

        tierEvaluator.evaluate(order.getOwnerId());
        return order;
    }

    private Order doDispatch(String orderId) {
        Order order = lockOrder(orderId);
        if (order.getState() != OrderState.PAID) {
            logger.debug("Order {} is {}, nothing to dispatch", orderId, order.getState());
            return order;
        }
        if (order.isManualFulfillmentPending()) {
            logger.debug("Order {} already dispatched, waiting for staff", orderId);
            return order;
        }

        List<String> deliveredPayloads = issueDigitalUnits(order);
        inventoryLedger.commitAll(orderId, order.getLines());
        order.setFulfillmentIssue(null);

        if (!deliveredPayloads.isEmpty()) {
            eventPublisher.publishEvent(StoreNotification.of(
                            StoreNotification.Type.DIGITAL_DELIVERY, order.getOwnerId(), orderId)
                    .with("payloads", deliveredPayloads));
        }

        if (order.hasPhysicalLines()) {
            order.setManualFulfillmentPending(true);
            metricsService.recordFulfillment("manual_pending");
            eventPublisher.publishEvent(StoreNotification.of(
                            StoreNotification.Type.MANUAL_FULFILLMENT_REQUIRED, order.getOwnerId(), orderId)
                    .with("totalMinor", order.getTotalMinor()));
            logger.info("Order {} handed to staff for delivery", orderId);
        } else {
            order.transitionTo(OrderState.FULFILLED);
            order.setFulfilledBy(Payment.SYSTEM_VERIFIER);
            metricsService.recordOrderTransition(OrderState.FULFILLED.name());
            metricsService.recordFulfillment("automatic");
            eventPublisher.publishEvent(StoreNotification.of(
                    StoreNotification.Type.ORDER_FULFILLED, order.getOwnerId(), orderId));
            logger.info("Order {} fulfilled automatically", orderId);
        }

        return orderRepository.save(order);
    }

    private List<String> issueDigitalUnits(Order order) {
        List<String> payloads = new ArrayList<>();
        for (OrderLine line : order.getLines()) {
            if (!line.isDigital()) {
                continue;
            }
            List<DigitalAsset> assets = digitalAssetRepository.findAvailableForUpdate(
                    line.getItemId(), PageRequest.of(0, line.getQuantity()));
            if (assets.size() < line.getQuantity()) {
                throw new FulfillmentFailureException(order.getOrderId(), String.format(
                        "only %d of %d digital units left for %s",
                        assets.size(), line.getQuantity(), line.getItemName()));
            }
            for (DigitalAsset asset : assets) {
                asset.issueTo(order.getOrderId());
                digitalAssetRepository.save(asset);
                payloads.add(asset.getPayload());
            }
        }
        return payloads;
    }

    private void handleFailure(String orderId, RuntimeException failure) {
        logger.error("Fulfillment of order {} failed: {}", orderId, failure.getMessage(), failure);
        metricsService.recordFulfillment("failed");
        metricsService.recordError(failure.getClass().getSimpleName(), "dispatch");

        orderService.recordFulfillmentIssue(orderId, failure.getMessage());
        Order order = orderService.getOrder(orderId);
        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.FULFILLMENT_FAILED, order.getOwnerId(), orderId)
                .with("reason", failure.getMessage()));
    }

    private Order lockOrder(String orderId) {
        return orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }
}
