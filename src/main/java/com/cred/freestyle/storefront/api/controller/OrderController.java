package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.CheckoutRequest;
import com.cred.freestyle.storefront.api.dto.CompleteOrderRequest;
import com.cred.freestyle.storefront.api.dto.OrderResponse;
import com.cred.freestyle.storefront.api.dto.RefundRequest;
import com.cred.freestyle.storefront.api.dto.ReviewRequest;
import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.service.CheckoutService;
import com.cred.freestyle.storefront.service.FulfillmentDispatcher;
import com.cred.freestyle.storefront.service.OrderService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for order operations.
 * Handles checkout, the buyer's order actions and the staff fulfillment actions.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/orders")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final CheckoutService checkoutService;
    private final OrderService orderService;
    private final FulfillmentDispatcher fulfillmentDispatcher;

    public OrderController(
            CheckoutService checkoutService,
            OrderService orderService,
            FulfillmentDispatcher fulfillmentDispatcher
    ) {
        this.checkoutService = checkoutService;
        this.orderService = orderService;
        this.fulfillmentDispatcher = fulfillmentDispatcher;
    }

    /**
     * Turn the caller's cart into an order awaiting payment.
     *
     * Flow:
     * 1. Cart lines are re-validated against the current catalog
     * 2. Stock for every line is reserved atomically
     * 3. The cart is emptied and payment is initiated with the chosen method
     *
     * @param request chosen payment method
     * @param userId caller
     * @return the order, with approval URL or payment instructions
     */
    @PostMapping("/checkout")
    public ResponseEntity<OrderResponse> checkout(
            @Valid @RequestBody CheckoutRequest request,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        logger.info("Processing checkout - user: {}, method: {}", userId, request.getPaymentMethod());

        Order order = checkoutService.checkout(userId, request.getPaymentMethod());

        logger.info("Checkout complete - order: {}, user: {}", order.getOrderId(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.fromEntity(order));
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> listOrders(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        List<OrderResponse> orders = orderService.listOrders(userId)
                .stream()
                .map(OrderResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(orders);
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(
            @PathVariable String orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        return ResponseEntity.ok(OrderResponse.fromEntity(orderService.getOrderForOwner(orderId, userId)));
    }

    /**
     * Cancel an unpaid order. Held stock goes back on sale.
     */
    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable String orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        return ResponseEntity.ok(OrderResponse.fromEntity(orderService.cancelByOwner(orderId, userId)));
    }

    /**
     * Ask staff to verify a crypto payment. The order stops expiring once this is requested.
     */
    @PostMapping("/{orderId}/manual-verification")
    public ResponseEntity<OrderResponse> requestManualVerification(
            @PathVariable String orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        return ResponseEntity.ok(OrderResponse.fromEntity(
                orderService.requestManualVerification(orderId, userId)));
    }

    @PostMapping("/{orderId}/review")
    public ResponseEntity<OrderResponse> submitReview(
            @PathVariable String orderId,
            @Valid @RequestBody ReviewRequest request,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        Order order = orderService.submitReview(orderId, userId, request.getRating(), request.getText());
        return ResponseEntity.ok(OrderResponse.fromEntity(order));
    }

    /**
     * Staff marks a paid order as delivered (physical goods, or a digital retry done by hand).
     */
    @PostMapping("/{orderId}/complete")
    public ResponseEntity<OrderResponse> completeOrder(
            @PathVariable String orderId,
            @RequestBody(required = false) CompleteOrderRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        String note = request == null ? null : request.getNote();
        logger.info("Staff {} completing order {}", staffId, orderId);
        return ResponseEntity.ok(OrderResponse.fromEntity(
                fulfillmentDispatcher.completeOrder(orderId, staffId, note)));
    }

    @PostMapping("/{orderId}/retry-fulfillment")
    public ResponseEntity<OrderResponse> retryFulfillment(
            @PathVariable String orderId,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        logger.info("Staff {} retrying fulfillment of order {}", staffId, orderId);
        return ResponseEntity.ok(OrderResponse.fromEntity(fulfillmentDispatcher.retryFulfillment(orderId)));
    }

    @PostMapping("/{orderId}/refund")
    public ResponseEntity<OrderResponse> refund(
            @PathVariable String orderId,
            @Valid @RequestBody RefundRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        return ResponseEntity.ok(OrderResponse.fromEntity(
                orderService.refund(orderId, staffId, request.getReason())));
    }

    @GetMapping("/awaiting-verification")
    public ResponseEntity<List<OrderResponse>> awaitingVerification(
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        return ResponseEntity.ok(toResponses(orderService.listAwaitingManualVerification()));
    }

    @GetMapping("/awaiting-fulfillment")
    public ResponseEntity<List<OrderResponse>> awaitingFulfillment(
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        return ResponseEntity.ok(toResponses(orderService.listAwaitingManualFulfillment()));
    }

    private List<OrderResponse> toResponses(List<Order> orders) {
        return orders.stream().map(OrderResponse::fromEntity).collect(Collectors.toList());
    }
}
