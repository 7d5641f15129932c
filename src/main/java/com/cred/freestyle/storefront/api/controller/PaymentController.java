package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.AttestationRequest;
import com.cred.freestyle.storefront.api.dto.OrderResponse;
import com.cred.freestyle.storefront.api.dto.PaymentCallbackRequest;
import com.cred.freestyle.storefront.service.OrderService;
import com.cred.freestyle.storefront.service.payment.PaymentReconciliationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for payment confirmation.
 * Every path ends in the same reconciliation, so callbacks, buyer re-checks and the
 * polling sweep can race without double-confirming an order.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/payments")
public class PaymentController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentController.class);

    private final PaymentReconciliationService reconciliationService;
    private final OrderService orderService;

    public PaymentController(PaymentReconciliationService reconciliationService, OrderService orderService) {
        this.reconciliationService = reconciliationService;
        this.orderService = orderService;
    }

    /**
     * Provider notification that a payment changed. The provider is re-queried; the
     * callback body is never trusted for amounts.
     */
    @PostMapping("/callback")
    public ResponseEntity<OrderResponse> providerCallback(@Valid @RequestBody PaymentCallbackRequest request) {
        logger.info("Payment callback for ref {}", request.getPaymentRef());
        return ResponseEntity.ok(OrderResponse.fromEntity(
                reconciliationService.handleProviderCallback(request.getPaymentRef())));
    }

    /**
     * Buyer-triggered re-check of their own order's payment.
     */
    @PostMapping("/orders/{orderId}/verify")
    public ResponseEntity<OrderResponse> verify(
            @PathVariable String orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        orderService.getOrderForOwner(orderId, userId);
        return ResponseEntity.ok(OrderResponse.fromEntity(reconciliationService.reconcile(orderId)));
    }

    /**
     * Staff attestation that a crypto payment arrived in full.
     */
    @PostMapping("/orders/{orderId}/attest")
    public ResponseEntity<OrderResponse> attest(
            @PathVariable String orderId,
            @Valid @RequestBody AttestationRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        logger.info("Staff {} attesting payment for order {}", staffId, orderId);
        return ResponseEntity.ok(OrderResponse.fromEntity(
                reconciliationService.attest(orderId, staffId, request.getEvidence())));
    }
}
