package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.domain.model.OrderLine;
import com.cred.freestyle.storefront.exception.InsufficientStockException;
import com.cred.freestyle.storefront.exception.InvalidOrderStateException;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.exception.ShopClosedException;
import com.cred.freestyle.storefront.exception.StaleCartItemException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.service.CheckoutService;
import com.cred.freestyle.storefront.service.FulfillmentDispatcher;
import com.cred.freestyle.storefront.service.OrderService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for OrderController using MockMvc.
 */
@WebMvcTest(OrderController.class)
@ContextConfiguration(classes = {OrderController.class, GlobalExceptionHandler.class})
@DisplayName("OrderController Tests")
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CheckoutService checkoutService;

    @MockBean
    private OrderService orderService;

    @MockBean
    private FulfillmentDispatcher fulfillmentDispatcher;

    @MockBean
    private StorefrontMetricsService metricsService;

    private Order order(OrderState state) {
        OrderLine line = OrderLine.builder()
                .itemId("item-1").itemName("Hoodie").quantity(2).unitPriceMinor(500L).digital(false)
                .build();
        return Order.builder()
                .orderId("order-1")
                .ownerId("user-1")
                .lines(new ArrayList<>(List.of(line)))
                .totalMinor(1_000L)
                .currency("USD")
                .state(state)
                .paymentMethod(PaymentMethod.PAYPAL)
                .paymentRef("PP-1")
                .approvalUrl("https://paypal/approve")
                .createdAt(Instant.now())
                .expiresAt(Instant.now().plusSeconds(900))
                .build();
    }

    // ========================================
    // POST /api/v1/orders/checkout Tests
    // ========================================

    @Test
    @DisplayName("POST /checkout - Valid request returns 201 Created with the approval link")
    void checkout_ValidRequest_Returns201() throws Exception {
        // Given
        when(checkoutService.checkout("user-1", PaymentMethod.PAYPAL)).thenReturn(order(OrderState.AWAITING_PAYMENT));

        // When / Then
        mockMvc.perform(post("/api/v1/orders/checkout")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"paymentMethod": "PAYPAL"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderId").value("order-1"))
                .andExpect(jsonPath("$.state").value("AWAITING_PAYMENT"))
                .andExpect(jsonPath("$.totalMinor").value(1000))
                .andExpect(jsonPath("$.approvalUrl").value("https://paypal/approve"))
                .andExpect(jsonPath("$.lines", hasSize(1)));
    }

    @Test
    @DisplayName("POST /checkout - Missing payment method returns 400")
    void checkout_MissingMethod_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/orders/checkout")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.paymentMethod").exists());

        verifyNoInteractions(checkoutService);
    }

    @Test
    @DisplayName("POST /checkout - Missing user header returns 400")
    void checkout_MissingUser_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/orders/checkout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentMethod\": \"PAYPAL\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /checkout - Stock ran out returns 409 with item details")
    void checkout_InsufficientStock_Returns409() throws Exception {
        when(checkoutService.checkout("user-1", PaymentMethod.PAYPAL))
                .thenThrow(new InsufficientStockException("item-1", 2, 1));

        mockMvc.perform(post("/api/v1/orders/checkout")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentMethod\": \"PAYPAL\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Insufficient Stock"))
                .andExpect(jsonPath("$.details.itemId").value("item-1"))
                .andExpect(jsonPath("$.kind").value("InsufficientStock"))
                .andExpect(jsonPath("$.details.availableQuantity").value(1));
    }

    @Test
    @DisplayName("POST /checkout - Price changed since adding returns 409")
    void checkout_StaleItem_Returns409() throws Exception {
        when(checkoutService.checkout("user-1", PaymentMethod.CRYPTO))
                .thenThrow(new StaleCartItemException("item-1", StaleCartItemException.Reason.PRICE_CHANGED));

        mockMvc.perform(post("/api/v1/orders/checkout")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentMethod\": \"CRYPTO\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.reason").value("PRICE_CHANGED"));
    }

    @Test
    @DisplayName("POST /checkout - Shop closed returns 503")
    void checkout_ShopClosed_Returns503() throws Exception {
        when(checkoutService.checkout(anyString(), any())).thenThrow(new ShopClosedException());

        mockMvc.perform(post("/api/v1/orders/checkout")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentMethod\": \"PAYPAL\"}"))
                .andExpect(status().isServiceUnavailable());
    }

    // ========================================
    // Buyer order actions Tests
    // ========================================

    @Test
    @DisplayName("GET /{orderId} - Someone else's order returns 404")
    void getOrder_ForeignOwner_Returns404() throws Exception {
        when(orderService.getOrderForOwner("order-1", "user-2"))
                .thenThrow(new ResourceNotFoundException("Order", "order-1"));

        mockMvc.perform(get("/api/v1/orders/order-1").header("X-User-Id", "user-2"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /{orderId}/cancel - Paid order returns 409")
    void cancel_PaidOrder_Returns409() throws Exception {
        when(orderService.cancelByOwner("order-1", "user-1"))
                .thenThrow(new InvalidOrderStateException("order-1", OrderState.PAID, OrderState.CANCELLED));

        mockMvc.perform(post("/api/v1/orders/order-1/cancel").header("X-User-Id", "user-1"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /{orderId}/review - Rating out of range returns 400")
    void review_BadRating_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/orders/order-1/review")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"rating": 7, "text": "great"}
                                """))
                .andExpect(status().isBadRequest());

        verify(orderService, never()).submitReview(any(), any(), anyInt(), any());
    }

    // ========================================
    // Staff actions Tests
    // ========================================

    @Test
    @DisplayName("POST /{orderId}/complete - Staff completes without a body")
    void complete_NoBody_Returns200() throws Exception {
        Order fulfilled = order(OrderState.FULFILLED);
        fulfilled.setFulfilledBy("staff-1");
        when(fulfillmentDispatcher.completeOrder("order-1", "staff-1", null)).thenReturn(fulfilled);

        mockMvc.perform(post("/api/v1/orders/order-1/complete").header("X-Staff-Id", "staff-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("FULFILLED"))
                .andExpect(jsonPath("$.fulfilledBy").value("staff-1"));
    }

    @Test
    @DisplayName("POST /{orderId}/complete - Missing staff header returns 400")
    void complete_NoStaff_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/orders/order-1/complete").header("X-User-Id", "user-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(fulfillmentDispatcher);
    }
}
