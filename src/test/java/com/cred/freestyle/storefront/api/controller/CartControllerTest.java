package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.storefront.exception.CartBusyException;
import com.cred.freestyle.storefront.exception.InsufficientStockException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.service.CartService;
import com.cred.freestyle.storefront.service.CartSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for CartController using MockMvc.
 */
@WebMvcTest(CartController.class)
@ContextConfiguration(classes = {CartController.class, GlobalExceptionHandler.class})
@DisplayName("CartController Tests")
class CartControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CartService cartService;

    @MockBean
    private StorefrontMetricsService metricsService;

    private CartSnapshot snapshot() {
        return new CartSnapshot("user-1",
                List.of(new CartSnapshot.Line("item-1", "Hoodie", 2, 4_500L)),
                Instant.now());
    }

    @Test
    @DisplayName("POST /cart/items - Valid request returns the updated cart")
    void addToCart_Valid_Returns200() throws Exception {
        // Given
        when(cartService.addItem("user-1", "item-1", 2)).thenReturn(snapshot());

        // When / Then
        mockMvc.perform(post("/api/v1/cart/items")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"itemId": "item-1", "quantity": 2}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ownerId").value("user-1"))
                .andExpect(jsonPath("$.lines", hasSize(1)))
                .andExpect(jsonPath("$.totalMinor").value(9000));
    }

    @Test
    @DisplayName("POST /cart/items - Zero quantity returns 400")
    void addToCart_ZeroQuantity_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/cart/items")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"itemId": "item-1", "quantity": 0}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(cartService);
    }

    @Test
    @DisplayName("POST /cart/items - More than is for sale returns 409")
    void addToCart_TooMany_Returns409() throws Exception {
        when(cartService.addItem("user-1", "item-1", 5)).thenThrow(new InsufficientStockException("item-1", 5, 3));

        mockMvc.perform(post("/api/v1/cart/items")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemId\": \"item-1\", \"quantity\": 5}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /cart/items - Concurrent cart update returns 429")
    void addToCart_Busy_Returns429() throws Exception {
        when(cartService.addItem(anyString(), anyString(), anyInt())).thenThrow(new CartBusyException("user-1"));

        mockMvc.perform(post("/api/v1/cart/items")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemId\": \"item-1\", \"quantity\": 1}"))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    @DisplayName("DELETE /cart/items/{itemId} - Partial removal passes the quantity")
    void removeFromCart_Partial() throws Exception {
        when(cartService.removeItem("user-1", "item-1", 1)).thenReturn(snapshot());

        mockMvc.perform(delete("/api/v1/cart/items/item-1").param("quantity", "1").header("X-User-Id", "user-1"))
                .andExpect(status().isOk());

        verify(cartService).removeItem("user-1", "item-1", 1);
    }

    @Test
    @DisplayName("GET /carts - Staff sees every cart")
    void listCarts_Staff() throws Exception {
        when(cartService.listCarts()).thenReturn(List.of(snapshot(), CartSnapshot.empty("user-2")));

        mockMvc.perform(get("/api/v1/carts").header("X-Staff-Id", "staff-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    @DisplayName("DELETE /carts - Staff wipe reports how many carts were cleared")
    void wipeAll_Staff() throws Exception {
        when(cartService.wipeAll("staff-1")).thenReturn(3);

        mockMvc.perform(delete("/api/v1/carts").header("X-Staff-Id", "staff-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wipedCarts").value(3));
    }
}
