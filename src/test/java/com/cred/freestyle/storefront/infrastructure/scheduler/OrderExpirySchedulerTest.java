package com.cred.freestyle.storefront.infrastructure.scheduler;

import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.service.OrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderExpiryScheduler.
 *
 * @author Storefront Team
 */
@ExtendWith(MockitoExtension.class)
class OrderExpirySchedulerTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private OrderService orderService;

    @Mock
    private StorefrontMetricsService metricsService;

    private OrderExpiryScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new OrderExpiryScheduler(orderRepository, orderService, metricsService);
        ReflectionTestUtils.setField(scheduler, "schedulerEnabled", true);
    }

    @Test
    @DisplayName("expireUnpaidOrders - No overdue orders: Should do nothing")
    void expireUnpaidOrders_NothingDue() {
        // Arrange
        when(orderRepository.findExpiredAwaitingPayment(any(Instant.class))).thenReturn(Collections.emptyList());

        // Act
        scheduler.expireUnpaidOrders();

        // Assert
        verifyNoInteractions(orderService);
        verify(metricsService, never()).recordSweep(anyString(), anyInt(), anyInt(), anyLong());
    }

    @Test
    @DisplayName("sweep - Overdue orders: Should expire each and count only the ones this sweep expired")
    void sweep_ExpiresDueOrders() {
        // Arrange
        Instant now = Instant.now();
        when(orderRepository.findExpiredAwaitingPayment(now)).thenReturn(Arrays.asList("order-1", "order-2", "order-3"));
        when(orderService.expire("order-1", now)).thenReturn(true);
        when(orderService.expire("order-2", now)).thenReturn(false);
        when(orderService.expire("order-3", now)).thenReturn(true);

        // Act
        int expired = scheduler.sweep(now);

        // Assert
        assertEquals(2, expired);
        verify(metricsService).recordSweep(eq("order_expiry"), eq(2), eq(0), anyLong());
    }

    @Test
    @DisplayName("sweep - One order fails: Should continue with the rest")
    void sweep_ContinuesAfterFailure() {
        // Arrange
        Instant now = Instant.now();
        when(orderRepository.findExpiredAwaitingPayment(now)).thenReturn(Arrays.asList("order-1", "order-2"));
        when(orderService.expire("order-1", now)).thenThrow(new RuntimeException("Database error"));
        when(orderService.expire("order-2", now)).thenReturn(true);

        // Act
        int expired = scheduler.sweep(now);

        // Assert
        assertEquals(1, expired);
        verify(metricsService).recordError("ORDER_EXPIRY_PROCESSING_ERROR", "expireUnpaidOrders");
        verify(metricsService).recordSweep(eq("order_expiry"), eq(1), eq(1), anyLong());
    }

    @Test
    @DisplayName("expireUnpaidOrders - Disabled: Should not query")
    void expireUnpaidOrders_Disabled() {
        // Arrange
        ReflectionTestUtils.setField(scheduler, "schedulerEnabled", false);

        // Act
        scheduler.expireUnpaidOrders();

        // Assert
        verifyNoInteractions(orderRepository, orderService);
    }

    @Test
    @DisplayName("expireUnpaidOrders - Query fails: Should record the error and not rethrow")
    void expireUnpaidOrders_QueryFails() {
        // Arrange
        when(orderRepository.findExpiredAwaitingPayment(any(Instant.class)))
                .thenThrow(new RuntimeException("Connection refused"));

        // Act
        assertDoesNotThrow(() -> scheduler.expireUnpaidOrders());

        // Assert
        verify(metricsService).recordError("ORDER_EXPIRY_SCHEDULER_ERROR", "expireUnpaidOrders");
    }
}
