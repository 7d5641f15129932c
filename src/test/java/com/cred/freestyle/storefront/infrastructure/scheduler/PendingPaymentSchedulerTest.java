package com.cred.freestyle.storefront.infrastructure.scheduler;

import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.exception.PaymentMismatchException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.service.payment.PaymentReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PendingPaymentSchedulerTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private PaymentReconciliationService reconciliationService;

    @Mock
    private StorefrontMetricsService metricsService;

    private PendingPaymentScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new PendingPaymentScheduler(orderRepository, reconciliationService, metricsService);
    }

    @Test
    @DisplayName("sweep - Pending PayPal orders: Should reconcile each, a mismatch not stopping the rest")
    void sweep_ReconcilesEach() {
        // Arrange
        when(orderRepository.findPendingPayments(PaymentMethod.PAYPAL)).thenReturn(Arrays.asList("order-1", "order-2"));
        when(reconciliationService.reconcile("order-1"))
                .thenThrow(new PaymentMismatchException("order-1", 1000L, 999L, "USD", "USD"));

        // Act
        int checked = scheduler.sweep();

        // Assert
        assertEquals(1, checked);
        verify(reconciliationService).reconcile("order-2");
        verify(metricsService, never()).recordError(anyString(), anyString());
        verify(metricsService).recordSweep(eq("payment_poll"), eq(1), eq(1), anyLong());
    }

    @Test
    @DisplayName("sweep - Gateway error: Should record it")
    void sweep_GatewayError() {
        // Arrange
        when(orderRepository.findPendingPayments(PaymentMethod.PAYPAL)).thenReturn(Arrays.asList("order-1"));
        when(reconciliationService.reconcile("order-1")).thenThrow(new IllegalStateException("timeout"));

        // Act
        int checked = scheduler.sweep();

        // Assert
        assertEquals(0, checked);
        verify(metricsService).recordError("PAYMENT_POLL_PROCESSING_ERROR", "pollPendingPayments");
    }
}
