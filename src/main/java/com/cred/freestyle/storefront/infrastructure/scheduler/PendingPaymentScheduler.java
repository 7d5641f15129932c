package com.cred.freestyle.storefront.infrastructure.scheduler;

import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.exception.PaymentMismatchException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.service.payment.PaymentReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Polls the payment provider for PayPal orders still awaiting payment.
 * Covers buyers who approved a payment without the provider callback reaching us.
 *
 * @author Storefront Team
 */
@Service
public class PendingPaymentScheduler {

    private static final Logger logger = LoggerFactory.getLogger(PendingPaymentScheduler.class);

    private final OrderRepository orderRepository;
    private final PaymentReconciliationService reconciliationService;
    private final StorefrontMetricsService metricsService;

    @Value("${storefront.schedulers.enabled:true}")
    private boolean schedulerEnabled;

    public PendingPaymentScheduler(
            OrderRepository orderRepository,
            PaymentReconciliationService reconciliationService,
            StorefrontMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.reconciliationService = reconciliationService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${storefront.payment.poll-interval-ms:15000}")
    public void pollPendingPayments() {
        if (!schedulerEnabled) {
            logger.debug("Pending payment scheduler is disabled");
            return;
        }
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.error("Error in pending payment scheduler", e);
            metricsService.recordError("PAYMENT_POLL_SCHEDULER_ERROR", "pollPendingPayments");
        }
    }

    /**
     * Reconcile every pending PayPal order once.
     *
     * @return Number of orders checked without error
     */
    public int sweep() {
        long startTime = System.currentTimeMillis();
        List<String> pendingOrderIds = orderRepository.findPendingPayments(PaymentMethod.PAYPAL);
        if (pendingOrderIds.isEmpty()) {
            return 0;
        }

        int processedCount = 0;
        int failedCount = 0;
        for (String orderId : pendingOrderIds) {
            try {
                reconciliationService.reconcile(orderId);
                processedCount++;
            } catch (PaymentMismatchException e) {
                logger.warn("Payment mismatch on order {}: {}", orderId, e.getMessage());
                failedCount++;
            } catch (RuntimeException e) {
                logger.error("Error reconciling payment for order: {}", orderId, e);
                failedCount++;
                metricsService.recordError("PAYMENT_POLL_PROCESSING_ERROR", "pollPendingPayments");
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordSweep("payment_poll", processedCount, failedCount, duration);
        logger.info("Payment poll completed: {} checked, {} failed, duration: {}ms",
                processedCount, failedCount, duration);
        return processedCount;
    }
}
