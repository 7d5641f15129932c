package com.cred.freestyle.storefront.infrastructure.scheduler;

import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.service.OrderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Cancels orders whose payment window has passed and releases their stock.
 *
 * Each order is expired in its own transaction, which re-checks the order under its row lock.
 * A payment confirmed between the scan and the expiry therefore wins, and a sweep overlapping a
 * previous one finds nothing left to do.
 *
 * Crypto orders with a pending manual verification request are never expired, nor are orders
 * whose provider payment did not match: money may have moved and staff decide what happens.
 *
 * @author Storefront Team
 */
@Service
public class OrderExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(OrderExpiryScheduler.class);

    private final OrderRepository orderRepository;
    private final OrderService orderService;
    private final StorefrontMetricsService metricsService;

    @Value("${storefront.schedulers.enabled:true}")
    private boolean schedulerEnabled;

    public OrderExpiryScheduler(
            OrderRepository orderRepository,
            OrderService orderService,
            StorefrontMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.orderService = orderService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${storefront.order.expiry-sweep-interval-ms:10000}")
    public void expireUnpaidOrders() {
        if (!schedulerEnabled) {
            logger.debug("Order expiry scheduler is disabled");
            return;
        }
        try {
            sweep(Instant.now());
        } catch (RuntimeException e) {
            logger.error("Error in order expiry scheduler", e);
            metricsService.recordError("ORDER_EXPIRY_SCHEDULER_ERROR", "expireUnpaidOrders");
        }
    }

    /**
     * Expire every order due at {@code now}.
     *
     * @return Number of orders expired
     */
    public int sweep(Instant now) {
        long startTime = System.currentTimeMillis();
        List<String> dueOrderIds = orderRepository.findExpiredAwaitingPayment(now);
        if (dueOrderIds.isEmpty()) {
            logger.debug("No expired orders found");
            return 0;
        }

        logger.info("Found {} orders past their payment window", dueOrderIds.size());
        int processedCount = 0;
        int failedCount = 0;

        for (String orderId : dueOrderIds) {
            try {
                if (orderService.expire(orderId, now)) {
                    processedCount++;
                }
            } catch (RuntimeException e) {
                logger.error("Error expiring order: {}", orderId, e);
                failedCount++;
                metricsService.recordError("ORDER_EXPIRY_PROCESSING_ERROR", "expireUnpaidOrders");
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordSweep("order_expiry", processedCount, failedCount, duration);
        logger.info("Order expiry completed: {} expired, {} failed, duration: {}ms",
                processedCount, failedCount, duration);
        return processedCount;
    }
}
