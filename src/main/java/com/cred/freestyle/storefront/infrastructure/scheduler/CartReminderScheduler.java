package com.cred.freestyle.storefront.infrastructure.scheduler;

import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.service.CartService;
import com.cred.freestyle.storefront.service.StoreStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reminds owners of carts left idle. Skipped while the shop is closed.
 *
 * @author Storefront Team
 */
@Service
public class CartReminderScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CartReminderScheduler.class);

    private final CartService cartService;
    private final StoreStateService storeStateService;
    private final StorefrontMetricsService metricsService;

    @Value("${storefront.schedulers.enabled:true}")
    private boolean schedulerEnabled;

    @Value("${storefront.cart.inactivity-threshold:PT48H}")
    private Duration inactivityThreshold;

    public CartReminderScheduler(
            CartService cartService,
            StoreStateService storeStateService,
            StorefrontMetricsService metricsService
    ) {
        this.cartService = cartService;
        this.storeStateService = storeStateService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${storefront.cart.reminder-interval-ms:172800000}",
               initialDelayString = "${storefront.cart.reminder-interval-ms:172800000}")
    public void remindInactiveCarts() {
        if (!schedulerEnabled) {
            logger.debug("Cart reminder scheduler is disabled");
            return;
        }
        try {
            sweep(Instant.now());
        } catch (RuntimeException e) {
            logger.error("Error in cart reminder scheduler", e);
            metricsService.recordError("CART_REMINDER_SCHEDULER_ERROR", "remindInactiveCarts");
        }
    }

    /**
     * @return Number of reminders sent
     */
    public int sweep(Instant now) {
        if (!storeStateService.isShopOpen()) {
            logger.debug("Shop closed, skipping cart reminders");
            return 0;
        }

        long startTime = System.currentTimeMillis();
        Instant cutoff = now.minus(inactivityThreshold);
        List<String> ownerIds = cartService.findOwnersDueForReminder(cutoff);

        int processedCount = 0;
        int failedCount = 0;
        for (String ownerId : ownerIds) {
            try {
                if (cartService.remindIfInactive(ownerId, cutoff, now)) {
                    processedCount++;
                }
            } catch (RuntimeException e) {
                logger.error("Error reminding cart owner: {}", ownerId, e);
                failedCount++;
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordSweep("cart_reminder", processedCount, failedCount, duration);
        if (processedCount > 0) {
            logger.info("Sent {} cart reminders", processedCount);
        }
        return processedCount;
    }
}
