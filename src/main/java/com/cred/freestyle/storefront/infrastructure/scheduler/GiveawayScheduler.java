package com.cred.freestyle.storefront.infrastructure.scheduler;

import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.service.GiveawayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Drives the giveaway cycle: ends rounds whose time is up and makes sure a round is running.
 *
 * @author Storefront Team
 */
@Service
public class GiveawayScheduler {

    private static final Logger logger = LoggerFactory.getLogger(GiveawayScheduler.class);

    private final GiveawayService giveawayService;
    private final StorefrontMetricsService metricsService;

    @Value("${storefront.schedulers.enabled:true}")
    private boolean schedulerEnabled;

    public GiveawayScheduler(GiveawayService giveawayService, StorefrontMetricsService metricsService) {
        this.giveawayService = giveawayService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${storefront.giveaway.sweep-interval-ms:60000}")
    public void runGiveawayCycle() {
        if (!schedulerEnabled) {
            logger.debug("Giveaway scheduler is disabled");
            return;
        }
        try {
            sweep(Instant.now());
        } catch (RuntimeException e) {
            logger.error("Error in giveaway scheduler", e);
            metricsService.recordError("GIVEAWAY_SCHEDULER_ERROR", "runGiveawayCycle");
        }
    }

    /**
     * @return Number of rounds ended by this sweep
     */
    public int sweep(Instant now) {
        long startTime = System.currentTimeMillis();
        List<String> dueRoundIds = giveawayService.findDueForSelection(now);

        int processedCount = 0;
        int failedCount = 0;
        for (String roundId : dueRoundIds) {
            try {
                if (giveawayService.endRound(roundId, now)) {
                    processedCount++;
                }
            } catch (RuntimeException e) {
                logger.error("Error ending giveaway round: {}", roundId, e);
                failedCount++;
                metricsService.recordError("GIVEAWAY_SELECTION_ERROR", "runGiveawayCycle");
            }
        }

        giveawayService.startRound(now);

        long duration = System.currentTimeMillis() - startTime;
        if (!dueRoundIds.isEmpty()) {
            metricsService.recordSweep("giveaway", processedCount, failedCount, duration);
            logger.info("Giveaway sweep completed: {} rounds ended, {} failed, duration: {}ms",
                    processedCount, failedCount, duration);
        }
        return processedCount;
    }
}
