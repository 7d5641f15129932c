package com.cred.freestyle.storefront.infrastructure.scheduler;

import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.service.TicketService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Purges closed tickets once their purge time has passed.
 *
 * @author Storefront Team
 */
@Service
public class TicketPurgeScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TicketPurgeScheduler.class);

    private final TicketService ticketService;
    private final StorefrontMetricsService metricsService;

    @Value("${storefront.schedulers.enabled:true}")
    private boolean schedulerEnabled;

    public TicketPurgeScheduler(TicketService ticketService, StorefrontMetricsService metricsService) {
        this.ticketService = ticketService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${storefront.ticket.sweep-interval-ms:60000}")
    public void purgeClosedTickets() {
        if (!schedulerEnabled) {
            logger.debug("Ticket purge scheduler is disabled");
            return;
        }
        try {
            sweep(Instant.now());
        } catch (RuntimeException e) {
            logger.error("Error in ticket purge scheduler", e);
            metricsService.recordError("TICKET_PURGE_SCHEDULER_ERROR", "purgeClosedTickets");
        }
    }

    /**
     * @return Number of tickets purged by this sweep
     */
    public int sweep(Instant now) {
        long startTime = System.currentTimeMillis();
        List<String> dueTicketIds = ticketService.findDueForPurge(now);
        if (dueTicketIds.isEmpty()) {
            return 0;
        }

        int processedCount = 0;
        int failedCount = 0;
        for (String ticketId : dueTicketIds) {
            try {
                if (ticketService.purge(ticketId, now)) {
                    processedCount++;
                }
            } catch (RuntimeException e) {
                logger.error("Error purging ticket: {}", ticketId, e);
                failedCount++;
                metricsService.recordError("TICKET_PURGE_PROCESSING_ERROR", "purgeClosedTickets");
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordSweep("ticket_purge", processedCount, failedCount, duration);
        logger.info("Ticket purge completed: {} purged, {} failed, duration: {}ms",
                processedCount, failedCount, duration);
        return processedCount;
    }
}
