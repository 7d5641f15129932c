package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.service.ItemSalesSummary;
import com.cred.freestyle.storefront.service.SalesAnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Sales figures from paid orders.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private final SalesAnalyticsService analyticsService;

    public AnalyticsController(SalesAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    /**
     * Best sellers by units sold over the last {@code days} days.
     */
    @GetMapping("/popular")
    public ResponseEntity<List<ItemSalesSummary>> popularItems(
            @RequestParam(defaultValue = "30") int days,
            @RequestParam(defaultValue = "10") int limit,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        if (days <= 0 || limit <= 0) {
            throw new IllegalArgumentException("days and limit must be positive");
        }
        Instant since = Instant.now().minus(Duration.ofDays(days));
        return ResponseEntity.ok(analyticsService.popularItems(since, limit));
    }

    @GetMapping("/items/{itemId}")
    public ResponseEntity<ItemSalesSummary> itemSales(
            @PathVariable String itemId,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        return ResponseEntity.ok(analyticsService.itemSales(itemId));
    }
}
