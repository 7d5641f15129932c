package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.repository.OrderRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Sales figures over paid orders. Refunded and cancelled orders are not counted.
 *
 * @author Storefront Team
 */
@Service
public class SalesAnalyticsService {

    static final Set<OrderState> SOLD_STATES = EnumSet.of(OrderState.PAID, OrderState.FULFILLED, OrderState.REVIEWED);

    private final OrderRepository orderRepository;
    private final CatalogService catalogService;

    public SalesAnalyticsService(OrderRepository orderRepository, CatalogService catalogService) {
        this.orderRepository = orderRepository;
        this.catalogService = catalogService;
    }

    /**
     * Best sellers by units since a point in time.
     */
    @Transactional(readOnly = true)
    public List<ItemSalesSummary> popularItems(Instant since, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        return orderRepository.findTopSellingItems(SOLD_STATES, since, PageRequest.of(0, limit));
    }

    /**
     * All-time sales of one item. Items that never sold report zero.
     */
    @Transactional(readOnly = true)
    public ItemSalesSummary itemSales(String itemId) {
        return orderRepository.findItemSales(itemId, SOLD_STATES)
                .orElseGet(() -> new ItemSalesSummary(itemId, catalogService.getItem(itemId).getName(), 0L, 0L));
    }
}
