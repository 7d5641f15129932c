package com.cred.freestyle.storefront.testutil;

import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.Item.ItemStatus;
import com.cred.freestyle.storefront.domain.model.Item.StockVisibility;
import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.domain.model.OrderLine;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builder class for creating test data objects.
 * Provides fluent API for building domain models with sensible defaults.
 */
public class TestDataBuilder {

    /**
     * Builder for Item
     */
    public static class ItemBuilder {
        private String name = "Test Item " + UUID.randomUUID().toString().substring(0, 8);
        private Long priceMinor = 1_000L;
        private Integer quantityAvailable = 10;
        private Integer quantityReserved = 0;
        private ItemStatus status = ItemStatus.ACTIVE;
        private boolean digital = false;

        public ItemBuilder name(String name) {
            this.name = name;
            return this;
        }

        public ItemBuilder priceMinor(long priceMinor) {
            this.priceMinor = priceMinor;
            return this;
        }

        public ItemBuilder quantityAvailable(int quantityAvailable) {
            this.quantityAvailable = quantityAvailable;
            return this;
        }

        public ItemBuilder quantityReserved(int quantityReserved) {
            this.quantityReserved = quantityReserved;
            return this;
        }

        public ItemBuilder status(ItemStatus status) {
            this.status = status;
            return this;
        }

        public ItemBuilder digital(boolean digital) {
            this.digital = digital;
            return this;
        }

        public Item build() {
            return Item.builder()
                    .name(name)
                    .priceMinor(priceMinor)
                    .quantityAvailable(quantityAvailable)
                    .quantityReserved(quantityReserved)
                    .stockVisibility(StockVisibility.EXACT)
                    .status(status)
                    .digital(digital)
                    .build();
        }
    }

    /**
     * Builder for Order. Lines are optional; the total is given directly when there are none.
     */
    public static class OrderBuilder {
        private String ownerId = "user-" + UUID.randomUUID().toString().substring(0, 8);
        private List<OrderLine> lines = new ArrayList<>();
        private Long totalMinor;
        private String currency = "USD";
        private OrderState state = OrderState.AWAITING_PAYMENT;
        private PaymentMethod paymentMethod = PaymentMethod.PAYPAL;
        private String paymentRef;

        public OrderBuilder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public OrderBuilder line(String itemId, int quantity, long unitPriceMinor) {
            this.lines.add(OrderLine.builder()
                    .itemId(itemId)
                    .itemName("Item " + itemId)
                    .quantity(quantity)
                    .unitPriceMinor(unitPriceMinor)
                    .digital(false)
                    .build());
            return this;
        }

        public OrderBuilder totalMinor(long totalMinor) {
            this.totalMinor = totalMinor;
            return this;
        }

        public OrderBuilder state(OrderState state) {
            this.state = state;
            return this;
        }

        public OrderBuilder paymentMethod(PaymentMethod paymentMethod) {
            this.paymentMethod = paymentMethod;
            return this;
        }

        public OrderBuilder paymentRef(String paymentRef) {
            this.paymentRef = paymentRef;
            return this;
        }

        public Order build() {
            return Order.builder()
                    .ownerId(ownerId)
                    .lines(new ArrayList<>(lines))
                    .totalMinor(totalMinor != null ? totalMinor : Order.totalOf(lines))
                    .currency(currency)
                    .state(state)
                    .paymentMethod(paymentMethod)
                    .paymentRef(paymentRef)
                    .build();
        }
    }

    public static ItemBuilder item() {
        return new ItemBuilder();
    }

    public static OrderBuilder order() {
        return new OrderBuilder();
    }
}
