package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Cart;
import com.cred.freestyle.storefront.domain.model.CartLine;
import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.domain.model.OrderLine;
import com.cred.freestyle.storefront.exception.InsufficientStockException;
import com.cred.freestyle.storefront.exception.PaymentGatewayException;
import com.cred.freestyle.storefront.exception.StaleCartItemException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.ItemRepository;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.service.payment.PaymentGateways;
import com.cred.freestyle.storefront.service.payment.PaymentInitiation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Converts a cart into an order.
 *
 * Flow:
 * 1. Under the owner's cart lock, in one transaction: re-validate every cart line against the
 *    current item (exists, active, unchanged price, enough stock), create the order, reserve all
 *    lines through the {@link InventoryLedger}, move the order to AWAITING_PAYMENT and remove the
 *    ordered lines from the cart. Any failure rolls the whole unit back and leaves the cart as it was.
 * 2. After commit, register the payment with the gateway for the chosen method. If that fails the
 *    order is cancelled (releasing its stock) and the lines go back into the cart.
 *
 * @author Storefront Team
 */
@Service
public class CheckoutService {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutService.class);

    private final CartService cartService;
    private final ItemRepository itemRepository;
    private final OrderRepository orderRepository;
    private final InventoryLedger inventoryLedger;
    private final OrderService orderService;
    private final PaymentGateways paymentGateways;
    private final StoreStateService storeStateService;
    private final StorefrontMetricsService metricsService;
    private final String currency;
    private final Duration reservationTimeout;

    public CheckoutService(
            CartService cartService,
            ItemRepository itemRepository,
            OrderRepository orderRepository,
            InventoryLedger inventoryLedger,
            OrderService orderService,
            PaymentGateways paymentGateways,
            StoreStateService storeStateService,
            StorefrontMetricsService metricsService,
            @Value("${storefront.currency:USD}") String currency,
            @Value("${storefront.checkout.reservation-timeout:PT30M}") Duration reservationTimeout
    ) {
        this.cartService = cartService;
        this.itemRepository = itemRepository;
        this.orderRepository = orderRepository;
        this.inventoryLedger = inventoryLedger;
        this.orderService = orderService;
        this.paymentGateways = paymentGateways;
        this.storeStateService = storeStateService;
        this.metricsService = metricsService;
        this.currency = currency;
        this.reservationTimeout = reservationTimeout;
    }

    /**
     * Check out the owner's cart.
     *
     * @param ownerId Buyer
     * @param method Payment method chosen by the buyer
     * @return Order in AWAITING_PAYMENT with its payment reference recorded
     * @throws StaleCartItemException if a line's item vanished, was hidden or changed price
     * @throws InsufficientStockException if any line cannot be reserved
     * @throws PaymentGatewayException if the payment could not be initiated (order cancelled)
     */
    public Order checkout(String ownerId, PaymentMethod method) {
        long startTime = System.currentTimeMillis();
        storeStateService.requireOpen();

        Order order;
        try {
            order = cartService.underOwnerLock(ownerId, () -> placeOrder(ownerId, method));
        } catch (InsufficientStockException e) {
            metricsService.recordCheckout("insufficient_stock");
            throw e;
        } catch (StaleCartItemException e) {
            metricsService.recordCheckout("stale_cart");
            throw e;
        }

        PaymentInitiation initiation;
        try {
            initiation = paymentGateways.forMethod(method).initiatePayment(order);
        } catch (PaymentGatewayException e) {
            logger.error("Payment initiation failed for order {}, cancelling", order.getOrderId(), e);
            orderService.cancel(order.getOrderId(), "Payment could not be initiated");
            cartService.restoreLines(ownerId, order.getLines());
            metricsService.recordCheckout("gateway_failure");
            throw e;
        }

        Order awaiting = orderService.recordPaymentInitiation(order.getOrderId(), initiation);

        metricsService.recordCheckout("success");
        metricsService.recordCheckoutLatency(System.currentTimeMillis() - startTime);
        logger.info("Checkout complete for {}: order {} total {} {} via {}",
                ownerId, awaiting.getOrderId(), awaiting.getTotalMinor(), awaiting.getCurrency(), method);
        return awaiting;
    }

    private Order placeOrder(String ownerId, PaymentMethod method) {
        Cart cart = cartService.lockCart(ownerId)
                .filter(existing -> !existing.isEmpty())
                .orElseThrow(() -> new IllegalStateException("Cart is empty"));

        List<OrderLine> lines = validateLines(cart);
        Instant now = Instant.now();

        Order order = Order.builder()
                .ownerId(ownerId)
                .lines(new ArrayList<>(lines))
                .totalMinor(Order.totalOf(lines))
                .currency(currency)
                .state(OrderState.CREATED)
                .paymentMethod(method)
                .build();
        order = orderRepository.save(order);

        Map<String, Integer> quantities = lines.stream()
                .collect(Collectors.toMap(OrderLine::getItemId, OrderLine::getQuantity, Integer::sum, LinkedHashMap::new));
        inventoryLedger.reserveAll(order.getOrderId(), quantities);

        order.transitionTo(OrderState.AWAITING_PAYMENT);
        order.setExpiresAt(now.plus(reservationTimeout));
        order = orderRepository.save(order);
        metricsService.recordOrderTransition(OrderState.AWAITING_PAYMENT.name());

        cart.removeItems(quantities.keySet(), now);
        cartService.saveCart(cart);

        logger.info("Order {} created for {} with {} lines, reserved until {}",
                order.getOrderId(), ownerId, lines.size(), order.getExpiresAt());
        return order;
    }

    /**
     * Compare each cart line with the current item. Nothing is written here.
     * Items are read under their row locks, in ascending id order, so the counters checked here
     * are the ones the ledger reserves against.
     */
    private List<OrderLine> validateLines(Cart cart) {
        Map<String, Item> lockedItems = new TreeMap<>();
        for (CartLine cartLine : cart.getLines()) {
            lockedItems.put(cartLine.getItemId(), null);
        }
        for (String itemId : lockedItems.keySet()) {
            lockedItems.put(itemId, itemRepository.findByIdWithLock(itemId).orElse(null));
        }

        List<OrderLine> lines = new ArrayList<>(cart.getLines().size());
        for (CartLine cartLine : cart.getLines()) {
            Item item = lockedItems.get(cartLine.getItemId());
            if (item == null) {
                throw new StaleCartItemException(cartLine.getItemId(), StaleCartItemException.Reason.ITEM_NOT_FOUND);
            }

            if (!item.isPurchasable()) {
                throw new StaleCartItemException(item.getItemId(), StaleCartItemException.Reason.ITEM_UNAVAILABLE);
            }
            if (!item.getPriceMinor().equals(cartLine.getPriceSnapshotMinor())) {
                throw new StaleCartItemException(item.getItemId(), StaleCartItemException.Reason.PRICE_CHANGED);
            }
            if (item.availableForSale() < cartLine.getQuantity()) {
                throw new InsufficientStockException(item.getItemId(), cartLine.getQuantity(), item.availableForSale());
            }

            lines.add(OrderLine.builder()
                    .itemId(item.getItemId())
                    .itemName(item.getName())
                    .quantity(cartLine.getQuantity())
                    .unitPriceMinor(cartLine.getPriceSnapshotMinor())
                    .digital(item.isDigital())
                    .build());
        }
        return lines;
    }
}
