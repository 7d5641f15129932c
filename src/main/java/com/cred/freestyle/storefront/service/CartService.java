package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Cart;
import com.cred.freestyle.storefront.domain.model.CartLine;
import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.OrderLine;
import com.cred.freestyle.storefront.exception.CartBusyException;
import com.cred.freestyle.storefront.exception.InsufficientStockException;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.exception.StaleCartItemException;
import com.cred.freestyle.storefront.infrastructure.lock.RedisDistributedLock;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.repository.CartRepository;
import com.cred.freestyle.storefront.repository.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Per-user carts. Carts never reserve stock; availability checks here are advisory.
 *
 * Edits of one owner's cart are serialized: a Redis lock keyed by owner keeps concurrent
 * requests from different instances apart, and inside the transaction the cart row itself is
 * locked. Carts of different owners never contend.
 *
 * @author Storefront Team
 */
@Service
public class CartService {

    private static final Logger logger = LoggerFactory.getLogger(CartService.class);

    private static final String LOCK_PREFIX = "lock:cart:";
    private static final Duration LOCK_EXPIRY = Duration.ofSeconds(10);
    private static final Duration INITIAL_BACKOFF = Duration.ofMillis(20);

    private final CartRepository cartRepository;
    private final ItemRepository itemRepository;
    private final StoreStateService storeStateService;
    private final RedisDistributedLock distributedLock;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final boolean distributedLockEnabled;
    private final Duration lockWait;

    public CartService(
            CartRepository cartRepository,
            ItemRepository itemRepository,
            StoreStateService storeStateService,
            RedisDistributedLock distributedLock,
            ApplicationEventPublisher eventPublisher,
            PlatformTransactionManager transactionManager,
            @Value("${storefront.cart.distributed-lock.enabled:true}") boolean distributedLockEnabled,
            @Value("${storefront.cart.lock-timeout:PT2S}") Duration lockWait
    ) {
        this.cartRepository = cartRepository;
        this.itemRepository = itemRepository;
        this.storeStateService = storeStateService;
        this.distributedLock = distributedLock;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.distributedLockEnabled = distributedLockEnabled;
        this.lockWait = lockWait;
    }

    /**
     * Run work for one owner's cart under the per-owner lock, in a single transaction.
     *
     * @throws CartBusyException if the lock could not be acquired in time
     */
    public <T> T underOwnerLock(String ownerId, Supplier<T> work) {
        String lockKey = LOCK_PREFIX + ownerId;
        String lockToken = null;

        if (distributedLockEnabled) {
            lockToken = distributedLock.acquireLockWithRetry(lockKey, LOCK_EXPIRY, lockWait, INITIAL_BACKOFF);
            if (lockToken == null) {
                throw new CartBusyException(ownerId);
            }
        }

        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            if (lockToken != null) {
                distributedLock.releaseLock(lockKey, lockToken);
            }
        }
    }

    /**
     * Add an item, merging with an existing line. Re-validates that the item is active and that
     * the total quantity in the cart is currently available.
     */
    public CartSnapshot addItem(String ownerId, String itemId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        storeStateService.requireOpen();

        return underOwnerLock(ownerId, () -> {
            Item item = itemRepository.findById(itemId)
                    .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
            if (!item.isPurchasable()) {
                throw new StaleCartItemException(itemId, StaleCartItemException.Reason.ITEM_UNAVAILABLE);
            }

            Cart cart = lockCart(ownerId).orElseGet(() -> Cart.emptyFor(ownerId));
            int wanted = cart.findLine(itemId).map(CartLine::getQuantity).orElse(0) + quantity;
            if (item.availableForSale() < wanted) {
                throw new InsufficientStockException(itemId, wanted, item.availableForSale());
            }

            cart.addOrMerge(itemId, quantity, item.getPriceMinor(), Instant.now());
            cart = cartRepository.save(cart);

            logger.info("Added {} x {} to cart of {}", quantity, itemId, ownerId);
            return snapshotOf(cart);
        });
    }

    /**
     * Remove an item from the cart, or only {@code quantity} units of it when given.
     */
    public CartSnapshot removeItem(String ownerId, String itemId, Integer quantity) {
        if (quantity != null && quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        return underOwnerLock(ownerId, () -> {
            Optional<Cart> existing = lockCart(ownerId);
            if (existing.isEmpty()) {
                return CartSnapshot.empty(ownerId);
            }
            Cart cart = existing.get();
            if (cart.remove(itemId, quantity, Instant.now())) {
                cart = cartRepository.save(cart);
                logger.info("Removed {} from cart of {}", itemId, ownerId);
            }
            return snapshotOf(cart);
        });
    }

    @Transactional(readOnly = true)
    public CartSnapshot view(String ownerId) {
        return cartRepository.findById(ownerId)
                .map(this::snapshotOf)
                .orElseGet(() -> CartSnapshot.empty(ownerId));
    }

    public void clear(String ownerId) {
        underOwnerLock(ownerId, () -> {
            lockCart(ownerId).ifPresent(cart -> {
                cart.clear(Instant.now());
                cartRepository.save(cart);
            });
            return null;
        });
        logger.info("Cleared cart of {}", ownerId);
    }

    /**
     * Administrative overview of all carts that hold something.
     */
    @Transactional(readOnly = true)
    public List<CartSnapshot> listCarts() {
        return cartRepository.findNonEmpty().stream()
                .map(this::snapshotOf)
                .collect(Collectors.toList());
    }

    /**
     * Delete every cart.
     *
     * @return Number of carts deleted
     */
    @Transactional
    public int wipeAll(String staffId) {
        List<Cart> carts = cartRepository.findAll();
        cartRepository.deleteAll(carts);
        logger.warn("All {} carts wiped by {}", carts.size(), staffId);
        return carts.size();
    }

    /**
     * Put the lines of an order that never reached payment back into its owner's cart,
     * with the prices the buyer originally saw.
     */
    public CartSnapshot restoreLines(String ownerId, List<OrderLine> lines) {
        return underOwnerLock(ownerId, () -> {
            Cart cart = lockCart(ownerId).orElseGet(() -> Cart.emptyFor(ownerId));
            Instant now = Instant.now();
            for (OrderLine line : lines) {
                cart.addOrMerge(line.getItemId(), line.getQuantity(), line.getUnitPriceMinor(), now);
            }
            logger.info("Restored {} lines to cart of {}", lines.size(), ownerId);
            return snapshotOf(cartRepository.save(cart));
        });
    }

    public Cart saveCart(Cart cart) {
        return cartRepository.save(cart);
    }

    /**
     * Lock an owner's cart row in the current transaction.
     */
    public Optional<Cart> lockCart(String ownerId) {
        return cartRepository.findByIdWithLock(ownerId);
    }

    @Transactional(readOnly = true)
    public List<String> findOwnersDueForReminder(Instant cutoff) {
        return cartRepository.findOwnersDueForReminder(cutoff);
    }

    /**
     * Stamp an idle cart as reminded and emit the reminder.
     * The stamp is a guarded update: concurrent sweeps remind an owner once per idle period.
     *
     * @return true if this call sent the reminder
     */
    @Transactional
    public boolean remindIfInactive(String ownerId, Instant cutoff, Instant now) {
        int updated = cartRepository.markReminded(ownerId, cutoff, now);
        if (updated == 0) {
            logger.debug("Cart of {} already reminded or active again", ownerId);
            return false;
        }
        eventPublisher.publishEvent(StoreNotification.of(StoreNotification.Type.CART_REMINDER, ownerId, ownerId));
        return true;
    }

    CartSnapshot snapshotOf(Cart cart) {
        List<String> itemIds = cart.getLines().stream().map(CartLine::getItemId).collect(Collectors.toList());
        Map<String, String> names = itemRepository.findAllById(itemIds).stream()
                .collect(Collectors.toMap(Item::getItemId, Item::getName));

        List<CartSnapshot.Line> lines = cart.getLines().stream()
                .map(line -> new CartSnapshot.Line(
                        line.getItemId(),
                        names.getOrDefault(line.getItemId(), "(removed item)"),
                        line.getQuantity(),
                        line.getPriceSnapshotMinor()))
                .collect(Collectors.toList());
        return new CartSnapshot(cart.getOwnerId(), lines, cart.getLastActivityAt());
    }
}
