package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Cart;
import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.Item.ItemStatus;
import com.cred.freestyle.storefront.domain.model.OrderLine;
import com.cred.freestyle.storefront.exception.CartBusyException;
import com.cred.freestyle.storefront.exception.InsufficientStockException;
import com.cred.freestyle.storefront.exception.ShopClosedException;
import com.cred.freestyle.storefront.exception.StaleCartItemException;
import com.cred.freestyle.storefront.infrastructure.lock.RedisDistributedLock;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.repository.CartRepository;
import com.cred.freestyle.storefront.repository.ItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CartService.
 * Tests add/remove validation, per-owner locking and reminders.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartService Unit Tests")
class CartServiceTest {

    private static final String OWNER = "user-1";
    private static final String LOCK_KEY = "lock:cart:" + OWNER;

    @Mock
    private CartRepository cartRepository;

    @Mock
    private ItemRepository itemRepository;

    @Mock
    private StoreStateService storeStateService;

    @Mock
    private RedisDistributedLock distributedLock;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private CartService cartService;

    private Item item;

    @BeforeEach
    void setUp() {
        cartService = new CartService(
                cartRepository,
                itemRepository,
                storeStateService,
                distributedLock,
                eventPublisher,
                transactionManager,
                true,
                Duration.ofMillis(100)
        );

        item = Item.builder()
                .itemId("item-1")
                .name("Gift Card")
                .priceMinor(1000L)
                .quantityAvailable(3)
                .quantityReserved(0)
                .status(ItemStatus.ACTIVE)
                .build();
    }

    private void lockGranted() {
        when(distributedLock.acquireLockWithRetry(eq(LOCK_KEY), any(), any(), any())).thenReturn("token");
    }

    // ========================================
    // addItem() Tests
    // ========================================

    @Test
    @DisplayName("addItem - Success: Should create the cart and add a line with the current price")
    void addItem_Success() {
        // Given
        lockGranted();
        when(itemRepository.findById("item-1")).thenReturn(Optional.of(item));
        when(cartRepository.findByIdWithLock(OWNER)).thenReturn(Optional.empty());
        when(cartRepository.save(any(Cart.class))).thenAnswer(inv -> inv.getArgument(0));
        when(itemRepository.findAllById(List.of("item-1"))).thenReturn(List.of(item));

        // When
        CartSnapshot snapshot = cartService.addItem(OWNER, "item-1", 2);

        // Then
        assertThat(snapshot.getLines()).hasSize(1);
        assertThat(snapshot.getLines().get(0).getItemName()).isEqualTo("Gift Card");
        assertThat(snapshot.getLines().get(0).getQuantity()).isEqualTo(2);
        assertThat(snapshot.getTotalMinor()).isEqualTo(2000L);
        verify(distributedLock).releaseLock(LOCK_KEY, "token");
    }

    @Test
    @DisplayName("addItem - Merge exceeding stock: Should reject and keep the cart")
    void addItem_MergedQuantityExceedsStock() {
        // Given
        lockGranted();
        Cart cart = Cart.emptyFor(OWNER);
        cart.addOrMerge("item-1", 2, 1000L, Instant.now());
        when(itemRepository.findById("item-1")).thenReturn(Optional.of(item));
        when(cartRepository.findByIdWithLock(OWNER)).thenReturn(Optional.of(cart));

        // When / Then
        assertThatThrownBy(() -> cartService.addItem(OWNER, "item-1", 2))
                .isInstanceOf(InsufficientStockException.class);
        verify(cartRepository, never()).save(any());
        verify(distributedLock).releaseLock(LOCK_KEY, "token");
    }

    @Test
    @DisplayName("addItem - Hidden item: Should reject as unavailable")
    void addItem_HiddenItem() {
        // Given
        lockGranted();
        item.setStatus(ItemStatus.HIDDEN);
        when(itemRepository.findById("item-1")).thenReturn(Optional.of(item));

        // When / Then
        assertThatThrownBy(() -> cartService.addItem(OWNER, "item-1", 1))
                .isInstanceOf(StaleCartItemException.class)
                .extracting("reason")
                .isEqualTo(StaleCartItemException.Reason.ITEM_UNAVAILABLE);
    }

    @Test
    @DisplayName("addItem - Shop closed: Should reject before taking the lock")
    void addItem_ShopClosed() {
        // Given
        doThrow(new ShopClosedException()).when(storeStateService).requireOpen();

        // When / Then
        assertThatThrownBy(() -> cartService.addItem(OWNER, "item-1", 1))
                .isInstanceOf(ShopClosedException.class);
        verifyNoInteractions(distributedLock);
    }

    @Test
    @DisplayName("addItem - Lock held elsewhere: Should report the cart busy")
    void addItem_LockNotAcquired() {
        // Given
        when(distributedLock.acquireLockWithRetry(eq(LOCK_KEY), any(), any(), any())).thenReturn(null);

        // When / Then
        assertThatThrownBy(() -> cartService.addItem(OWNER, "item-1", 1))
                .isInstanceOf(CartBusyException.class);
        verifyNoInteractions(cartRepository);
        verify(distributedLock, never()).releaseLock(any(), any());
    }

    @Test
    @DisplayName("addItem - Non-positive quantity: Should reject")
    void addItem_NonPositiveQuantity() {
        assertThatThrownBy(() -> cartService.addItem(OWNER, "item-1", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ========================================
    // removeItem() / view() Tests
    // ========================================

    @Test
    @DisplayName("removeItem - No cart: Should return an empty snapshot")
    void removeItem_NoCart() {
        // Given
        lockGranted();
        when(cartRepository.findByIdWithLock(OWNER)).thenReturn(Optional.empty());

        // When
        CartSnapshot snapshot = cartService.removeItem(OWNER, "item-1", null);

        // Then
        assertThat(snapshot.isEmpty()).isTrue();
        verify(cartRepository, never()).save(any());
    }

    @Test
    @DisplayName("view - Removed catalog item: Should still show the line with a placeholder name")
    void view_RemovedItemPlaceholder() {
        // Given
        Cart cart = Cart.emptyFor(OWNER);
        cart.addOrMerge("gone", 1, 250L, Instant.now());
        when(cartRepository.findById(OWNER)).thenReturn(Optional.of(cart));
        when(itemRepository.findAllById(List.of("gone"))).thenReturn(List.of());

        // When
        CartSnapshot snapshot = cartService.view(OWNER);

        // Then
        assertThat(snapshot.getLines().get(0).getItemName()).isEqualTo("(removed item)");
        assertThat(snapshot.getTotalMinor()).isEqualTo(250L);
    }

    // ========================================
    // restoreLines() / wipeAll() Tests
    // ========================================

    @Test
    @DisplayName("restoreLines - Should put order lines back with their original prices")
    void restoreLines_UsesOrderPrices() {
        // Given
        lockGranted();
        when(cartRepository.findByIdWithLock(OWNER)).thenReturn(Optional.empty());
        when(cartRepository.save(any(Cart.class))).thenAnswer(inv -> inv.getArgument(0));
        when(itemRepository.findAllById(anyList())).thenReturn(List.of(item));

        // When
        CartSnapshot snapshot = cartService.restoreLines(OWNER, List.of(
                OrderLine.builder().itemId("item-1").itemName("Gift Card").quantity(1).unitPriceMinor(900L).build()));

        // Then
        assertThat(snapshot.getLines().get(0).getPriceSnapshotMinor()).isEqualTo(900L);
    }

    @Test
    @DisplayName("wipeAll - Should delete every cart and report the count")
    void wipeAll_DeletesEverything() {
        // Given
        List<Cart> carts = List.of(Cart.emptyFor("a"), Cart.emptyFor("b"));
        when(cartRepository.findAll()).thenReturn(carts);

        // When
        int wiped = cartService.wipeAll("staff-1");

        // Then
        assertThat(wiped).isEqualTo(2);
        verify(cartRepository).deleteAll(carts);
    }

    // ========================================
    // remindIfInactive() Tests
    // ========================================

    @Test
    @DisplayName("remindIfInactive - Stamp applied: Should publish one reminder")
    void remindIfInactive_Sends() {
        // Given
        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofHours(48));
        when(cartRepository.markReminded(OWNER, cutoff, now)).thenReturn(1);

        // When
        boolean sent = cartService.remindIfInactive(OWNER, cutoff, now);

        // Then
        assertThat(sent).isTrue();
        ArgumentCaptor<StoreNotification> captor = ArgumentCaptor.forClass(StoreNotification.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(StoreNotification.Type.CART_REMINDER);
    }

    @Test
    @DisplayName("remindIfInactive - Already reminded: Should publish nothing")
    void remindIfInactive_AlreadyReminded() {
        Instant now = Instant.now();
        when(cartRepository.markReminded(eq(OWNER), any(), eq(now))).thenReturn(0);

        assertThat(cartService.remindIfInactive(OWNER, now.minusSeconds(10), now)).isFalse();
        verifyNoInteractions(eventPublisher);
    }
}
