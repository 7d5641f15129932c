package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.OrderLine;
import com.cred.freestyle.storefront.domain.model.StockReservation;
import com.cred.freestyle.storefront.domain.model.StockReservation.ReservationStatus;
import com.cred.freestyle.storefront.exception.InsufficientStockException;
import com.cred.freestyle.storefront.exception.ReservationInvariantViolationException;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.ItemRepository;
import com.cred.freestyle.storefront.repository.StockReservationRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Authoritative stock counts per item with reserve / commit / release.
 *
 * Every operation takes the item's row lock (SELECT ... FOR UPDATE) before reading the
 * counters, so operations on one item are serialized and two reservations can never both
 * succeed when together they exceed availability. Multi-item reservations lock rows in
 * ascending item id order to rule out deadlocks between concurrent checkouts.
 *
 * Commit and release are checked against the order's StockReservation rows; a mismatch is an
 * accounting bug and aborts the operation with {@link ReservationInvariantViolationException}.
 *
 * @author Storefront Team
 */
@Service
public class InventoryLedger {

    private static final Logger logger = LoggerFactory.getLogger(InventoryLedger.class);

    private final ItemRepository itemRepository;
    private final StockReservationRepository reservationRepository;
    private final StorefrontMetricsService metricsService;
    private final EntityManager entityManager;

    public InventoryLedger(
            ItemRepository itemRepository,
            StockReservationRepository reservationRepository,
            StorefrontMetricsService metricsService,
            EntityManager entityManager
    ) {
        this.itemRepository = itemRepository;
        this.reservationRepository = reservationRepository;
        this.metricsService = metricsService;
        this.entityManager = entityManager;
    }

    /**
     * Reserve a single item for an order.
     *
     * @throws InsufficientStockException if available-for-sale is below the requested quantity
     */
    @Transactional
    public StockReservation reserve(String orderId, String itemId, int quantity) {
        return reserveAll(orderId, Map.of(itemId, quantity)).get(0);
    }

    /**
     * Reserve every line of an order as one unit.
     * All rows are locked and checked before any counter moves; on a shortfall nothing is
     * written and the surrounding transaction rolls back as a whole.
     *
     * @param orderId Order holding the stock
     * @param quantities Quantity per item id
     * @return Created reservation records, in item id order
     * @throws InsufficientStockException on the first item that cannot be covered
     */
    @Transactional
    public List<StockReservation> reserveAll(String orderId, Map<String, Integer> quantities) {
        Map<String, Integer> ordered = new TreeMap<>(quantities);
        List<Item> locked = new ArrayList<>(ordered.size());

        for (Map.Entry<String, Integer> entry : ordered.entrySet()) {
            String itemId = entry.getKey();
            int quantity = entry.getValue();
            if (quantity <= 0) {
                throw new IllegalArgumentException("Reservation quantity must be positive for item " + itemId);
            }

            Item item = lockItem(itemId);
            if (item.availableForSale() < quantity) {
                logger.warn("Insufficient stock for item {} (order {}): requested {}, available {}",
                        itemId, orderId, quantity, item.availableForSale());
                metricsService.recordInsufficientStock(itemId);
                throw new InsufficientStockException(itemId, quantity, item.availableForSale());
            }
            locked.add(item);
        }

        List<StockReservation> reservations = new ArrayList<>(locked.size());
        for (Item item : locked) {
            int quantity = ordered.get(item.getItemId());
            item.setQuantityReserved(item.getQuantityReserved() + quantity);
            itemRepository.save(item);

            reservations.add(reservationRepository.save(StockReservation.builder()
                    .orderId(orderId)
                    .itemId(item.getItemId())
                    .quantity(quantity)
                    .status(ReservationStatus.RESERVED)
                    .build()));
            metricsService.recordStockMovement("reserved", quantity);
        }

        logger.info("Reserved {} item(s) for order {}", reservations.size(), orderId);
        return reservations;
    }

    /**
     * Move reserved quantity to a permanent decrement of quantity_available.
     *
     * @throws ReservationInvariantViolationException if the order holds no matching reservation
     */
    @Transactional
    public void commit(String orderId, String itemId, int quantity) {
        StockReservation reservation = outstandingReservation(orderId, itemId, quantity);
        Item item = lockItem(itemId);

        if (item.getQuantityReserved() < quantity || item.getQuantityAvailable() < quantity) {
            throw violation(orderId, itemId, String.format(
                    "cannot commit %d with reserved=%d available=%d",
                    quantity, item.getQuantityReserved(), item.getQuantityAvailable()));
        }

        item.setQuantityReserved(item.getQuantityReserved() - quantity);
        item.setQuantityAvailable(item.getQuantityAvailable() - quantity);
        itemRepository.save(item);

        reservation.commit();
        reservationRepository.save(reservation);
        metricsService.recordStockMovement("committed", quantity);
        logger.debug("Committed {} of item {} for order {}", quantity, itemId, orderId);
    }

    /**
     * Return reserved quantity to availability.
     *
     * @throws ReservationInvariantViolationException if the order holds no matching reservation
     */
    @Transactional
    public void release(String orderId, String itemId, int quantity) {
        StockReservation reservation = outstandingReservation(orderId, itemId, quantity);
        Item item = lockItem(itemId);

        if (item.getQuantityReserved() < quantity) {
            throw violation(orderId, itemId, String.format(
                    "cannot release %d with reserved=%d", quantity, item.getQuantityReserved()));
        }

        item.setQuantityReserved(item.getQuantityReserved() - quantity);
        itemRepository.save(item);

        reservation.release();
        reservationRepository.save(reservation);
        metricsService.recordStockMovement("released", quantity);
        logger.debug("Released {} of item {} for order {}", quantity, itemId, orderId);
    }

    /**
     * Commit every line of an order.
     */
    @Transactional
    public void commitAll(String orderId, List<OrderLine> lines) {
        for (OrderLine line : sortedByItem(lines)) {
            commit(orderId, line.getItemId(), line.getQuantity());
        }
    }

    /**
     * Release every line of an order.
     */
    @Transactional
    public void releaseAll(String orderId, List<OrderLine> lines) {
        for (OrderLine line : sortedByItem(lines)) {
            release(orderId, line.getItemId(), line.getQuantity());
        }
        logger.info("Released stock for order {}", orderId);
    }

    /**
     * Commit whatever the order still holds. Lines already committed are skipped.
     *
     * @return Number of reservations committed
     */
    @Transactional
    public int commitOutstanding(String orderId) {
        List<StockReservation> outstanding =
                reservationRepository.findByOrderIdAndStatusOrderByItemIdAsc(orderId, ReservationStatus.RESERVED);
        for (StockReservation reservation : outstanding) {
            commit(orderId, reservation.getItemId(), reservation.getQuantity());
        }
        return outstanding.size();
    }

    /**
     * Whether the order still has stock on hold.
     */
    @Transactional(readOnly = true)
    public boolean hasOutstanding(String orderId) {
        return !reservationRepository
                .findByOrderIdAndStatusOrderByItemIdAsc(orderId, ReservationStatus.RESERVED)
                .isEmpty();
    }

    /**
     * Add units to quantity_available.
     *
     * @return The item after restock
     */
    @Transactional
    public Item restock(String itemId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Restock quantity must be positive");
        }
        Item item = lockItem(itemId);
        item.setQuantityAvailable(item.getQuantityAvailable() + quantity);
        item = itemRepository.save(item);

        metricsService.recordStockMovement("restocked", quantity);
        logger.info("Restocked item {} by {}, available now {}", itemId, quantity, item.getQuantityAvailable());
        return item;
    }

    private StockReservation outstandingReservation(String orderId, String itemId, int quantity) {
        StockReservation reservation = reservationRepository.findByOrderIdAndItemId(orderId, itemId)
                .orElseThrow(() -> violation(orderId, itemId, "no reservation recorded"));

        if (!reservation.isOutstanding()) {
            throw violation(orderId, itemId, "reservation already " + reservation.getStatus());
        }
        if (reservation.getQuantity() != quantity) {
            throw violation(orderId, itemId, String.format(
                    "reserved %d but asked for %d", reservation.getQuantity(), quantity));
        }
        return reservation;
    }

    /**
     * Lock the item row and re-read its counters.
     * An instance already loaded earlier in the transaction would otherwise keep the counters it
     * was read with before the lock was granted.
     */
    private Item lockItem(String itemId) {
        Item item = itemRepository.findByIdWithLock(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
        entityManager.refresh(item, LockModeType.PESSIMISTIC_WRITE);
        return item;
    }

    private ReservationInvariantViolationException violation(String orderId, String itemId, String detail) {
        ReservationInvariantViolationException ex = new ReservationInvariantViolationException(orderId, itemId, detail);
        logger.error(ex.getMessage());
        metricsService.recordError("RESERVATION_INVARIANT_VIOLATION", "inventoryLedger");
        return ex;
    }

    private static List<OrderLine> sortedByItem(List<OrderLine> lines) {
        List<OrderLine> sorted = new ArrayList<>(lines);
        sorted.sort((a, b) -> a.getItemId().compareTo(b.getItemId()));
        return sorted;
    }
}
