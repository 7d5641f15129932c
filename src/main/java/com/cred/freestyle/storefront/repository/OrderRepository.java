package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.service.ItemSalesSummary;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Order entity.
 *
 * @author Storefront Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * Find order by ID with pessimistic write lock.
     * Every state transition of an order runs under this lock.
     *
     * @param orderId Order ID
     * @return Optional containing the locked order if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLock(@Param("orderId") String orderId);

    Optional<Order> findByPaymentRef(String paymentRef);

    List<Order> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    /**
     * Find orders whose payment window has closed.
     * Orders whose buyer reported a manual payment, or whose provider payment did not match,
     * wait for staff and are excluded.
     *
     * @param now Current timestamp
     * @return IDs of expired orders
     */
    @Query("SELECT o.orderId FROM Order o WHERE o.state = 'AWAITING_PAYMENT' " +
           "AND o.expiresAt < :now AND o.manualVerificationRequestedAt IS NULL " +
           "AND o.paymentIssue IS NULL")
    List<String> findExpiredAwaitingPayment(@Param("now") Instant now);

    /**
     * Find orders waiting on a provider that can be polled.
     *
     * @param method Payment method
     * @return IDs of orders with a payment reference, oldest first
     */
    @Query("SELECT o.orderId FROM Order o WHERE o.state = 'AWAITING_PAYMENT' " +
           "AND o.paymentMethod = :method AND o.paymentRef IS NOT NULL ORDER BY o.createdAt ASC")
    List<String> findPendingPayments(@Param("method") PaymentMethod method);

    List<Order> findByStateAndManualFulfillmentPendingTrueOrderByCreatedAtAsc(OrderState state);

    List<Order> findByStateAndManualVerificationRequestedAtIsNotNullOrderByCreatedAtAsc(OrderState state);

    /**
     * Lifetime spend of a buyer over orders in the given states.
     *
     * @param ownerId Buyer
     * @param states Counted states
     * @return Sum of order totals in minor units
     */
    @Query("SELECT COALESCE(SUM(o.totalMinor), 0) FROM Order o " +
           "WHERE o.ownerId = :ownerId AND o.state IN :states")
    long sumTotalByOwnerAndStates(@Param("ownerId") String ownerId,
                                  @Param("states") Collection<OrderState> states);

    @Query("SELECT new com.cred.freestyle.storefront.service.ItemSalesSummary(" +
           "l.itemId, MAX(l.itemName), SUM(l.quantity), SUM(l.unitPriceMinor * l.quantity)) " +
           "FROM Order o JOIN o.lines l " +
           "WHERE o.state IN :states AND o.createdAt >= :since " +
           "GROUP BY l.itemId ORDER BY SUM(l.quantity) DESC")
    List<ItemSalesSummary> findTopSellingItems(@Param("states") Collection<OrderState> states,
                                               @Param("since") Instant since,
                                               Pageable pageable);

    @Query("SELECT new com.cred.freestyle.storefront.service.ItemSalesSummary(" +
           "l.itemId, MAX(l.itemName), SUM(l.quantity), SUM(l.unitPriceMinor * l.quantity)) " +
           "FROM Order o JOIN o.lines l " +
           "WHERE o.state IN :states AND l.itemId = :itemId " +
           "GROUP BY l.itemId")
    Optional<ItemSalesSummary> findItemSales(@Param("itemId") String itemId,
                                             @Param("states") Collection<OrderState> states);
}
