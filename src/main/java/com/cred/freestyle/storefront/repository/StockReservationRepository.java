package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.StockReservation;
import com.cred.freestyle.storefront.domain.model.StockReservation.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for StockReservation entity.
 *
 * @author Storefront Team
 */
@Repository
public interface StockReservationRepository extends JpaRepository<StockReservation, String> {

    Optional<StockReservation> findByOrderIdAndItemId(String orderId, String itemId);

    List<StockReservation> findByOrderIdAndStatusOrderByItemIdAsc(String orderId, ReservationStatus status);

    List<StockReservation> findByOrderId(String orderId);

    /**
     * Total quantity currently held for an item across all orders.
     * Used to audit an item's quantity_reserved counter.
     *
     * @param itemId Item ID
     * @return Sum of RESERVED quantities
     */
    @Query("SELECT COALESCE(SUM(r.quantity), 0) FROM StockReservation r " +
           "WHERE r.itemId = :itemId AND r.status = 'RESERVED'")
    long sumOutstandingQuantity(@Param("itemId") String itemId);
}
