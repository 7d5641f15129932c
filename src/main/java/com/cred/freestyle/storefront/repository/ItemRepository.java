package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.Item.ItemStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Item entity.
 * Provides data access methods for the catalog and the stock ledger with support for pessimistic locking.
 *
 * @author Storefront Team
 */
@Repository
public interface ItemRepository extends JpaRepository<Item, String> {

    /**
     * Find item by ID with pessimistic write lock.
     * Every reserve/commit/release/restock goes through this lock, which makes them
     * indivisible with respect to each other on the same item.
     *
     * @param itemId Item ID
     * @return Optional containing the locked item if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Item i WHERE i.itemId = :itemId")
    Optional<Item> findByIdWithLock(@Param("itemId") String itemId);

    boolean existsByNameIgnoreCase(String name);

    Optional<Item> findByNameIgnoreCase(String name);

    List<Item> findByStatusOrderByNameAsc(ItemStatus status);

    List<Item> findByStatusInOrderByNameAsc(Collection<ItemStatus> statuses);
}
