package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.DigitalAsset;
import com.cred.freestyle.storefront.domain.model.DigitalAsset.AssetStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;

/**
 * Repository interface for DigitalAsset entity (license key pool).
 *
 * @author Storefront Team
 */
@Repository
public interface DigitalAssetRepository extends JpaRepository<DigitalAsset, String> {

    /**
     * Lock the next available assets of an item so two orders never receive the same key.
     *
     * @param itemId Item ID
     * @param pageable How many assets to claim
     * @return Locked available assets, oldest first
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM DigitalAsset a WHERE a.itemId = :itemId AND a.status = 'AVAILABLE' " +
           "ORDER BY a.createdAt ASC, a.assetId ASC")
    List<DigitalAsset> findAvailableForUpdate(@Param("itemId") String itemId, Pageable pageable);

    long countByItemIdAndStatus(String itemId, AssetStatus status);

    List<DigitalAsset> findByOrderId(String orderId);
}
