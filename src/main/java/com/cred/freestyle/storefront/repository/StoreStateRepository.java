package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.StoreState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

/**
 * Repository interface for the single-row StoreState entity.
 *
 * @author Storefront Team
 */
@Repository
public interface StoreStateRepository extends JpaRepository<StoreState, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StoreState s WHERE s.stateId = :stateId")
    Optional<StoreState> findByIdWithLock(@Param("stateId") String stateId);
}
