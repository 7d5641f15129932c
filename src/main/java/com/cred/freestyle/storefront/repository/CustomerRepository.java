package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

/**
 * Repository interface for Customer entity.
 *
 * @author Storefront Team
 */
@Repository
public interface CustomerRepository extends JpaRepository<Customer, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Customer c WHERE c.ownerId = :ownerId")
    Optional<Customer> findByIdWithLock(@Param("ownerId") String ownerId);
}
