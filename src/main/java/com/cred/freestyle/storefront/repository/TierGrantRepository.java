package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.TierGrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for TierGrant entity.
 *
 * @author Storefront Team
 */
@Repository
public interface TierGrantRepository extends JpaRepository<TierGrant, String> {

    Optional<TierGrant> findByOwnerIdAndRoleId(String ownerId, String roleId);

    boolean existsByOwnerIdAndRoleId(String ownerId, String roleId);

    List<TierGrant> findByOwnerIdAndRevokedAtIsNullOrderByGrantedAtAsc(String ownerId);
}
