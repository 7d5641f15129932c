package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.BuyerTierRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for BuyerTierRule entity.
 *
 * @author Storefront Team
 */
@Repository
public interface BuyerTierRuleRepository extends JpaRepository<BuyerTierRule, String> {

    List<BuyerTierRule> findAllByOrderBySpendThresholdMinorAsc();

    List<BuyerTierRule> findBySpendThresholdMinorLessThanEqualOrderBySpendThresholdMinorAsc(Long lifetimeTotalMinor);

    Optional<BuyerTierRule> findBySpendThresholdMinor(Long spendThresholdMinor);
}
