package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.BuyerTierRule;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.TierGrant;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.BuyerTierRuleRepository;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.repository.TierGrantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Grants buyer tiers from lifetime spend.
 *
 * Lifetime spend is the sum of totals of the owner's FULFILLED and REVIEWED orders. Every rule
 * whose threshold the spend has reached is granted once; a grant row is never deleted, so a tier
 * an admin revoked is not granted again. Evaluations for one owner are serialized on the
 * customer row.
 *
 * @author Storefront Team
 */
@Service
public class BuyerTierEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(BuyerTierEvaluator.class);

    static final Set<OrderState> COUNTED_STATES = EnumSet.of(OrderState.FULFILLED, OrderState.REVIEWED);

    private final BuyerTierRuleRepository ruleRepository;
    private final TierGrantRepository grantRepository;
    private final OrderRepository orderRepository;
    private final CustomerService customerService;
    private final ApplicationEventPublisher eventPublisher;
    private final StorefrontMetricsService metricsService;

    public BuyerTierEvaluator(
            BuyerTierRuleRepository ruleRepository,
            TierGrantRepository grantRepository,
            OrderRepository orderRepository,
            CustomerService customerService,
            ApplicationEventPublisher eventPublisher,
            StorefrontMetricsService metricsService
    ) {
        this.ruleRepository = ruleRepository;
        this.grantRepository = grantRepository;
        this.orderRepository = orderRepository;
        this.customerService = customerService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Recompute the owner's lifetime spend and grant every tier it newly qualifies for.
     *
     * @return Role ids granted by this call
     */
    @Transactional
    public List<String> evaluate(String ownerId) {
        customerService.lockCustomer(ownerId);

        long lifetimeTotal = orderRepository.sumTotalByOwnerAndStates(ownerId, COUNTED_STATES);
        customerService.updateLifetimeTotal(ownerId, lifetimeTotal);

        List<String> granted = new ArrayList<>();
        for (BuyerTierRule rule : ruleRepository
                .findBySpendThresholdMinorLessThanEqualOrderBySpendThresholdMinorAsc(lifetimeTotal)) {

            if (grantRepository.existsByOwnerIdAndRoleId(ownerId, rule.getRoleId())) {
                continue;
            }

            grantRepository.save(TierGrant.builder()
                    .ownerId(ownerId)
                    .roleId(rule.getRoleId())
                    .grantedAt(Instant.now())
                    .build());
            granted.add(rule.getRoleId());

            metricsService.recordTierGrant(rule.getRoleId());
            eventPublisher.publishEvent(StoreNotification.of(
                            StoreNotification.Type.TIER_GRANTED, ownerId, rule.getRoleId())
                    .with("thresholdMinor", rule.getSpendThresholdMinor())
                    .with("lifetimeTotalMinor", lifetimeTotal));
            logger.info("Granted tier {} to {} (lifetime spend {} >= {})",
                    rule.getRoleId(), ownerId, lifetimeTotal, rule.getSpendThresholdMinor());
        }
        return granted;
    }

    // ===== Rule management =====

    /**
     * Create a rule or move an existing role to a new threshold.
     * Two roles cannot share a threshold.
     */
    @Transactional
    public BuyerTierRule addRule(String roleId, long spendThresholdMinor) {
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("Role id is required");
        }
        if (spendThresholdMinor < 0) {
            throw new IllegalArgumentException("Spend threshold cannot be negative");
        }

        ruleRepository.findBySpendThresholdMinor(spendThresholdMinor)
                .filter(existing -> !existing.getRoleId().equals(roleId))
                .ifPresent(existing -> {
                    throw new IllegalArgumentException(
                            "Threshold " + spendThresholdMinor + " is already used by role " + existing.getRoleId());
                });

        BuyerTierRule rule = ruleRepository.findById(roleId)
                .orElseGet(() -> BuyerTierRule.builder().roleId(roleId).build());
        rule.setSpendThresholdMinor(spendThresholdMinor);

        logger.info("Tier rule {} set to threshold {}", roleId, spendThresholdMinor);
        return ruleRepository.save(rule);
    }

    @Transactional
    public void removeRule(String roleId) {
        BuyerTierRule rule = ruleRepository.findById(roleId)
                .orElseThrow(() -> new ResourceNotFoundException("Tier rule", roleId));
        ruleRepository.delete(rule);
        logger.info("Tier rule {} removed", roleId);
    }

    @Transactional(readOnly = true)
    public List<BuyerTierRule> listRules() {
        return ruleRepository.findAllByOrderBySpendThresholdMinorAsc();
    }

    /**
     * Role ids the owner currently holds.
     */
    @Transactional(readOnly = true)
    public List<String> currentTiers(String ownerId) {
        return grantRepository.findByOwnerIdAndRevokedAtIsNullOrderByGrantedAtAsc(ownerId).stream()
                .map(TierGrant::getRoleId)
                .collect(Collectors.toList());
    }

    /**
     * Take a tier away. The grant record stays, so evaluation will not grant it again.
     */
    @Transactional
    public TierGrant revoke(String ownerId, String roleId, String adminId) {
        TierGrant grant = grantRepository.findByOwnerIdAndRoleId(ownerId, roleId)
                .orElseThrow(() -> new ResourceNotFoundException("Tier grant", ownerId + "/" + roleId));
        if (!grant.isActive()) {
            return grant;
        }

        grant.revoke(adminId);
        TierGrant saved = grantRepository.save(grant);

        eventPublisher.publishEvent(StoreNotification.of(StoreNotification.Type.TIER_REVOKED, ownerId, roleId)
                .with("revokedBy", adminId));
        logger.info("Tier {} revoked from {} by {}", roleId, ownerId, adminId);
        return saved;
    }
}
