package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.BuyerTierRule;

import java.time.Instant;

/**
 * Response DTO for a buyer tier rule.
 *
 * @author Storefront Team
 */
public class TierRuleResponse {

    private String roleId;

    private Long spendThresholdMinor;

    private Instant createdAt;

    public TierRuleResponse() {
    }

    public static TierRuleResponse fromEntity(BuyerTierRule rule) {
        TierRuleResponse response = new TierRuleResponse();
        response.setRoleId(rule.getRoleId());
        response.setSpendThresholdMinor(rule.getSpendThresholdMinor());
        response.setCreatedAt(rule.getCreatedAt());
        return response;
    }

    // Getters and setters
    public String getRoleId() {
        return roleId;
    }

    public void setRoleId(String roleId) {
        this.roleId = roleId;
    }

    public Long getSpendThresholdMinor() {
        return spendThresholdMinor;
    }

    public void setSpendThresholdMinor(Long spendThresholdMinor) {
        this.spendThresholdMinor = spendThresholdMinor;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
