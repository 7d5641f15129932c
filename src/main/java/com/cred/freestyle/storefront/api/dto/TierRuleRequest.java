package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request DTO for adding or moving a buyer tier rule.
 *
 * @author Storefront Team
 */
public class TierRuleRequest {

    @NotBlank(message = "Role ID is required")
    private String roleId;

    @NotNull(message = "Spend threshold is required")
    @PositiveOrZero(message = "Spend threshold cannot be negative")
    private Long spendThresholdMinor;

    public TierRuleRequest() {
    }

    public TierRuleRequest(String roleId, Long spendThresholdMinor) {
        this.roleId = roleId;
        this.spendThresholdMinor = spendThresholdMinor;
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
}
