package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request DTO for changing a store credit balance.
 *
 * @author Storefront Team
 */
public class CreditRequest {

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    private Long amountMinor;

    public CreditRequest() {
    }

    public CreditRequest(Long amountMinor) {
        this.amountMinor = amountMinor;
    }

    // Getters and setters
    public Long getAmountMinor() {
        return amountMinor;
    }

    public void setAmountMinor(Long amountMinor) {
        this.amountMinor = amountMinor;
    }
}
