package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request DTO carrying a positive quantity (restock).
 *
 * @author Storefront Team
 */
public class QuantityRequest {

    @NotNull(message = "Quantity is required")
    @Positive(message = "Quantity must be positive")
    private Integer quantity;

    public QuantityRequest() {
    }

    public QuantityRequest(Integer quantity) {
        this.quantity = quantity;
    }

    // Getters and setters
    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }
}
