package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.StoreState.ShopStatus;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for opening or closing the shop.
 *
 * @author Storefront Team
 */
public class ShopStatusRequest {

    @NotNull(message = "Status is required")
    private ShopStatus status;

    public ShopStatusRequest() {
    }

    public ShopStatusRequest(ShopStatus status) {
        this.status = status;
    }

    // Getters and setters
    public ShopStatus getStatus() {
        return status;
    }

    public void setStatus(ShopStatus status) {
        this.status = status;
    }
}
