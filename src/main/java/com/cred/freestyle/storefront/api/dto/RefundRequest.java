package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for refunding a paid order.
 *
 * @author Storefront Team
 */
public class RefundRequest {

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;

    public RefundRequest() {
    }

    public RefundRequest(String reason) {
        this.reason = reason;
    }

    // Getters and setters
    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
