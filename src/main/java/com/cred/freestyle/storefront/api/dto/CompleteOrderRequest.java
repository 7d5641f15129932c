package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Request DTO for staff completion of an order.
 *
 * @author Storefront Team
 */
public class CompleteOrderRequest {

    @Size(max = 500, message = "Note must be at most 500 characters")
    private String note;

    public CompleteOrderRequest() {
    }

    public CompleteOrderRequest(String note) {
        this.note = note;
    }

    // Getters and setters
    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }
}
