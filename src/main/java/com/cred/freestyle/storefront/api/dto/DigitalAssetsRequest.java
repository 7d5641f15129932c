package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request DTO for adding deliverable units to a digital item.
 *
 * @author Storefront Team
 */
public class DigitalAssetsRequest {

    @NotEmpty(message = "At least one payload is required")
    private List<String> payloads;

    public DigitalAssetsRequest() {
    }

    public DigitalAssetsRequest(List<String> payloads) {
        this.payloads = payloads;
    }

    // Getters and setters
    public List<String> getPayloads() {
        return payloads;
    }

    public void setPayloads(List<String> payloads) {
        this.payloads = payloads;
    }
}
