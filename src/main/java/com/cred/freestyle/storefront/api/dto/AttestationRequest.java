package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for staff confirmation of a crypto payment.
 *
 * @author Storefront Team
 */
public class AttestationRequest {

    @NotBlank(message = "Evidence is required")
    @Size(max = 1000, message = "Evidence must be at most 1000 characters")
    private String evidence;

    public AttestationRequest() {
    }

    public AttestationRequest(String evidence) {
        this.evidence = evidence;
    }

    // Getters and setters
    public String getEvidence() {
        return evidence;
    }

    public void setEvidence(String evidence) {
        this.evidence = evidence;
    }
}
