package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Provider notification that a payment changed.
 * Only the reference is read; the payment itself is looked up again.
 *
 * @author Storefront Team
 */
public class PaymentCallbackRequest {

    @NotBlank(message = "Payment reference is required")
    private String paymentRef;

    public PaymentCallbackRequest() {
    }

    public PaymentCallbackRequest(String paymentRef) {
        this.paymentRef = paymentRef;
    }

    // Getters and setters
    public String getPaymentRef() {
        return paymentRef;
    }

    public void setPaymentRef(String paymentRef) {
        this.paymentRef = paymentRef;
    }
}
