package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for checking out the caller's cart.
 *
 * @author Storefront Team
 */
public class CheckoutRequest {

    @NotNull(message = "Payment method is required")
    private PaymentMethod paymentMethod;

    public CheckoutRequest() {
    }

    public CheckoutRequest(PaymentMethod paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    // Getters and setters
    public PaymentMethod getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(PaymentMethod paymentMethod) {
        this.paymentMethod = paymentMethod;
    }
}
