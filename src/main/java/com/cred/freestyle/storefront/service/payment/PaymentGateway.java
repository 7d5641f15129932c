package com.cred.freestyle.storefront.service.payment;

import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.exception.PaymentGatewayException;

/**
 * Adapter to a payment provider.
 *
 * @author Storefront Team
 */
public interface PaymentGateway {

    /**
     * Payment method this gateway serves.
     */
    Order.PaymentMethod method();

    /**
     * Register the order with the provider.
     *
     * @throws PaymentGatewayException if the provider could not be reached or refused the request
     */
    PaymentInitiation initiatePayment(Order order);

    /**
     * Fetch the provider's view of a payment, capturing approved funds where the provider
     * requires an explicit capture.
     *
     * @throws PaymentGatewayException if the provider could not be reached
     */
    ProviderPaymentStatus fetchStatus(String paymentRef);
}
