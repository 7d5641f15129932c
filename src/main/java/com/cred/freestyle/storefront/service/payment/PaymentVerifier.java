package com.cred.freestyle.storefront.service.payment;

import com.cred.freestyle.storefront.domain.model.Order;

/**
 * Decides whether an order's payment has been made for the right amount.
 *
 * @author Storefront Team
 */
public interface PaymentVerifier {

    Order.PaymentMethod method();

    /**
     * Verify the payment of an order that is awaiting payment.
     * Never changes order state; the caller acts on the result.
     */
    VerificationResult verify(Order order);
}
