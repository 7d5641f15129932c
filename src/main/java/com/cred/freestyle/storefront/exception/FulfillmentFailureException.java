package com.cred.freestyle.storefront.exception;

/**
 * Exception thrown when a paid order could not be delivered.
 * The order stays PAID with its reservations intact until staff intervene.
 *
 * @author Storefront Team
 */
public class FulfillmentFailureException extends RuntimeException {

    private final String orderId;

    public FulfillmentFailureException(String orderId, String reason) {
        super(String.format("Fulfillment of order %s failed: %s", orderId, reason));
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }
}
