package com.cred.freestyle.storefront.exception;

/**
 * Exception thrown when a commit or release does not match the outstanding reservations
 * of an order. Signals an accounting bug: the single operation is aborted and rolled back.
 *
 * @author Storefront Team
 */
public class ReservationInvariantViolationException extends RuntimeException {

    private final String orderId;
    private final String itemId;

    public ReservationInvariantViolationException(String orderId, String itemId, String detail) {
        super(String.format("Reservation invariant violated for order %s, item %s: %s", orderId, itemId, detail));
        this.orderId = orderId;
        this.itemId = itemId;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getItemId() {
        return itemId;
    }
}
