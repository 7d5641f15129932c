package com.cred.freestyle.storefront.exception;

/**
 * Validation failure for a cart line: the item vanished, was hidden, or its price changed
 * since the line was added. Raised before any stock is reserved; the cart is left untouched.
 *
 * @author Storefront Team
 */
public class StaleCartItemException extends RuntimeException {

    private final String itemId;
    private final Reason reason;

    public StaleCartItemException(String itemId, Reason reason) {
        super(String.format("Cart item %s is no longer valid: %s", itemId, reason));
        this.itemId = itemId;
        this.reason = reason;
    }

    public String getItemId() {
        return itemId;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        ITEM_NOT_FOUND,
        ITEM_UNAVAILABLE,
        PRICE_CHANGED
    }
}
