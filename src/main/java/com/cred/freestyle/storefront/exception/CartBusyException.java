package com.cred.freestyle.storefront.exception;

/**
 * Exception thrown when another edit of the same cart holds the per-owner lock for too long.
 *
 * @author Storefront Team
 */
public class CartBusyException extends RuntimeException {

    private final String ownerId;

    public CartBusyException(String ownerId) {
        super(String.format("Cart of %s is being modified, try again", ownerId));
        this.ownerId = ownerId;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
