package com.cred.freestyle.storefront.exception;

/**
 * Exception thrown when a buyer operation is attempted while the shop is closed.
 *
 * @author Storefront Team
 */
public class ShopClosedException extends RuntimeException {

    public ShopClosedException() {
        super("The shop is currently closed");
    }
}
