package com.cred.freestyle.storefront.exception;

/**
 * Exception thrown when a reservation (or an add-to-cart) asks for more than is available for sale.
 * Recoverable: no order is created and the caller may retry with a smaller quantity.
 *
 * @author Storefront Team
 */
public class InsufficientStockException extends RuntimeException {

    private final String itemId;
    private final Integer requestedQuantity;
    private final Integer availableQuantity;

    public InsufficientStockException(String itemId, Integer requestedQuantity, Integer availableQuantity) {
        super(String.format("Item %s has insufficient stock. Requested: %d, Available: %d",
                itemId, requestedQuantity, availableQuantity));
        this.itemId = itemId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public String getItemId() {
        return itemId;
    }

    public Integer getRequestedQuantity() {
        return requestedQuantity;
    }

    public Integer getAvailableQuantity() {
        return availableQuantity;
    }
}
