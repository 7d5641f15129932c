package com.cred.freestyle.storefront.exception;

/**
 * Exception thrown when a user who already has an open ticket asks for another one.
 *
 * @author Storefront Team
 */
public class TicketAlreadyOpenException extends RuntimeException {

    private final String ownerId;

    public TicketAlreadyOpenException(String ownerId) {
        super(String.format("User %s already has an open ticket", ownerId));
        this.ownerId = ownerId;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
