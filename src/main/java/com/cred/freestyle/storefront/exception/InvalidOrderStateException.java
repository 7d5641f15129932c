package com.cred.freestyle.storefront.exception;

import com.cred.freestyle.storefront.domain.model.Order.OrderState;

/**
 * Exception thrown when an order is asked to move backwards or sideways in its state machine.
 *
 * @author Storefront Team
 */
public class InvalidOrderStateException extends RuntimeException {

    private final String orderId;
    private final OrderState currentState;
    private final OrderState requestedState;

    public InvalidOrderStateException(String orderId, OrderState currentState, OrderState requestedState) {
        super(String.format("Order %s cannot move from %s to %s", orderId, currentState, requestedState));
        this.orderId = orderId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getOrderId() {
        return orderId;
    }

    public OrderState getCurrentState() {
        return currentState;
    }

    public OrderState getRequestedState() {
        return requestedState;
    }
}
