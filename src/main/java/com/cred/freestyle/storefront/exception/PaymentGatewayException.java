package com.cred.freestyle.storefront.exception;

/**
 * Exception thrown when the payment provider cannot be reached or answers with an error.
 *
 * @author Storefront Team
 */
public class PaymentGatewayException extends RuntimeException {

    public PaymentGatewayException(String message) {
        super(message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
