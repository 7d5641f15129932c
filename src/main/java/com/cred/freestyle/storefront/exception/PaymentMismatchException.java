package com.cred.freestyle.storefront.exception;

/**
 * Exception thrown when a provider reports a completed payment whose amount or currency
 * disagrees with the order. The order stays AWAITING_PAYMENT and staff are notified.
 *
 * @author Storefront Team
 */
public class PaymentMismatchException extends RuntimeException {

    private final String orderId;
    private final Long expectedAmountMinor;
    private final Long actualAmountMinor;
    private final String expectedCurrency;
    private final String actualCurrency;

    public PaymentMismatchException(String orderId, Long expectedAmountMinor, Long actualAmountMinor,
                                    String expectedCurrency, String actualCurrency) {
        super(String.format("Payment for order %s does not match. Expected: %d %s, Received: %d %s",
                orderId, expectedAmountMinor, expectedCurrency, actualAmountMinor, actualCurrency));
        this.orderId = orderId;
        this.expectedAmountMinor = expectedAmountMinor;
        this.actualAmountMinor = actualAmountMinor;
        this.expectedCurrency = expectedCurrency;
        this.actualCurrency = actualCurrency;
    }

    public String getOrderId() {
        return orderId;
    }

    public Long getExpectedAmountMinor() {
        return expectedAmountMinor;
    }

    public Long getActualAmountMinor() {
        return actualAmountMinor;
    }

    public String getExpectedCurrency() {
        return expectedCurrency;
    }

    public String getActualCurrency() {
        return actualCurrency;
    }
}
