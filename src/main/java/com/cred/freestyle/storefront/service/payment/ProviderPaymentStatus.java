package com.cred.freestyle.storefront.service.payment;

/**
 * Status of a payment as reported by the provider.
 * Amount and currency are only meaningful when the payment is COMPLETED. A PENDING status may carry
 * an issue when the provider's answer is inconsistent and needs a person to look at it.
 *
 * @author Storefront Team
 */
public final class ProviderPaymentStatus {

    public enum State {
        /** Buyer has not finished paying yet. */
        PENDING,
        /** Funds captured. */
        COMPLETED,
        /** Provider reports the payment as failed, voided or declined. */
        FAILED
    }

    private final State state;
    private final String rawStatus;
    private final String externalRef;
    private final Long amountMinor;
    private final String currency;
    private final String issue;

    private ProviderPaymentStatus(State state, String rawStatus, String externalRef, Long amountMinor,
                                  String currency, String issue) {
        this.state = state;
        this.rawStatus = rawStatus;
        this.externalRef = externalRef;
        this.amountMinor = amountMinor;
        this.currency = currency;
        this.issue = issue;
    }

    public static ProviderPaymentStatus pending(String rawStatus) {
        return new ProviderPaymentStatus(State.PENDING, rawStatus, null, null, null, null);
    }

    /**
     * Not confirmable yet, and not something that will resolve by waiting alone.
     */
    public static ProviderPaymentStatus unresolved(String rawStatus, String issue) {
        return new ProviderPaymentStatus(State.PENDING, rawStatus, null, null, null, issue);
    }

    public static ProviderPaymentStatus failed(String rawStatus) {
        return new ProviderPaymentStatus(State.FAILED, rawStatus, null, null, null, null);
    }

    public static ProviderPaymentStatus completed(String rawStatus, String externalRef, long amountMinor, String currency) {
        return new ProviderPaymentStatus(State.COMPLETED, rawStatus, externalRef, amountMinor, currency, null);
    }

    public State getState() { return state; }
    public String getRawStatus() { return rawStatus; }
    public String getExternalRef() { return externalRef; }
    public Long getAmountMinor() { return amountMinor; }
    public String getCurrency() { return currency; }
    public String getIssue() { return issue; }
}
