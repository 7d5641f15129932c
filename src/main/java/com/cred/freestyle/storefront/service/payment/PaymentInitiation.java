package com.cred.freestyle.storefront.service.payment;

/**
 * What the buyer needs to pay an order: the provider reference and either an approval link
 * (automated providers) or payment instructions (manual methods).
 *
 * @author Storefront Team
 */
public final class PaymentInitiation {

    private final String paymentRef;
    private final String approvalUrl;
    private final String instructions;

    public PaymentInitiation(String paymentRef, String approvalUrl, String instructions) {
        this.paymentRef = paymentRef;
        this.approvalUrl = approvalUrl;
        this.instructions = instructions;
    }

    public String getPaymentRef() { return paymentRef; }
    public String getApprovalUrl() { return approvalUrl; }
    public String getInstructions() { return instructions; }
}
