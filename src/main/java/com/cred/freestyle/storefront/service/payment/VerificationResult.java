package com.cred.freestyle.storefront.service.payment;

/**
 * Outcome of verifying an order's payment.
 *
 * @author Storefront Team
 */
public final class VerificationResult {

    public enum Outcome {
        CONFIRMED,
        REJECTED,
        PENDING
    }

    public enum RejectionReason {
        AMOUNT_MISMATCH,
        CURRENCY_MISMATCH,
        PAYMENT_FAILED
    }

    private final Outcome outcome;
    private final RejectionReason rejectionReason;
    private final Long amountMinor;
    private final String currency;
    private final String verifierIdentity;
    private final String externalRef;
    private final String evidence;
    private final String issue;

    private VerificationResult(Outcome outcome, RejectionReason rejectionReason, Long amountMinor, String currency,
                               String verifierIdentity, String externalRef, String evidence, String issue) {
        this.outcome = outcome;
        this.rejectionReason = rejectionReason;
        this.amountMinor = amountMinor;
        this.currency = currency;
        this.verifierIdentity = verifierIdentity;
        this.externalRef = externalRef;
        this.evidence = evidence;
        this.issue = issue;
    }

    public static VerificationResult confirmed(long amountMinor, String currency, String verifierIdentity,
                                               String externalRef, String evidence) {
        return new VerificationResult(Outcome.CONFIRMED, null, amountMinor, currency,
                verifierIdentity, externalRef, evidence, null);
    }

    public static VerificationResult rejected(RejectionReason reason, Long amountMinor, String currency, String evidence) {
        return new VerificationResult(Outcome.REJECTED, reason, amountMinor, currency, null, null, evidence, null);
    }

    public static VerificationResult pending(String evidence) {
        return new VerificationResult(Outcome.PENDING, null, null, null, null, null, evidence, null);
    }

    /**
     * Still pending, with a problem staff should see on the order.
     */
    public static VerificationResult pendingWithIssue(String issue, String evidence) {
        return new VerificationResult(Outcome.PENDING, null, null, null, null, null, evidence, issue);
    }

    public boolean isConfirmed() {
        return outcome == Outcome.CONFIRMED;
    }

    public boolean isMismatch() {
        return rejectionReason == RejectionReason.AMOUNT_MISMATCH
                || rejectionReason == RejectionReason.CURRENCY_MISMATCH;
    }

    public Outcome getOutcome() { return outcome; }
    public RejectionReason getRejectionReason() { return rejectionReason; }
    public Long getAmountMinor() { return amountMinor; }
    public String getCurrency() { return currency; }
    public String getVerifierIdentity() { return verifierIdentity; }
    public String getExternalRef() { return externalRef; }
    public String getEvidence() { return evidence; }
    public String getIssue() { return issue; }
}
