package com.cred.freestyle.storefront.service.payment;

import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Payment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Verifies PayPal payments against the provider.
 *
 * A completed payment is accepted only when the captured currency equals the order currency
 * and the captured amount is within the configured tolerance of the order total (exact by
 * default). Anything else is rejected, and the order is left for the caller to handle.
 *
 * @author Storefront Team
 */
@Component
public class AutomatedPaymentVerifier implements PaymentVerifier {

    private static final Logger logger = LoggerFactory.getLogger(AutomatedPaymentVerifier.class);

    private final PaymentGateways paymentGateways;
    private final long amountToleranceMinor;

    public AutomatedPaymentVerifier(
            PaymentGateways paymentGateways,
            @Value("${storefront.payment.amount-tolerance-minor:0}") long amountToleranceMinor
    ) {
        this.paymentGateways = paymentGateways;
        this.amountToleranceMinor = amountToleranceMinor;
    }

    @Override
    public Order.PaymentMethod method() {
        return Order.PaymentMethod.PAYPAL;
    }

    @Override
    public VerificationResult verify(Order order) {
        if (order.getPaymentRef() == null) {
            return VerificationResult.pending("payment not initiated");
        }

        ProviderPaymentStatus status = paymentGateways.forMethod(method()).fetchStatus(order.getPaymentRef());

        switch (status.getState()) {
            case PENDING:
                if (status.getIssue() != null) {
                    logger.warn("Payment {} for order {} needs attention: {}",
                            order.getPaymentRef(), order.getOrderId(), status.getIssue());
                    return VerificationResult.pendingWithIssue(status.getIssue(),
                            "provider status " + status.getRawStatus());
                }
                logger.debug("Payment {} for order {} still pending ({})",
                        order.getPaymentRef(), order.getOrderId(), status.getRawStatus());
                return VerificationResult.pending("provider status " + status.getRawStatus());
            case FAILED:
                logger.warn("Payment {} for order {} failed at provider ({})",
                        order.getPaymentRef(), order.getOrderId(), status.getRawStatus());
                return VerificationResult.rejected(VerificationResult.RejectionReason.PAYMENT_FAILED,
                        null, null, "provider status " + status.getRawStatus());
            default:
                return compare(order, status);
        }
    }

    private VerificationResult compare(Order order, ProviderPaymentStatus status) {
        if (!order.getCurrency().equalsIgnoreCase(status.getCurrency())) {
            logger.warn("Currency mismatch for order {}: expected {}, got {}",
                    order.getOrderId(), order.getCurrency(), status.getCurrency());
            return VerificationResult.rejected(VerificationResult.RejectionReason.CURRENCY_MISMATCH,
                    status.getAmountMinor(), status.getCurrency(), "capture " + status.getExternalRef());
        }

        long difference = Math.abs(status.getAmountMinor() - order.getTotalMinor());
        if (difference > amountToleranceMinor) {
            logger.warn("Amount mismatch for order {}: expected {}, got {}",
                    order.getOrderId(), order.getTotalMinor(), status.getAmountMinor());
            return VerificationResult.rejected(VerificationResult.RejectionReason.AMOUNT_MISMATCH,
                    status.getAmountMinor(), status.getCurrency(), "capture " + status.getExternalRef());
        }

        return VerificationResult.confirmed(status.getAmountMinor(), status.getCurrency(),
                Payment.SYSTEM_VERIFIER, status.getExternalRef(), "provider status " + status.getRawStatus());
    }
}
