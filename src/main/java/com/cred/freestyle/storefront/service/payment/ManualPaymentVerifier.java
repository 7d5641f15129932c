package com.cred.freestyle.storefront.service.payment;

import com.cred.freestyle.storefront.domain.model.Order;
import org.springframework.stereotype.Component;

/**
 * Crypto payments are verified by staff. There is no provider to ask, so verification stays
 * pending until a staff member attests to the payment.
 *
 * @author Storefront Team
 */
@Component
public class ManualPaymentVerifier implements PaymentVerifier {

    @Override
    public Order.PaymentMethod method() {
        return Order.PaymentMethod.CRYPTO;
    }

    @Override
    public VerificationResult verify(Order order) {
        return VerificationResult.pending("awaiting staff attestation");
    }

    /**
     * Confirm a payment on a staff member's word. The attested amount is the order total.
     */
    public VerificationResult attest(Order order, String staffId, String evidence) {
        if (staffId == null || staffId.isBlank()) {
            throw new IllegalArgumentException("Attestation requires a staff identity");
        }
        return VerificationResult.confirmed(order.getTotalMinor(), order.getCurrency(),
                staffId, order.getPaymentRef(), evidence);
    }
}
