package com.cred.freestyle.storefront.service.payment;

import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the gateway registered for a payment method.
 *
 * @author Storefront Team
 */
@Component
public class PaymentGateways {

    private final Map<PaymentMethod, PaymentGateway> byMethod = new EnumMap<>(PaymentMethod.class);

    public PaymentGateways(List<PaymentGateway> gateways) {
        for (PaymentGateway gateway : gateways) {
            PaymentGateway previous = byMethod.put(gateway.method(), gateway);
            if (previous != null) {
                throw new IllegalStateException("Two gateways registered for " + gateway.method());
            }
        }
    }

    public PaymentGateway forMethod(PaymentMethod method) {
        PaymentGateway gateway = byMethod.get(method);
        if (gateway == null) {
            throw new IllegalArgumentException("No payment gateway configured for " + method);
        }
        return gateway;
    }
}
