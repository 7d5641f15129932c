package com.cred.freestyle.storefront.infrastructure.payment;

import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.service.payment.PaymentGateway;
import com.cred.freestyle.storefront.service.payment.PaymentInitiation;
import com.cred.freestyle.storefront.service.payment.ProviderPaymentStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Crypto payments. Nothing is registered with a third party: the buyer receives the shop's
 * wallet addresses and staff confirm receipt by hand.
 *
 * @author Storefront Team
 */
@Component
public class CryptoPaymentGateway implements PaymentGateway {

    static final String REF_PREFIX = "crypto-";

    private final Map<String, String> wallets = new LinkedHashMap<>();

    public CryptoPaymentGateway(
            @Value("${storefront.crypto.wallets.btc:}") String btcWallet,
            @Value("${storefront.crypto.wallets.eth:}") String ethWallet,
            @Value("${storefront.crypto.wallets.ltc:}") String ltcWallet
    ) {
        putIfConfigured("BTC", btcWallet);
        putIfConfigured("ETH", ethWallet);
        putIfConfigured("LTC", ltcWallet);
    }

    @Override
    public Order.PaymentMethod method() {
        return Order.PaymentMethod.CRYPTO;
    }

    @Override
    public PaymentInitiation initiatePayment(Order order) {
        String amount = BigDecimal.valueOf(order.getTotalMinor(), 2).toPlainString();
        String addresses = wallets.isEmpty()
                ? "Ask staff for a wallet address."
                : wallets.entrySet().stream()
                        .map(entry -> entry.getKey() + ": " + entry.getValue())
                        .collect(Collectors.joining(", "));

        String instructions = "Send the equivalent of " + amount + " " + order.getCurrency()
                + " to one of " + addresses + " then request verification for order " + order.getOrderId() + ".";
        return new PaymentInitiation(REF_PREFIX + order.getOrderId(), null, instructions);
    }

    @Override
    public ProviderPaymentStatus fetchStatus(String paymentRef) {
        return ProviderPaymentStatus.pending("AWAITING_ATTESTATION");
    }

    private void putIfConfigured(String coin, String address) {
        if (address != null && !address.isBlank()) {
            wallets.put(coin, address);
        }
    }
}
