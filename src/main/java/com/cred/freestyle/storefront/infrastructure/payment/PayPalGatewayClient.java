package com.cred.freestyle.storefront.infrastructure.payment;

import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.exception.PaymentGatewayException;
import com.cred.freestyle.storefront.service.payment.PaymentGateway;
import com.cred.freestyle.storefront.service.payment.PaymentInitiation;
import com.cred.freestyle.storefront.service.payment.ProviderPaymentStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * PayPal Orders API v2 client.
 *
 * Orders are created with intent CAPTURE and the storefront order id as custom_id. Status checks
 * read the PayPal order and capture it once the buyer has approved, so a COMPLETED status always
 * carries the captured amount.
 *
 * OAuth tokens are cached until five minutes before they expire.
 *
 * @author Storefront Team
 */
@Component
public class PayPalGatewayClient implements PaymentGateway {

    private static final Logger logger = LoggerFactory.getLogger(PayPalGatewayClient.class);

    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 300;

    private final RestClient restClient;
    private final String clientId;
    private final String clientSecret;
    private final String returnUrl;
    private final String cancelUrl;
    private final String brandName;

    private String accessToken;
    private Instant accessTokenExpiresAt = Instant.EPOCH;

    public PayPalGatewayClient(
            @Qualifier("paypalRestClient") RestClient restClient,
            @Value("${storefront.paypal.client-id:}") String clientId,
            @Value("${storefront.paypal.client-secret:}") String clientSecret,
            @Value("${storefront.paypal.return-url:http://localhost:8080/payments/success}") String returnUrl,
            @Value("${storefront.paypal.cancel-url:http://localhost:8080/payments/cancel}") String cancelUrl,
            @Value("${storefront.paypal.brand-name:Storefront}") String brandName
    ) {
        this.restClient = restClient;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.returnUrl = returnUrl;
        this.cancelUrl = cancelUrl;
        this.brandName = brandName;
    }

    @Override
    public Order.PaymentMethod method() {
        return Order.PaymentMethod.PAYPAL;
    }

    @Override
    public PaymentInitiation initiatePayment(Order order) {
        Map<String, Object> amount = Map.of(
                "currency_code", order.getCurrency(),
                "value", formatMinorUnits(order.getTotalMinor()));

        Map<String, Object> body = Map.of(
                "intent", "CAPTURE",
                "purchase_units", List.of(Map.of(
                        "amount", amount,
                        "custom_id", order.getOrderId(),
                        "description", "Order " + order.getOrderId())),
                "application_context", Map.of(
                        "return_url", returnUrl,
                        "cancel_url", cancelUrl,
                        "brand_name", brandName,
                        "user_action", "PAY_NOW"));

        try {
            JsonNode created = restClient.post()
                    .uri("/v2/checkout/orders")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);

            if (created == null || !created.hasNonNull("id")) {
                throw new PaymentGatewayException("PayPal returned no order id for order " + order.getOrderId());
            }

            String paypalOrderId = created.get("id").asText();
            String approvalUrl = linkHref(created, "approve");
            if (approvalUrl == null) {
                approvalUrl = linkHref(created, "payer-action");
            }

            logger.info("Created PayPal order {} for order {}", paypalOrderId, order.getOrderId());
            return new PaymentInitiation(paypalOrderId, approvalUrl, null);

        } catch (RestClientException e) {
            logger.error("Failed to create PayPal order for {}: {}", order.getOrderId(), e.getMessage(), e);
            throw new PaymentGatewayException("PayPal order creation failed for " + order.getOrderId(), e);
        }
    }

    @Override
    public ProviderPaymentStatus fetchStatus(String paymentRef) {
        try {
            JsonNode paypalOrder = restClient.get()
                    .uri("/v2/checkout/orders/{id}", paymentRef)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken())
                    .retrieve()
                    .body(JsonNode.class);

            String status = paypalOrder == null ? "UNKNOWN" : paypalOrder.path("status").asText("UNKNOWN");
            switch (status) {
                case "APPROVED":
                    return capture(paymentRef);
                case "COMPLETED":
                    return fromCaptured(paypalOrder);
                case "VOIDED":
                    return ProviderPaymentStatus.failed(status);
                default:
                    return ProviderPaymentStatus.pending(status);
            }

        } catch (RestClientException e) {
            logger.error("Failed to fetch PayPal order {}: {}", paymentRef, e.getMessage(), e);
            throw new PaymentGatewayException("PayPal status lookup failed for " + paymentRef, e);
        }
    }

    private ProviderPaymentStatus capture(String paymentRef) {
        JsonNode captured = restClient.post()
                .uri("/v2/checkout/orders/{id}/capture", paymentRef)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of())
                .retrieve()
                .body(JsonNode.class);

        logger.info("Captured PayPal order {}", paymentRef);
        return fromCaptured(captured);
    }

    private ProviderPaymentStatus fromCaptured(JsonNode paypalOrder) {
        String status = paypalOrder == null ? "UNKNOWN" : paypalOrder.path("status").asText("UNKNOWN");
        JsonNode capture = paypalOrder == null ? null
                : paypalOrder.path("purchase_units").path(0).path("payments").path("captures").path(0);

        if (capture == null || capture.isMissingNode()) {
            if ("COMPLETED".equals(status)) {
                // funds may have moved; never cancel on this
                logger.warn("PayPal order {} is COMPLETED but carries no capture",
                        paypalOrder.path("id").asText("unknown"));
                return ProviderPaymentStatus.unresolved(status, "COMPLETED_WITHOUT_CAPTURE");
            }
            return ProviderPaymentStatus.pending(status);
        }

        String captureStatus = capture.path("status").asText(status);
        if ("DECLINED".equals(captureStatus) || "FAILED".equals(captureStatus)) {
            return ProviderPaymentStatus.failed(captureStatus);
        }
        if (!"COMPLETED".equals(captureStatus)) {
            return ProviderPaymentStatus.pending(captureStatus);
        }

        JsonNode amount = capture.path("amount");
        return ProviderPaymentStatus.completed(
                captureStatus,
                capture.path("id").asText(null),
                parseMinorUnits(amount.path("value").asText("0")),
                amount.path("currency_code").asText(null));
    }

    private synchronized String accessToken() {
        if (accessToken != null && Instant.now().isBefore(accessTokenExpiresAt)) {
            return accessToken;
        }

        String credentials = Base64.getEncoder()
                .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");

        JsonNode token = restClient.post()
                .uri("/v1/oauth2/token")
                .header(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);

        if (token == null || !token.hasNonNull("access_token")) {
            throw new PaymentGatewayException("PayPal returned no access token");
        }

        accessToken = token.get("access_token").asText();
        long expiresIn = token.path("expires_in").asLong(0);
        accessTokenExpiresAt = Instant.now().plusSeconds(Math.max(0, expiresIn - TOKEN_EXPIRY_MARGIN_SECONDS));
        logger.debug("Obtained PayPal access token valid for {}s", expiresIn);
        return accessToken;
    }

    private static String linkHref(JsonNode paypalOrder, String rel) {
        for (JsonNode link : paypalOrder.path("links")) {
            if (rel.equals(link.path("rel").asText())) {
                return link.path("href").asText(null);
            }
        }
        return null;
    }

    static String formatMinorUnits(long amountMinor) {
        return BigDecimal.valueOf(amountMinor, 2).toPlainString();
    }

    static long parseMinorUnits(String value) {
        return new BigDecimal(value).movePointRight(2).longValueExact();
    }
}
