package com.cred.freestyle.storefront.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.security.SecureRandom;
import java.util.Random;

/**
 * HTTP client for the payment provider and the random source for giveaway draws.
 *
 * @author Storefront Team
 */
@Configuration
public class PaymentConfig {

    @Value("${storefront.paypal.mode:sandbox}")
    private String paypalMode;

    @Value("${storefront.paypal.sandbox-base-url:https://api-m.sandbox.paypal.com}")
    private String sandboxBaseUrl;

    @Value("${storefront.paypal.live-base-url:https://api-m.paypal.com}")
    private String liveBaseUrl;

    @Value("${storefront.paypal.connect-timeout-ms:3000}")
    private Integer connectTimeoutMs;

    @Value("${storefront.paypal.read-timeout-ms:10000}")
    private Integer readTimeoutMs;

    @Bean
    public RestClient paypalRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        String baseUrl = "live".equalsIgnoreCase(paypalMode) ? liveBaseUrl : sandboxBaseUrl;
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public Random giveawayRandom() {
        return new SecureRandom();
    }
}
