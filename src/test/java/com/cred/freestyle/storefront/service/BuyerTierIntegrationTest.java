package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.testutil.StorefrontIntegrationTestSupport;
import com.cred.freestyle.storefront.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Buyer Tier Integration Tests")
class BuyerTierIntegrationTest extends StorefrontIntegrationTestSupport {

    @Autowired
    private BuyerTierEvaluator tierEvaluator;

    @Autowired
    private CustomerService customerService;

    @Test
    @DisplayName("Spend moving from 95.00 to 110.00 crosses the 100.00 threshold and grants the tier once")
    void crossingThreshold_GrantsOnce() throws Exception {
        // Given
        tierEvaluator.addRule("supporter", 10_000L);
        orderRepository.save(TestDataBuilder.order().ownerId("buyer-a")
                .totalMinor(9_500L).state(OrderState.FULFILLED).build());
        assertThat(tierEvaluator.evaluate("buyer-a")).isEmpty();

        orderRepository.save(TestDataBuilder.order().ownerId("buyer-a")
                .totalMinor(1_500L).state(OrderState.REVIEWED).build());

        // When
        List<Callable<List<String>>> evaluations = List.of(
                () -> tierEvaluator.evaluate("buyer-a"),
                () -> tierEvaluator.evaluate("buyer-a"));
        List<Future<List<String>>> results = runConcurrently(evaluations);

        // Then
        int grants = 0;
        for (Future<List<String>> result : results) {
            grants += result.get().size();
        }
        assertThat(grants).isEqualTo(1);
        assertThat(tierEvaluator.evaluate("buyer-a")).isEmpty();
        assertThat(tierGrantRepository.count()).isEqualTo(1);
        assertThat(tierEvaluator.currentTiers("buyer-a")).containsExactly("supporter");
        assertThat(customerService.getCustomer("buyer-a").getLifetimeTotalMinor()).isEqualTo(11_000L);
    }

    @Test
    @DisplayName("Unpaid and cancelled orders do not count toward lifetime spend")
    void onlyFulfilledOrdersCount() {
        tierEvaluator.addRule("supporter", 10_000L);
        orderRepository.save(TestDataBuilder.order().ownerId("buyer-a")
                .totalMinor(50_000L).state(OrderState.CANCELLED).build());
        orderRepository.save(TestDataBuilder.order().ownerId("buyer-a")
                .totalMinor(50_000L).state(OrderState.AWAITING_PAYMENT).build());

        assertThat(tierEvaluator.evaluate("buyer-a")).isEmpty();
    }

    @Test
    @DisplayName("A revoked tier is not granted again")
    void revokedTier_NotRegranted() {
        tierEvaluator.addRule("supporter", 10_000L);
        orderRepository.save(TestDataBuilder.order().ownerId("buyer-a")
                .totalMinor(20_000L).state(OrderState.FULFILLED).build());
        assertThat(tierEvaluator.evaluate("buyer-a")).containsExactly("supporter");

        tierEvaluator.revoke("buyer-a", "supporter", "admin-1");

        assertThat(tierEvaluator.evaluate("buyer-a")).isEmpty();
        assertThat(tierEvaluator.currentTiers("buyer-a")).isEmpty();
    }
}
