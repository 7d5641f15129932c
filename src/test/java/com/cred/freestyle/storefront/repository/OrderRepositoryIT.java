package com.cred.freestyle.storefront.repository;

import com.cred.freestyle.storefront.domain.model.Order;
import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.domain.model.Order.PaymentMethod;
import com.cred.freestyle.storefront.service.ItemSalesSummary;
import com.cred.freestyle.storefront.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for OrderRepository using Testcontainers.
 * Tests the sweep and reporting queries against a real PostgreSQL database.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("OrderRepository Integration Tests")
class OrderRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("storefront_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private OrderRepository orderRepository;

    @BeforeEach
    void setUp() {
        orderRepository.deleteAll();
    }

    // ========================================
    // findExpiredAwaitingPayment Tests
    // ========================================

    @Test
    @DisplayName("findExpiredAwaitingPayment - Should skip live and manually reported orders")
    void findExpiredAwaitingPayment_FiltersCandidates() {
        // Given
        Instant now = Instant.now();
        Order expired = TestDataBuilder.order().line("item-1", 1, 1000L).build();
        expired.setExpiresAt(now.minus(5, ChronoUnit.MINUTES));
        orderRepository.save(expired);

        Order live = TestDataBuilder.order().line("item-1", 1, 1000L).build();
        live.setExpiresAt(now.plus(5, ChronoUnit.MINUTES));
        orderRepository.save(live);

        Order reported = TestDataBuilder.order().line("item-1", 1, 1000L)
                .paymentMethod(PaymentMethod.CRYPTO).build();
        reported.setExpiresAt(now.minus(5, ChronoUnit.MINUTES));
        reported.setManualVerificationRequestedAt(now.minus(10, ChronoUnit.MINUTES));
        orderRepository.save(reported);

        Order paid = TestDataBuilder.order().line("item-1", 1, 1000L).state(OrderState.PAID).build();
        paid.setExpiresAt(now.minus(5, ChronoUnit.MINUTES));
        orderRepository.save(paid);

        // When
        List<String> result = orderRepository.findExpiredAwaitingPayment(now);

        // Then
        assertThat(result).containsExactly(expired.getOrderId());
    }

    // ========================================
    // findPendingPayments Tests
    // ========================================

    @Test
    @DisplayName("findPendingPayments - Should return pollable orders of one method")
    void findPendingPayments_ReturnsOrdersWithReference() {
        // Given
        Order withRef = orderRepository.save(TestDataBuilder.order().line("item-1", 1, 1000L)
                .paymentRef("PP-1").build());
        orderRepository.save(TestDataBuilder.order().line("item-1", 1, 1000L).build());
        orderRepository.save(TestDataBuilder.order().line("item-1", 1, 1000L)
                .paymentMethod(PaymentMethod.CRYPTO).paymentRef("crypto-1").build());

        // When
        List<String> result = orderRepository.findPendingPayments(PaymentMethod.PAYPAL);

        // Then
        assertThat(result).containsExactly(withRef.getOrderId());
    }

    // ========================================
    // Spend and sales aggregation Tests
    // ========================================

    @Test
    @DisplayName("sumTotalByOwnerAndStates - Should sum only counted states")
    void sumTotalByOwnerAndStates_SumsCountedStates() {
        // Given
        orderRepository.save(TestDataBuilder.order().ownerId("buyer-a").totalMinor(9_500L)
                .state(OrderState.FULFILLED).build());
        orderRepository.save(TestDataBuilder.order().ownerId("buyer-a").totalMinor(1_500L)
                .state(OrderState.REVIEWED).build());
        orderRepository.save(TestDataBuilder.order().ownerId("buyer-a").totalMinor(40_000L)
                .state(OrderState.CANCELLED).build());
        orderRepository.save(TestDataBuilder.order().ownerId("buyer-b").totalMinor(7_000L)
                .state(OrderState.FULFILLED).build());

        // When
        long total = orderRepository.sumTotalByOwnerAndStates("buyer-a",
                List.of(OrderState.FULFILLED, OrderState.REVIEWED));
        long none = orderRepository.sumTotalByOwnerAndStates("buyer-z",
                List.of(OrderState.FULFILLED, OrderState.REVIEWED));

        // Then
        assertThat(total).isEqualTo(11_000L);
        assertThat(none).isZero();
    }

    @Test
    @DisplayName("findTopSellingItems - Should rank items by units sold")
    void findTopSellingItems_RanksByQuantity() {
        // Given
        orderRepository.save(TestDataBuilder.order().line("item-1", 1, 1000L).line("item-2", 3, 500L)
                .state(OrderState.FULFILLED).build());
        orderRepository.save(TestDataBuilder.order().line("item-2", 2, 500L)
                .state(OrderState.PAID).build());
        orderRepository.save(TestDataBuilder.order().line("item-1", 9, 1000L)
                .state(OrderState.CANCELLED).build());

        // When
        List<ItemSalesSummary> top = orderRepository.findTopSellingItems(
                List.of(OrderState.PAID, OrderState.FULFILLED, OrderState.REVIEWED),
                Instant.now().minus(1, ChronoUnit.DAYS),
                PageRequest.of(0, 5));
        Optional<ItemSalesSummary> item1 = orderRepository.findItemSales("item-1",
                List.of(OrderState.PAID, OrderState.FULFILLED, OrderState.REVIEWED));

        // Then
        assertThat(top).hasSize(2);
        assertThat(top.get(0).getItemId()).isEqualTo("item-2");
        assertThat(top.get(0).getUnitsSold()).isEqualTo(5L);
        assertThat(item1).isPresent();
        assertThat(item1.get().getRevenueMinor()).isEqualTo(1000L);
    }
}
