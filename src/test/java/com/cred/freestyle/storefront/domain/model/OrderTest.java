package com.cred.freestyle.storefront.domain.model;

import com.cred.freestyle.storefront.domain.model.Order.OrderState;
import com.cred.freestyle.storefront.exception.InvalidOrderStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the Order state machine.
 */
@DisplayName("Order Domain Model Tests")
class OrderTest {

    private Order orderIn(OrderState state) {
        return Order.builder()
                .orderId("order-1")
                .ownerId("user-1")
                .state(state)
                .totalMinor(1000L)
                .currency("USD")
                .build();
    }

    @Test
    @DisplayName("Should follow the happy path CREATED -> AWAITING_PAYMENT -> PAID -> FULFILLED -> REVIEWED")
    void shouldFollowHappyPath() {
        // Given
        Order order = orderIn(OrderState.CREATED);

        // When / Then
        assertThat(order.transitionTo(OrderState.AWAITING_PAYMENT)).isTrue();
        assertThat(order.transitionTo(OrderState.PAID)).isTrue();
        assertThat(order.transitionTo(OrderState.FULFILLED)).isTrue();
        assertThat(order.transitionTo(OrderState.REVIEWED)).isTrue();
        assertThat(order.getState()).isEqualTo(OrderState.REVIEWED);
        assertThat(order.getState().isTerminal()).isTrue();
    }

    @Test
    @DisplayName("Should treat a transition to the current state as a no-op")
    void shouldTreatSameStateAsNoOp() {
        // Given
        Order order = orderIn(OrderState.PAID);
        Instant before = order.getStateChangedAt();

        // When
        boolean changed = order.transitionTo(OrderState.PAID);

        // Then
        assertThat(changed).isFalse();
        assertThat(order.getStateChangedAt()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should never go backwards from PAID to AWAITING_PAYMENT")
    void shouldRejectBackwardTransition() {
        // Given
        Order order = orderIn(OrderState.PAID);

        // When / Then
        assertThatThrownBy(() -> order.transitionTo(OrderState.AWAITING_PAYMENT))
                .isInstanceOf(InvalidOrderStateException.class)
                .satisfies(ex -> {
                    InvalidOrderStateException e = (InvalidOrderStateException) ex;
                    assertThat(e.getCurrentState()).isEqualTo(OrderState.PAID);
                    assertThat(e.getRequestedState()).isEqualTo(OrderState.AWAITING_PAYMENT);
                });
        assertThat(order.getState()).isEqualTo(OrderState.PAID);
    }

    @Test
    @DisplayName("Should not allow cancelling a paid order")
    void shouldNotCancelPaidOrder() {
        Order order = orderIn(OrderState.PAID);

        assertThatThrownBy(() -> order.transitionTo(OrderState.CANCELLED))
                .isInstanceOf(InvalidOrderStateException.class);
    }

    @Test
    @DisplayName("Should allow refund only from PAID")
    void shouldAllowRefundFromPaid() {
        assertThat(OrderState.PAID.canAdvanceTo(OrderState.REFUNDED)).isTrue();
        assertThat(OrderState.FULFILLED.canAdvanceTo(OrderState.REFUNDED)).isFalse();
        assertThat(OrderState.AWAITING_PAYMENT.canAdvanceTo(OrderState.REFUNDED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = OrderState.class, names = {"CANCELLED", "REFUNDED", "REVIEWED"})
    @DisplayName("Terminal states have no successors")
    void terminalStatesHaveNoSuccessors(OrderState terminal) {
        Order order = orderIn(terminal);

        assertThat(terminal.isTerminal()).isTrue();
        for (OrderState next : OrderState.values()) {
            if (next != terminal) {
                assertThatThrownBy(() -> order.transitionTo(next))
                        .isInstanceOf(InvalidOrderStateException.class);
            }
        }
    }

    @Test
    @DisplayName("Should compute totals from line snapshots")
    void shouldComputeTotalOfLines() {
        // Given
        List<OrderLine> lines = List.of(
                OrderLine.builder().itemId("a").itemName("A").quantity(2).unitPriceMinor(499L).build(),
                OrderLine.builder().itemId("b").itemName("B").quantity(1).unitPriceMinor(1000L).digital(true).build()
        );

        // When
        long total = Order.totalOf(lines);

        // Then
        assertThat(total).isEqualTo(1998L);
    }

    @Test
    @DisplayName("Should report payment confirmed for PAID and later states only")
    void shouldReportPaymentConfirmed() {
        assertThat(orderIn(OrderState.AWAITING_PAYMENT).isPaymentConfirmed()).isFalse();
        assertThat(orderIn(OrderState.CANCELLED).isPaymentConfirmed()).isFalse();
        assertThat(orderIn(OrderState.PAID).isPaymentConfirmed()).isTrue();
        assertThat(orderIn(OrderState.FULFILLED).isPaymentConfirmed()).isTrue();
        assertThat(orderIn(OrderState.REFUNDED).isPaymentConfirmed()).isTrue();
    }

    @Test
    @DisplayName("Should split digital and physical lines")
    void shouldDetectLineKinds() {
        Order order = orderIn(OrderState.PAID);
        order.setLines(List.of(
                OrderLine.builder().itemId("a").itemName("A").quantity(1).unitPriceMinor(100L).digital(true).build()));

        assertThat(order.hasDigitalLines()).isTrue();
        assertThat(order.hasPhysicalLines()).isFalse();
    }
}
