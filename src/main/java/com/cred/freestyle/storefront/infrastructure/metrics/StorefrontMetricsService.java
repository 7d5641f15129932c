package com.cred.freestyle.storefront.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for monitoring and observability.
 * Publishes custom metrics through Micrometer; CloudWatch when the CloudWatch registry is enabled.
 *
 * Key Metrics:
 * - Checkout outcomes and latency
 * - Stock reservation denials
 * - Payment verification outcomes
 * - Fulfillment outcomes, tier grants, ticket purges, giveaway rounds
 * - Background sweep throughput and error rates
 *
 * @author Storefront Team
 */
@Service
public class StorefrontMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(StorefrontMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "storefront.";
    private static final String CHECKOUT_PREFIX = METRIC_PREFIX + "checkout.";
    private static final String INVENTORY_PREFIX = METRIC_PREFIX + "inventory.";
    private static final String PAYMENT_PREFIX = METRIC_PREFIX + "payment.";
    private static final String ORDER_PREFIX = METRIC_PREFIX + "order.";
    private static final String SWEEP_PREFIX = METRIC_PREFIX + "sweep.";

    public StorefrontMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a checkout attempt and how it ended.
     *
     * @param outcome e.g. "AWAITING_PAYMENT", "INSUFFICIENT_STOCK", "STALE_CART"
     */
    public void recordCheckout(String outcome) {
        Counter.builder(CHECKOUT_PREFIX + "attempts")
                .tag("outcome", outcome)
                .description("Checkout attempts by outcome")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded checkout outcome: {}", outcome);
    }

    public void recordCheckoutLatency(long durationMs) {
        Timer.builder(CHECKOUT_PREFIX + "latency")
                .description("Cart to awaiting-payment latency")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a denied reservation.
     *
     * @param itemId Item ID
     */
    public void recordInsufficientStock(String itemId) {
        Counter.builder(INVENTORY_PREFIX + "insufficient")
                .tag("item_id", itemId)
                .description("Reservations denied for insufficient stock")
                .register(meterRegistry)
                .increment();
    }

    public void recordStockMovement(String movement, int quantity) {
        Counter.builder(INVENTORY_PREFIX + "movement")
                .tag("movement", movement)
                .description("Units reserved, committed, released or restocked")
                .register(meterRegistry)
                .increment(quantity);
    }

    /**
     * Record the result of a payment verification.
     *
     * @param method PAYPAL or CRYPTO
     * @param outcome CONFIRMED, REJECTED, PENDING, MISMATCH
     */
    public void recordPaymentOutcome(String method, String outcome) {
        Counter.builder(PAYMENT_PREFIX + "verification")
                .tag("method", method)
                .tag("outcome", outcome)
                .description("Payment verification outcomes")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded payment outcome: {} {}", method, outcome);
    }

    /**
     * Record an order state transition.
     *
     * @param state Target state
     */
    public void recordOrderTransition(String state) {
        Counter.builder(ORDER_PREFIX + "transition")
                .tag("state", state)
                .description("Order state transitions")
                .register(meterRegistry)
                .increment();
    }

    public void recordRevenue(String currency, long amountMinor) {
        Counter.builder(ORDER_PREFIX + "revenue")
                .tag("currency", currency)
                .description("Confirmed revenue in minor units")
                .register(meterRegistry)
                .increment(amountMinor);
    }

    public void recordFulfillment(String outcome) {
        Counter.builder(ORDER_PREFIX + "fulfillment")
                .tag("outcome", outcome)
                .description("Fulfillment outcomes")
                .register(meterRegistry)
                .increment();
    }

    public void recordTierGrant(String roleId) {
        Counter.builder(METRIC_PREFIX + "tier.granted")
                .tag("role_id", roleId)
                .description("Buyer tier grants")
                .register(meterRegistry)
                .increment();
    }

    public void recordGiveawayRound(boolean hadWinner) {
        Counter.builder(METRIC_PREFIX + "giveaway.ended")
                .tag("winner", String.valueOf(hadWinner))
                .description("Giveaway rounds ended")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record one run of a background sweep.
     *
     * @param sweep Sweep name
     * @param processed Records acted upon
     * @param failed Records that raised an error
     * @param durationMs Run duration
     */
    public void recordSweep(String sweep, int processed, int failed, long durationMs) {
        Counter.builder(SWEEP_PREFIX + "processed")
                .tag("sweep", sweep)
                .register(meterRegistry)
                .increment(processed);
        Counter.builder(SWEEP_PREFIX + "failed")
                .tag("sweep", sweep)
                .register(meterRegistry)
                .increment(failed);
        Timer.builder(SWEEP_PREFIX + "latency")
                .tag("sweep", sweep)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a guarded transition that lost the race (duplicate purge / selection / reminder).
     *
     * @param operation Guarded operation
     */
    public void recordDuplicateSkipped(String operation) {
        Counter.builder(SWEEP_PREFIX + "duplicate")
                .tag("operation", operation)
                .description("Guarded transitions already applied by another worker")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Type of error
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
