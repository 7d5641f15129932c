package com.cred.freestyle.storefront.infrastructure.messaging;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fire-and-forget event for the presentation adapter (DMs, channel posts, role changes).
 * Published as a Spring application event inside the transaction that caused it and relayed
 * to the notification sink only after that transaction commits.
 *
 * @author Storefront Team
 */
public class StoreNotification {

    private final Type type;
    private final String recipientId;
    private final String referenceId;
    private final Map<String, Object> attributes;
    private final Instant occurredAt;

    private StoreNotification(Type type, String recipientId, String referenceId) {
        this.type = type;
        this.recipientId = recipientId;
        this.referenceId = referenceId;
        this.attributes = new LinkedHashMap<>();
        this.occurredAt = Instant.now();
    }

    /**
     * @param type Event type
     * @param recipientId User the event concerns (null for staff or broadcast events)
     * @param referenceId Order, ticket, item or round the event is about
     */
    public static StoreNotification of(Type type, String recipientId, String referenceId) {
        return new StoreNotification(type, recipientId, referenceId);
    }

    public StoreNotification with(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    public Type getType() { return type; }
    public String getRecipientId() { return recipientId; }
    public String getReferenceId() { return referenceId; }
    public Map<String, Object> getAttributes() { return Collections.unmodifiableMap(attributes); }
    public Instant getOccurredAt() { return occurredAt; }

    /**
     * Partition key: events for the same recipient stay ordered.
     */
    public String partitionKey() {
        return recipientId != null ? recipientId : referenceId;
    }

    @Override
    public String toString() {
        return "StoreNotification{" + type + ", recipient=" + recipientId + ", ref=" + referenceId + "}";
    }

    public enum Type {
        ORDER_AWAITING_PAYMENT,
        ORDER_CONFIRMED,
        ORDER_CANCELLED,
        ORDER_FULFILLED,
        ORDER_REFUNDED,
        ORDER_REVIEWED,
        PAYMENT_MISMATCH,
        MANUAL_VERIFICATION_REQUESTED,
        MANUAL_FULFILLMENT_REQUIRED,
        FULFILLMENT_FAILED,
        DIGITAL_DELIVERY,
        TIER_GRANTED,
        TIER_REVOKED,
        TICKET_OPENED,
        TICKET_CLOSING,
        TICKET_PURGED,
        TICKET_PANEL_REQUESTED,
        GIVEAWAY_STARTED,
        GIVEAWAY_ENDED,
        CART_REMINDER,
        SHOP_STATUS_CHANGED,
        ITEM_CHANGED
    }
}
