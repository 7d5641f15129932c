package com.cred.freestyle.storefront.infrastructure.messaging;

/**
 * Destination of store notifications. Implementations must not throw:
 * a failed delivery is logged and dropped.
 *
 * @author Storefront Team
 */
public interface NotificationSink {

    void send(StoreNotification notification);
}
