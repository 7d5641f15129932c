package com.cred.freestyle.storefront.infrastructure.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards store notifications to the sink once the publishing transaction has committed.
 * A rolled back change never produces a notification, and a failing sink never rolls back a change.
 * Events published outside a transaction are forwarded immediately.
 *
 * @author Storefront Team
 */
@Component
public class NotificationRelay {

    private static final Logger logger = LoggerFactory.getLogger(NotificationRelay.class);

    private final NotificationSink notificationSink;

    public NotificationRelay(NotificationSink notificationSink) {
        this.notificationSink = notificationSink;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotification(StoreNotification notification) {
        try {
            notificationSink.send(notification);
        } catch (RuntimeException e) {
            logger.error("Notification sink rejected {}", notification, e);
        }
    }
}
