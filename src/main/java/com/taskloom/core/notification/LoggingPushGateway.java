package com.taskloom.core.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PushGateway} that only logs; used when no push provider is configured.
 */
public class LoggingPushGateway implements PushGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingPushGateway.class);

    @Override
    public void sendBanner(long userId, PushNotification notification) {
        log.info("Push to user {}: '{}' - {} (deepLink={})", userId, notification.title(),
                notification.message(), notification.data().get("deepLink"));
    }

    @Override
    public void sendBadge(long userId, int badgeCount) {
        log.info("Badge update for user {}: count={}", userId, badgeCount);
    }
}
