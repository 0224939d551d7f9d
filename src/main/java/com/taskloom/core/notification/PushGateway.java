package com.taskloom.core.notification;

/**
 * Delivery channel for push notifications.
 */
public interface PushGateway {

    void sendBanner(long userId, PushNotification notification);

    void sendBadge(long userId, int badgeCount);
}
