package com.taskloom.core.notification;

import java.util.Map;

/**
 * A banner notification ready for delivery.
 *
 * @param title   heading
 * @param message body text
 * @param data    payload for deep linking; null values are omitted
 */
public record PushNotification(String title, String message, Map<String, String> data) {

    public PushNotification {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
