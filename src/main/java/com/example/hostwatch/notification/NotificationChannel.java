package com.example.hostwatch.notification;

/**
 * Transport to a chat channel. Authentication and rendering are the channel's concern;
 * it must bound each post with a timeout.
 */
public interface NotificationChannel {

    String name();

    /**
     * Post one message. Transport problems are reported as a {@link DeliveryResult.Status#FAILED}
     * result or an unchecked exception; the dispatcher handles both.
     */
    DeliveryResult post(NotificationMessage message);
}
