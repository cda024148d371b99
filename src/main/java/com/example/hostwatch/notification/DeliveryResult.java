package com.example.hostwatch.notification;

/**
 * What happened to one notification.
 */
public record DeliveryResult(Status status, String channel, String detail) {

    public enum Status {
        /** Accepted by the channel. */
        DELIVERED,
        /** Not sent: not notifiable, or a duplicate inside the dedupe window. */
        SUPPRESSED,
        /** One channel attempt failed. */
        FAILED,
        /** Given up after the retry. */
        DROPPED
    }

    public static DeliveryResult delivered(String channel) {
        return new DeliveryResult(Status.DELIVERED, channel, null);
    }

    public static DeliveryResult suppressed(String channel, String reason) {
        return new DeliveryResult(Status.SUPPRESSED, channel, reason);
    }

    public static DeliveryResult failed(String channel, String error) {
        return new DeliveryResult(Status.FAILED, channel, error);
    }

    public static DeliveryResult dropped(String channel, String error) {
        return new DeliveryResult(Status.DROPPED, channel, error);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
