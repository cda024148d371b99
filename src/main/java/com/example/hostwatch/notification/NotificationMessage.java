package com.example.hostwatch.notification;

/**
 * An outbound chat message. {@code dedupeKey} is null for messages that are never deduplicated.
 */
public record NotificationMessage(NotificationSeverity severity, String text, String channel, String dedupeKey) {
}
