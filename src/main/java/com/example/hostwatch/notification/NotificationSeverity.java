package com.example.hostwatch.notification;

public enum NotificationSeverity {
    INFO(":information_source:"),
    WARNING(":warning:"),
    ERROR(":x:"),
    CRITICAL(":rotating_light:");

    private final String emoji;

    NotificationSeverity(String emoji) {
        this.emoji = emoji;
    }

    public String emoji() {
        return emoji;
    }

    /** One level up, saturating at CRITICAL. */
    public NotificationSeverity escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }
}
