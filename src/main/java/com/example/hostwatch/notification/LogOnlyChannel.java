package com.example.hostwatch.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Channel used when Slack is disabled: messages go to the application log.
 */
@Slf4j
public class LogOnlyChannel implements NotificationChannel {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public DeliveryResult post(NotificationMessage message) {
        switch (message.severity()) {
            case INFO -> log.info("[{}] {}", message.channel(), message.text());
            case WARNING -> log.warn("[{}] {}", message.channel(), message.text());
            case ERROR, CRITICAL -> log.error("[{}] {} {}", message.channel(), message.severity(), message.text());
        }
        return DeliveryResult.delivered(message.channel());
    }
}
