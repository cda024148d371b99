package com.example.hostwatch.notification;

import com.example.hostwatch.alert.AlertTransition;
import com.example.hostwatch.config.MonitorProperties;
import com.example.hostwatch.monitoring.MetricKind;
import com.example.hostwatch.monitoring.MetricReading;
import com.example.hostwatch.monitoring.ThresholdConfigRegistry;
import com.example.hostwatch.remediation.RemediationOutcome;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Notification Dispatcher - turns alert transitions and remediation outcomes into chat messages.
 *
 * Alert messages are deduplicated per {@code kind:status} for the configured window.
 * Text is masked before it reaches the channel. A failed post is retried once and then
 * dropped with a local log record. Delivery never touches alert state and never throws.
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final NotificationChannel channel;
    private final SecretMasker masker;
    private final ThresholdConfigRegistry thresholds;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Cache<String, Instant> recentlySent;
    private final String channelName;
    private final String serviceName;

    public NotificationDispatcher(NotificationChannel channel, SecretMasker masker,
                                  ThresholdConfigRegistry thresholds, MonitorProperties properties,
                                  MeterRegistry meterRegistry, Clock clock) {
        this.channel = channel;
        this.masker = masker;
        this.thresholds = thresholds;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.channelName = properties.getNotifications().getChannel();
        this.serviceName = properties.getServiceHealth().getServiceName();
        this.recentlySent = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(properties.getNotifications().getDedupeWindowSeconds()))
                .ticker(tickerOf(clock))
                .maximumSize(1_000)
                .build();
        log.info("Notifications go to {} via {} channel", channelName, channel.name());
    }

    public DeliveryResult notify(AlertTransition transition) {
        return notify(transition, null);
    }

    /**
     * Notify about a transition, with the remediation outcome when one was dispatched.
     */
    public DeliveryResult notify(AlertTransition transition, RemediationOutcome outcome) {
        if (!transition.type().isNotifiable()) {
            log.debug("{} transition for {} is not notified", transition.type(), transition.kind());
            return record(DeliveryResult.suppressed(channelName, "not notifiable: " + transition.type()));
        }

        NotificationMessage message = new NotificationMessage(
                severityFor(transition, outcome),
                format(transition, outcome),
                channelName,
                transition.kind().name() + ":" + transition.to().name());
        return send(message);
    }

    /**
     * Free-form message (startup, shutdown, reports). Not deduplicated.
     */
    public DeliveryResult notifyText(NotificationSeverity severity, String text) {
        return send(new NotificationMessage(severity, text, channelName, null));
    }

    /**
     * Posts a health summary of the latest percentage readings.
     */
    public DeliveryResult notifyHealthReport(String hostname, Map<MetricKind, MetricReading> latest) {
        HealthStatus status = HealthStatus.of(latest.values().stream()
                .filter(r -> r.kind().isPercentage())
                .mapToDouble(MetricReading::value)
                .max()
                .orElse(0.0));

        StringBuilder text = new StringBuilder()
                .append("*System health report for ").append(hostname).append("*\n")
                .append("Status: ").append(status);
        for (MetricKind kind : List.of(MetricKind.CPU, MetricKind.MEMORY, MetricKind.DISK)) {
            MetricReading reading = latest.get(kind);
            text.append("\n").append(kind.displayName()).append(": ")
                    .append(reading != null ? String.format(Locale.ROOT, "%.1f%%", reading.value()) : "n/a");
        }
        MetricReading health = latest.get(MetricKind.SERVICE_HEALTH);
        if (health != null) {
            text.append("\nService ").append(serviceName).append(": ")
                    .append(health.value() == MetricReading.HEALTHY ? "healthy" : "unhealthy");
        }
        return notifyText(status.severity(), text.toString());
    }

    NotificationSeverity severityFor(AlertTransition transition, RemediationOutcome outcome) {
        if (outcome != null && !outcome.isSuccess()) {
            return NotificationSeverity.ERROR;
        }
        return switch (transition.type()) {
            case RAISED -> raisedSeverity(transition.kind());
            case REPEATED -> raisedSeverity(transition.kind()).escalate();
            default -> NotificationSeverity.INFO;
        };
    }

    private static NotificationSeverity raisedSeverity(MetricKind kind) {
        return switch (kind) {
            case CPU, MEMORY -> NotificationSeverity.WARNING;
            case DISK, SERVICE_HEALTH -> NotificationSeverity.ERROR;
        };
    }

    String format(AlertTransition transition, RemediationOutcome outcome) {
        MetricKind kind = transition.kind();
        MetricReading reading = transition.reading();
        String host = reading.hostname();
        StringBuilder text = new StringBuilder();

        switch (transition.type()) {
            case RAISED -> text.append(kind.isPercentage()
                    ? String.format(Locale.ROOT, "High %s usage on %s: %.1f%% (threshold: %.1f%%)", kind.displayName(), host,
                    reading.value(), thresholds.get(kind).highWaterMark())
                    : String.format(Locale.ROOT, "Service %s is unhealthy on %s", serviceName, host));
            case REPEATED -> text.append(kind.isPercentage()
                    ? String.format(Locale.ROOT, "%s usage still high on %s: %.1f%% after %d consecutive checks",
                    kind.displayName(), host, reading.value(), transition.consecutiveBreaches())
                    : String.format(Locale.ROOT, "Service %s still unhealthy on %s after %d consecutive checks",
                    serviceName, host, transition.consecutiveBreaches()));
            case CLEARED -> text.append(kind.isPercentage()
                    ? String.format(Locale.ROOT, "%s usage recovered on %s: %.1f%% (recovery threshold: %.1f%%)",
                    kind.displayName(), host, reading.value(), thresholds.get(kind).lowWaterMark())
                    : String.format(Locale.ROOT, "Service %s is healthy again on %s", serviceName, host));
            default -> text.append(kind.displayName()).append(" ").append(transition.type()).append(" on ").append(host);
        }

        if (outcome != null) {
            text.append("\nRemediation ")
                    .append(outcome.isSuccess() ? "succeeded" : "failed")
                    .append(": ").append(outcome.getMessage());
            if (outcome.getError() != null) {
                text.append(" (").append(outcome.getError()).append(")");
            }
            for (String step : outcome.getDetailSteps()) {
                text.append("\n- ").append(step);
            }
        }
        return text.toString();
    }

    private DeliveryResult send(NotificationMessage message) {
        String key = message.dedupeKey();
        if (key != null && recentlySent.getIfPresent(key) != null) {
            log.info("Suppressed duplicate notification {} within dedupe window", key);
            return record(DeliveryResult.suppressed(message.channel(), "duplicate within dedupe window: " + key));
        }

        NotificationMessage masked = new NotificationMessage(message.severity(), masker.mask(message.text()),
                message.channel(), key);

        DeliveryResult first = attempt(masked);
        if (first.isDelivered()) {
            remember(key);
            return record(first);
        }
        log.warn("Notification to {} via {} failed, retrying once: {}", masked.channel(), channel.name(), first.detail());

        DeliveryResult second = attempt(masked);
        if (second.isDelivered()) {
            remember(key);
            return record(second);
        }
        log.error("Dropped {} notification to {} after retry: {} | {}", masked.severity(), masked.channel(),
                second.detail(), masked.text());
        return record(DeliveryResult.dropped(masked.channel(), second.detail()));
    }

    private DeliveryResult attempt(NotificationMessage message) {
        try {
            DeliveryResult result = channel.post(message);
            if (result == null) {
                return DeliveryResult.failed(message.channel(), "channel returned no result");
            }
            return result.isDelivered() ? result
                    : DeliveryResult.failed(message.channel(), masker.mask(result.detail()));
        } catch (RuntimeException e) {
            log.debug("Channel {} threw while posting", channel.name(), e);
            return DeliveryResult.failed(message.channel(), masker.mask(e.getMessage()));
        }
    }

    private void remember(String key) {
        if (key != null) {
            recentlySent.put(key, clock.instant());
        }
    }

    private DeliveryResult record(DeliveryResult result) {
        Counter.builder("hostwatch.notifications")
                .tag("status", result.status().name().toLowerCase())
                .register(meterRegistry)
                .increment();
        return result;
    }

    private static Ticker tickerOf(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    enum HealthStatus {
        HEALTHY(NotificationSeverity.INFO),
        WARNING(NotificationSeverity.WARNING),
        CRITICAL(NotificationSeverity.CRITICAL);

        private final NotificationSeverity severity;

        HealthStatus(NotificationSeverity severity) {
            this.severity = severity;
        }

        NotificationSeverity severity() {
            return severity;
        }

        static HealthStatus of(double worstPercent) {
            if (worstPercent >= 90) {
                return CRITICAL;
            }
            return worstPercent >= 80 ? WARNING : HEALTHY;
        }
    }
}
