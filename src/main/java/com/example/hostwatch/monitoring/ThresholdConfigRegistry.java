package com.example.hostwatch.monitoring;

import com.example.hostwatch.config.InvalidConfigurationException;
import com.example.hostwatch.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Builds and validates the per-kind {@link ThresholdConfig}s once at startup, along with
 * the timeouts every external call is bounded by. Invalid values abort startup: this is
 * the one place the monitor refuses to run rather than degrade.
 */
@Slf4j
@Component
public class ThresholdConfigRegistry {

    private final Map<MetricKind, ThresholdConfig> configs;

    public ThresholdConfigRegistry(MonitorProperties properties) {
        this.configs = Collections.unmodifiableMap(build(properties));
        configs.values().forEach(c -> log.info("Threshold for {}: breach >= {}, recover <= {}, every {}s",
                c.kind(), c.highWaterMark(), c.lowWaterMark(), c.checkInterval().toSeconds()));
    }

    public ThresholdConfig get(MetricKind kind) {
        ThresholdConfig config = configs.get(kind);
        if (config == null) {
            throw new IllegalArgumentException("No threshold configured for " + kind);
        }
        return config;
    }

    public Map<MetricKind, ThresholdConfig> all() {
        return configs;
    }

    private static Map<MetricKind, ThresholdConfig> build(MonitorProperties properties) {
        MonitorProperties.MonitoringConfig monitoring = properties.getMonitoring();
        int interval = monitoring.getCheckIntervalSeconds();
        requirePositive("check-interval-seconds", interval);
        requireNonNegative("cooldown-seconds", monitoring.getCooldownSeconds());
        requireNonNegative("hysteresis-margin", monitoring.getHysteresisMargin());
        validateTimeouts(properties);

        Map<MetricKind, ThresholdConfig> result = new EnumMap<>(MetricKind.class);
        result.put(MetricKind.CPU, percentage(MetricKind.CPU, monitoring.getCpuThreshold(),
                monitoring.getCpuRecoveryThreshold(), monitoring.getHysteresisMargin(), interval));
        result.put(MetricKind.MEMORY, percentage(MetricKind.MEMORY, monitoring.getMemoryThreshold(),
                monitoring.getMemoryRecoveryThreshold(), monitoring.getHysteresisMargin(), interval));
        result.put(MetricKind.DISK, percentage(MetricKind.DISK, monitoring.getDiskThreshold(),
                monitoring.getDiskRecoveryThreshold(), monitoring.getHysteresisMargin(), interval));

        int healthInterval = properties.getServiceHealth().getCheckIntervalSeconds();
        requirePositive("service-health.check-interval-seconds", healthInterval);
        result.put(MetricKind.SERVICE_HEALTH, new ThresholdConfig(MetricKind.SERVICE_HEALTH,
                MetricReading.UNHEALTHY, MetricReading.HEALTHY, Duration.ofSeconds(healthInterval)));
        return result;
    }

    static ThresholdConfig percentage(MetricKind kind, double high, Double recovery, double margin, int intervalSeconds) {
        double low = recovery != null ? recovery : Math.max(0.0, high - margin);
        if (high < 0 || high > 100) {
            throw new InvalidConfigurationException(
                    String.format("%s threshold must be between 0 and 100, got %s", kind.key(), high));
        }
        if (low < 0 || low > 100) {
            throw new InvalidConfigurationException(
                    String.format("%s recovery threshold must be between 0 and 100, got %s", kind.key(), low));
        }
        if (low >= high) {
            throw new InvalidConfigurationException(String.format(
                    "%s recovery threshold (%s) must be below its alert threshold (%s)", kind.key(), low, high));
        }
        return new ThresholdConfig(kind, high, low, Duration.ofSeconds(intervalSeconds));
    }

    private static void validateTimeouts(MonitorProperties properties) {
        MonitorProperties.RemediationConfig remediation = properties.getRemediation();
        requirePositive("remediation.timeout-seconds", remediation.getTimeoutSeconds());
        requirePositive("remediation.initial-backoff-millis", remediation.getInitialBackoffMillis());
        requireNonNegative("remediation.retry-attempts", remediation.getRetryAttempts());
        requirePositive("service-health.timeout-seconds", properties.getServiceHealth().getTimeoutSeconds());
        requirePositive("notifications.dedupe-window-seconds", properties.getNotifications().getDedupeWindowSeconds());
        requirePositive("notifications.slack.timeout-seconds", properties.getNotifications().getSlack().getTimeoutSeconds());
        requirePositive("scheduler.shutdown-timeout-seconds", properties.getScheduler().getShutdownTimeoutSeconds());
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(name + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0) {
            throw new InvalidConfigurationException(name + " must not be negative, got " + value);
        }
    }
}
