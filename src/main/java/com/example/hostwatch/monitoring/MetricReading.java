package com.example.hostwatch.monitoring;

import java.time.Instant;
import java.util.Objects;

/**
 * A single sample of one metric kind.
 * Values are percentages in [0, 100]; service health is boolean-coded
 * ({@link #HEALTHY} or {@link #UNHEALTHY}).
 */
public record MetricReading(MetricKind kind, double value, String hostname, Instant observedAt) {

    public static final double HEALTHY = 0.0;
    public static final double UNHEALTHY = 100.0;

    public MetricReading {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(hostname, "hostname must not be null");
        Objects.requireNonNull(observedAt, "observedAt must not be null");
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(
                    String.format("%s reading out of range: %s", kind, value));
        }
    }

    public static MetricReading serviceHealth(boolean healthy, String hostname, Instant observedAt) {
        return new MetricReading(MetricKind.SERVICE_HEALTH, healthy ? HEALTHY : UNHEALTHY, hostname, observedAt);
    }
}
