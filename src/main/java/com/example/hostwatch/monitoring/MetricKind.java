package com.example.hostwatch.monitoring;

/**
 * The kinds of host metric the monitor tracks. Each kind owns exactly one alert state.
 */
public enum MetricKind {
    CPU("cpu", "CPU"),
    MEMORY("memory", "Memory"),
    DISK("disk", "Disk"),
    SERVICE_HEALTH("service", "Service health");

    private final String key;
    private final String displayName;

    MetricKind(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /** Short lowercase key used in remediation context and log lines. */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isPercentage() {
        return this != SERVICE_HEALTH;
    }
}
