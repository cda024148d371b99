package com.example.hostwatch.remediation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Remediation actions understood by the remediation service, keyed by their wire id.
 */
public enum IssueType {
    HIGH_CPU("high_cpu", 7),
    HIGH_MEMORY("high_memory", 7),
    HIGH_DISK("high_disk", 6),
    SERVICE_RESTART("service_restart", 8);

    private final String id;
    private final int defaultPriority;

    IssueType(String id, int defaultPriority) {
        this.id = id;
        this.defaultPriority = defaultPriority;
    }

    public String id() {
        return id;
    }

    public int defaultPriority() {
        return defaultPriority;
    }

    public static Optional<IssueType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase();
        return Arrays.stream(values()).filter(t -> t.id.equals(normalized)).findFirst();
    }
}
