package com.example.hostwatch.scheduler;

import com.example.hostwatch.notification.DeliveryResult;
import com.example.hostwatch.remediation.RemediationOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running totals for one monitor instance. Written from the scheduler thread,
 * read by the status endpoint.
 */
public class MonitorStats {

    private final AtomicReference<Instant> startedAt = new AtomicReference<>();
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final AtomicLong acquisitionFailures = new AtomicLong();
    private final AtomicLong alertsRaised = new AtomicLong();
    private final AtomicLong remediationsAttempted = new AtomicLong();
    private final AtomicLong remediationsSucceeded = new AtomicLong();
    private final AtomicLong notificationsDelivered = new AtomicLong();
    private final AtomicLong notificationsDropped = new AtomicLong();

    void started(Instant at) {
        startedAt.set(at);
    }

    void tick() {
        ticks.incrementAndGet();
    }

    void skipped(long count) {
        skippedTicks.addAndGet(count);
    }

    void acquisitionFailed() {
        acquisitionFailures.incrementAndGet();
    }

    void alertRaised() {
        alertsRaised.incrementAndGet();
    }

    void remediation(RemediationOutcome outcome) {
        remediationsAttempted.incrementAndGet();
        if (outcome.isSuccess()) {
            remediationsSucceeded.incrementAndGet();
        }
    }

    void notification(DeliveryResult result) {
        switch (result.status()) {
            case DELIVERED -> notificationsDelivered.incrementAndGet();
            case DROPPED -> notificationsDropped.incrementAndGet();
            default -> {
            }
        }
    }

    public Instant getStartedAt() {
        return startedAt.get();
    }

    public long getTicks() {
        return ticks.get();
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    public long getAlertsRaised() {
        return alertsRaised.get();
    }

    public long getRemediationsAttempted() {
        return remediationsAttempted.get();
    }

    public long getRemediationsSucceeded() {
        return remediationsSucceeded.get();
    }

    public Duration uptime(Instant now) {
        Instant start = startedAt.get();
        return start == null ? Duration.ZERO : Duration.between(start, now);
    }

    public Map<String, Object> toMap(Instant now) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("startedAt", startedAt.get() != null ? startedAt.get().toString() : null);
        map.put("uptimeSeconds", uptime(now).toSeconds());
        map.put("ticks", ticks.get());
        map.put("skippedTicks", skippedTicks.get());
        map.put("acquisitionFailures", acquisitionFailures.get());
        map.put("alertsRaised", alertsRaised.get());
        map.put("remediationsAttempted", remediationsAttempted.get());
        map.put("remediationsSucceeded", remediationsSucceeded.get());
        map.put("notificationsDelivered", notificationsDelivered.get());
        map.put("notificationsDropped", notificationsDropped.get());
        return map;
    }

    static String formatUptime(Duration uptime) {
        long seconds = uptime.toSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        return String.format("%dh %dm %ds", hours, minutes, seconds % 60);
    }
}
