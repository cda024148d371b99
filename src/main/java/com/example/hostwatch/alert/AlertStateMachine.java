package com.example.hostwatch.alert;

import com.example.hostwatch.config.MonitorProperties;
import com.example.hostwatch.monitoring.MetricKind;
import com.example.hostwatch.monitoring.MetricReading;
import com.example.hostwatch.monitoring.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Alert State Machine - advances one kind's {@link AlertState} per evaluated reading.
 *
 * <pre>
 * OK        + NORMAL/WARNING  → OK         (none)
 * OK        + BREACH          → ALERTING   RAISED
 * ALERTING  + BREACH          → ALERTING   REPEATED every renotify-interval breaches, else REPEATED_SUPPRESSED
 * ALERTING  + WARNING         → ALERTING   (none, hysteresis band)
 * ALERTING  + NORMAL          → COOLDOWN   CLEARED
 * COOLDOWN  + any             → COOLDOWN until cooldownUntil, then OK (none)
 * </pre>
 *
 * The machine itself is stateless; state lives in the {@link AlertStateStore}
 * handed in by the caller. The new state is computed in full and committed once.
 * The reading's observation time is the clock for transitions and cooldowns.
 */
@Slf4j
@Component
public class AlertStateMachine {

    private final Duration cooldown;
    private final int renotifyInterval;

    public AlertStateMachine(MonitorProperties properties) {
        this.cooldown = Duration.ofSeconds(properties.getMonitoring().getCooldownSeconds());
        this.renotifyInterval = properties.getMonitoring().getRenotifyInterval();
    }

    public AlertTransition advance(AlertStateStore store, MetricReading reading, Severity severity) {
        MetricKind kind = reading.kind();
        AlertState current = store.get(kind);
        Instant now = reading.observedAt();

        AlertState next;
        TransitionType type;
        int reportedBreaches;

        switch (current.status()) {
            case OK -> {
                if (severity == Severity.BREACH) {
                    next = current.toAlerting(now);
                    type = TransitionType.RAISED;
                } else {
                    next = current;
                    type = TransitionType.NONE;
                }
                reportedBreaches = next.consecutiveBreaches();
            }
            case ALERTING -> {
                if (severity == Severity.BREACH) {
                    next = current.withBreach();
                    type = isRenotifyDue(next.consecutiveBreaches())
                            ? TransitionType.REPEATED
                            : TransitionType.REPEATED_SUPPRESSED;
                    reportedBreaches = next.consecutiveBreaches();
                } else if (severity == Severity.NORMAL) {
                    next = current.toCooldown(now, now.plus(cooldown));
                    type = TransitionType.CLEARED;
                    reportedBreaches = current.consecutiveBreaches();
                } else {
                    next = current;
                    type = TransitionType.NONE;
                    reportedBreaches = current.consecutiveBreaches();
                }
            }
            case COOLDOWN -> {
                // the tick that ends a cooldown only re-arms; a breach can raise on the following tick
                next = now.isBefore(current.cooldownUntil()) ? current : current.toOk(now);
                type = TransitionType.NONE;
                reportedBreaches = 0;
            }
            default -> throw new IllegalStateException("Unknown alert status: " + current.status());
        }

        store.commit(next);
        AlertTransition transition = new AlertTransition(kind, current.status(), next.status(), type,
                reading, reportedBreaches);
        logTransition(transition, severity);
        return transition;
    }

    private boolean isRenotifyDue(int consecutiveBreaches) {
        return renotifyInterval > 0 && consecutiveBreaches % renotifyInterval == 0;
    }

    private void logTransition(AlertTransition t, Severity severity) {
        if (t.isStatusChange()) {
            log.info("{} alert {} → {} ({}, value={}, severity={})",
                    t.kind(), t.from(), t.to(), t.type(), t.reading().value(), severity);
        } else if (t.type() != TransitionType.NONE) {
            log.info("{} alert still {} ({}, value={}, consecutiveBreaches={})",
                    t.kind(), t.to(), t.type(), t.reading().value(), t.consecutiveBreaches());
        } else {
            log.debug("{} alert {} unchanged (value={}, severity={})",
                    t.kind(), t.to(), t.reading().value(), severity);
        }
    }
}
