package com.example.hostwatch.alert;

import com.example.hostwatch.monitoring.MetricKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one kind's alert state. Outside COOLDOWN,
 * {@code cooldownUntil} equals {@code lastTransitionAt}.
 */
public record AlertState(MetricKind kind, AlertStatus status, Instant lastTransitionAt,
                         int consecutiveBreaches, Instant cooldownUntil) {

    public AlertState {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(lastTransitionAt, "lastTransitionAt must not be null");
        Objects.requireNonNull(cooldownUntil, "cooldownUntil must not be null");
        if (cooldownUntil.isBefore(lastTransitionAt)) {
            throw new IllegalStateException("cooldownUntil " + cooldownUntil
                    + " precedes lastTransitionAt " + lastTransitionAt + " for " + kind);
        }
        if (consecutiveBreaches < 0) {
            throw new IllegalStateException("consecutiveBreaches must not be negative for " + kind);
        }
    }

    public static AlertState initial(MetricKind kind, Instant now) {
        return new AlertState(kind, AlertStatus.OK, now, 0, now);
    }

    AlertState toOk(Instant now) {
        return new AlertState(kind, AlertStatus.OK, now, 0, now);
    }

    AlertState toAlerting(Instant now) {
        return new AlertState(kind, AlertStatus.ALERTING, now, 1, now);
    }

    AlertState withBreach() {
        return new AlertState(kind, status, lastTransitionAt, consecutiveBreaches + 1, cooldownUntil);
    }

    AlertState toCooldown(Instant now, Instant until) {
        return new AlertState(kind, AlertStatus.COOLDOWN, now, 0, until);
    }
}
