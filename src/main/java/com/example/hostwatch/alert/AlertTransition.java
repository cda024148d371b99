package com.example.hostwatch.alert;

import com.example.hostwatch.monitoring.MetricKind;
import com.example.hostwatch.monitoring.MetricReading;

/**
 * Result of advancing one kind by one reading. Consumed immediately by the
 * dispatchers and then discarded.
 *
 * @param consecutiveBreaches breaches counted for the incident; for CLEARED this is
 *                            the count the incident reached before clearing
 */
public record AlertTransition(MetricKind kind, AlertStatus from, AlertStatus to, TransitionType type,
                              MetricReading reading, int consecutiveBreaches) {

    public boolean isRaised() {
        return type == TransitionType.RAISED;
    }

    public boolean isStatusChange() {
        return from != to;
    }
}
