package com.example.hostwatch.monitoring;

import com.example.hostwatch.alert.AlertStatus;
import org.springframework.stereotype.Component;

/**
 * Maps a reading onto a {@link Severity} using the kind's water marks.
 *
 * <p>Both marks are inclusive: {@code value >= high} breaches, and while alerting
 * {@code value <= low} recovers. Between the marks an alerting kind stays sticky
 * ({@link Severity#WARNING}), which keeps a value hovering at the threshold from
 * flapping between raised and cleared.</p>
 */
@Component
public class ThresholdEvaluator {

    public Severity evaluate(MetricReading reading, ThresholdConfig config) {
        return evaluate(reading, config, AlertStatus.OK);
    }

    public Severity evaluate(MetricReading reading, ThresholdConfig config, AlertStatus currentStatus) {
        double value = reading.value();
        if (value >= config.highWaterMark()) {
            return Severity.BREACH;
        }
        if (currentStatus == AlertStatus.ALERTING) {
            return value <= config.lowWaterMark() ? Severity.NORMAL : Severity.WARNING;
        }
        return value < config.lowWaterMark() ? Severity.NORMAL : Severity.WARNING;
    }
}
