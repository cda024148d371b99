package com.example.hostwatch.monitoring;

import java.time.Duration;

/**
 * Water marks for one metric kind. {@code lowWaterMark < highWaterMark} is enforced
 * by {@link ThresholdConfigRegistry} before any instance reaches the evaluator.
 */
public record ThresholdConfig(MetricKind kind, double highWaterMark, double lowWaterMark, Duration checkInterval) {
}
