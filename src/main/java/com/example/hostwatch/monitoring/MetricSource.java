package com.example.hostwatch.monitoring;

/**
 * Produces readings for one metric kind on demand.
 * Implementations must bound every call with a timeout.
 */
public interface MetricSource {

    MetricKind kind();

    /**
     * Take a sample now.
     *
     * @throws MetricAcquisitionException if the metric cannot be read this time
     */
    MetricReading sample() throws MetricAcquisitionException;
}
