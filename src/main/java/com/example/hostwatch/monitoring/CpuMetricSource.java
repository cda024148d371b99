package com.example.hostwatch.monitoring;

import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * System-wide CPU load as a percentage of all cores.
 */
@Component
public class CpuMetricSource extends SystemMetricSource {

    public CpuMetricSource(HostIdentity host, Clock clock) {
        super(host, clock);
    }

    @Override
    public MetricKind kind() {
        return MetricKind.CPU;
    }

    @Override
    public MetricReading sample() throws MetricAcquisitionException {
        // negative until the JVM has a first measurement window
        double load = osBean().getCpuLoad();
        return reading(load * 100.0);
    }
}
