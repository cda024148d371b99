package com.example.hostwatch.monitoring;

import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Physical memory in use as a percentage of total memory.
 */
@Component
public class MemoryMetricSource extends SystemMetricSource {

    public MemoryMetricSource(HostIdentity host, Clock clock) {
        super(host, clock);
    }

    @Override
    public MetricKind kind() {
        return MetricKind.MEMORY;
    }

    @Override
    public MetricReading sample() throws MetricAcquisitionException {
        com.sun.management.OperatingSystemMXBean os = osBean();
        long total = os.getTotalMemorySize();
        if (total <= 0) {
            throw new MetricAcquisitionException(kind(), "Total memory size not available");
        }
        long used = total - os.getFreeMemorySize();
        return reading(used * 100.0 / total);
    }
}
