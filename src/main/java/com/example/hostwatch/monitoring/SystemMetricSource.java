package com.example.hostwatch.monitoring;

import java.lang.management.ManagementFactory;
import java.time.Clock;

/**
 * Base for metric sources backed by the JVM's view of the operating system.
 */
public abstract class SystemMetricSource implements MetricSource {

    protected final HostIdentity host;
    protected final Clock clock;

    protected SystemMetricSource(HostIdentity host, Clock clock) {
        this.host = host;
        this.clock = clock;
    }

    protected MetricReading reading(double percent) throws MetricAcquisitionException {
        if (Double.isNaN(percent) || percent < 0) {
            throw new MetricAcquisitionException(kind(), kind().displayName() + " usage not available");
        }
        return new MetricReading(kind(), Math.min(100.0, percent), host.hostname(), clock.instant());
    }

    protected com.sun.management.OperatingSystemMXBean osBean() throws MetricAcquisitionException {
        if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean bean) {
            return bean;
        }
        throw new MetricAcquisitionException(kind(), "Operating system metrics are not exposed by this JVM");
    }
}
