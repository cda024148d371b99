package com.example.hostwatch.monitoring;

import com.example.hostwatch.config.MonitorProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Used space of the file store holding the configured path.
 */
@Component
public class DiskMetricSource extends SystemMetricSource {

    private final Path path;

    public DiskMetricSource(HostIdentity host, Clock clock, MonitorProperties properties) {
        super(host, clock);
        this.path = Path.of(properties.getMonitoring().getDiskPath());
    }

    @Override
    public MetricKind kind() {
        return MetricKind.DISK;
    }

    @Override
    public MetricReading sample() throws MetricAcquisitionException {
        try {
            FileStore store = Files.getFileStore(path);
            long total = store.getTotalSpace();
            if (total <= 0) {
                throw new MetricAcquisitionException(kind(), "File store for " + path + " reports no capacity");
            }
            long used = total - store.getUsableSpace();
            return reading(used * 100.0 / total);
        } catch (IOException e) {
            throw new MetricAcquisitionException(kind(), "Cannot read file store for " + path, e);
        }
    }
}
