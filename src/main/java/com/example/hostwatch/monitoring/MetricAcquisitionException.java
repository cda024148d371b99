package com.example.hostwatch.monitoring;

/**
 * A metric could not be sampled. Transient: the kind is skipped for one tick.
 */
public class MetricAcquisitionException extends Exception {

    private final MetricKind kind;

    public MetricAcquisitionException(MetricKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MetricAcquisitionException(MetricKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public MetricKind getKind() {
        return kind;
    }
}
