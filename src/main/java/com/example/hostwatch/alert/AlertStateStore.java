package com.example.hostwatch.alert;

import com.example.hostwatch.monitoring.MetricKind;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the single {@link AlertState} of every monitored kind.
 *
 * Owned by the monitor scheduler and written only from its thread; other threads
 * may read {@link #snapshot()}. Each kind's state is replaced as a whole, never
 * mutated in place.
 */
public class AlertStateStore {

    private final Map<MetricKind, AlertState> states = new ConcurrentHashMap<>();

    public AlertStateStore(Collection<MetricKind> kinds, Instant now) {
        for (MetricKind kind : kinds) {
            states.put(kind, AlertState.initial(kind, now));
        }
    }

    public AlertState get(MetricKind kind) {
        AlertState state = states.get(kind);
        if (state == null) {
            throw new IllegalArgumentException("Kind is not monitored: " + kind);
        }
        return state;
    }

    void commit(AlertState state) {
        if (!states.containsKey(state.kind())) {
            throw new IllegalArgumentException("Kind is not monitored: " + state.kind());
        }
        states.put(state.kind(), state);
    }

    public boolean contains(MetricKind kind) {
        return states.containsKey(kind);
    }

    public Map<MetricKind, AlertState> snapshot() {
        Map<MetricKind, AlertState> copy = new EnumMap<>(MetricKind.class);
        copy.putAll(states);
        return Collections.unmodifiableMap(copy);
    }
}
