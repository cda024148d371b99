package com.example.hostwatch.scheduler;

import com.example.hostwatch.alert.AlertState;
import com.example.hostwatch.alert.AlertStateMachine;
import com.example.hostwatch.alert.AlertStateStore;
import com.example.hostwatch.alert.AlertTransition;
import com.example.hostwatch.alert.TransitionType;
import com.example.hostwatch.config.InvalidConfigurationException;
import com.example.hostwatch.config.MonitorProperties;
import com.example.hostwatch.monitoring.*;
import com.example.hostwatch.notification.DeliveryResult;
import com.example.hostwatch.notification.NotificationDispatcher;
import com.example.hostwatch.notification.NotificationSeverity;
import com.example.hostwatch.remediation.IssueTypeRegistry;
import com.example.hostwatch.remediation.RemediationDispatcher;
import com.example.hostwatch.remediation.RemediationOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Monitor Scheduler - drives the monitor → alert → remediate → notify loop.
 *
 * Two fixed-interval ticks share one scheduler thread: the metric tick (CPU, memory, disk
 * in that order) and the slower service-health tick. The next run is due at
 * {@code start + interval}; slots the tick overran are skipped, never queued.
 * No exception escapes a tick.
 *
 * A tick may take at most {@code checkInterval * (retryAttempts + 1)}. Remediation gets the
 * part of that budget not held back for the notifications still to be sent in the tick.
 *
 * Stopping is cooperative: no new tick starts, the in-flight one runs to completion
 * within its own timeouts, then the shutdown message goes out.
 */
@Slf4j
@Component
public class MonitorScheduler implements SmartLifecycle {

    private final Map<MetricKind, MetricSource> sources;
    private final List<MetricKind> metricKinds;
    private final boolean serviceHealthEnabled;
    private final ThresholdConfigRegistry thresholds;
    private final ThresholdEvaluator evaluator;
    private final AlertStateMachine stateMachine;
    private final RemediationDispatcher remediation;
    private final IssueTypeRegistry issueTypes;
    private final NotificationDispatcher notifications;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final HostIdentity host;
    private final MonitorProperties properties;

    private final AlertStateStore store;
    private final MonitorStats stats = new MonitorStats();
    private final Map<MetricKind, MetricReading> latestReadings = new ConcurrentHashMap<>();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();
    private final Duration tickBudget;
    private final Duration notificationReserve;

    private volatile boolean running;

    public MonitorScheduler(List<MetricSource> sources, ThresholdConfigRegistry thresholds,
                            ThresholdEvaluator evaluator, AlertStateMachine stateMachine,
                            RemediationDispatcher remediation, IssueTypeRegistry issueTypes,
                            NotificationDispatcher notifications,
                            @Qualifier("monitorTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
                            MeterRegistry meterRegistry, Clock clock, HostIdentity host,
                            MonitorProperties properties) {
        this.thresholds = thresholds;
        this.evaluator = evaluator;
        this.stateMachine = stateMachine;
        this.remediation = remediation;
        this.issueTypes = issueTypes;
        this.notifications = notifications;
        this.taskScheduler = taskScheduler;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.host = host;
        this.properties = properties;

        this.metricKinds = new ArrayList<>(new TreeSet<>(properties.getMonitoring().getKinds()));
        if (metricKinds.contains(MetricKind.SERVICE_HEALTH)) {
            throw new InvalidConfigurationException(
                    "SERVICE_HEALTH is configured under hostwatch.service-health, not hostwatch.monitoring.kinds");
        }
        this.serviceHealthEnabled = properties.getServiceHealth().isEnabled();
        this.sources = index(sources);

        List<MetricKind> monitored = new ArrayList<>(metricKinds);
        if (serviceHealthEnabled) {
            monitored.add(MetricKind.SERVICE_HEALTH);
        }
        for (MetricKind kind : monitored) {
            if (!this.sources.containsKey(kind)) {
                throw new InvalidConfigurationException("No metric source available for " + kind);
            }
        }
        this.store = new AlertStateStore(monitored, clock.instant());

        this.tickBudget = Duration.ofSeconds(properties.getMonitoring().getCheckIntervalSeconds())
                .multipliedBy(properties.getRemediation().getRetryAttempts() + 1L);
        // one post plus its retry
        this.notificationReserve = Duration.ofSeconds(properties.getNotifications().getSlack().getTimeoutSeconds())
                .multipliedBy(2);
    }

    // ── Lifecycle ──

    @Override
    public boolean isAutoStartup() {
        return properties.getScheduler().isAutoStart();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Instant now = clock.instant();
        stats.started(now);
        log.info("Monitoring {} started: kinds {} every {}s{}", host.hostname(), metricKinds,
                properties.getMonitoring().getCheckIntervalSeconds(),
                serviceHealthEnabled ? ", service health every " + properties.getServiceHealth().getCheckIntervalSeconds() + "s" : "");

        if (properties.getNotifications().isLifecycleMessages()) {
            taskScheduler.execute(this::announceStartup);
        }
        if (!metricKinds.isEmpty()) {
            scheduled.add(taskScheduler.schedule(this::metricLoop, now));
        }
        if (serviceHealthEnabled) {
            scheduled.add(taskScheduler.schedule(this::serviceHealthLoop, now));
        }
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            scheduled.forEach(future -> future.cancel(false));
            scheduled.clear();
        }
        log.info("Stopping monitor, waiting for the in-flight tick to finish");

        boolean acquired = false;
        try {
            acquired = tickLock.tryLock(properties.getScheduler().getShutdownTimeoutSeconds(), TimeUnit.SECONDS);
            if (!acquired) {
                log.warn("In-flight tick did not finish within {}s", properties.getScheduler().getShutdownTimeoutSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the in-flight tick");
        } finally {
            if (acquired) {
                tickLock.unlock();
            }
        }

        Duration uptime = stats.uptime(clock.instant());
        log.info("Monitor stopped after {} ({} ticks, {} alerts raised)",
                MonitorStats.formatUptime(uptime), stats.getTicks(), stats.getAlertsRaised());
        if (properties.getNotifications().isLifecycleMessages()) {
            record(notifications.notifyText(NotificationSeverity.INFO, String.format(
                    "Hostwatch stopped on %s. Uptime: %s, checks: %d, alerts raised: %d",
                    host.hostname(), MonitorStats.formatUptime(uptime), stats.getTicks(), stats.getAlertsRaised())));
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ── Ticks ──

    private void metricLoop() {
        loop("metrics", Duration.ofSeconds(properties.getMonitoring().getCheckIntervalSeconds()),
                this::runMetricChecks, this::metricLoop);
    }

    private void serviceHealthLoop() {
        loop("service_health", thresholds.get(MetricKind.SERVICE_HEALTH).checkInterval(),
                this::runServiceHealthCheck, this::serviceHealthLoop);
    }

    private void loop(String tick, Duration interval, Runnable body, Runnable self) {
        if (!running) {
            return;
        }
        Instant started = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            body.run();
        } catch (RuntimeException e) {
            log.error("Unexpected error in {} tick", tick, e);
        } finally {
            sample.stop(Timer.builder("hostwatch.tick.duration").tag("tick", tick).register(meterRegistry));
        }

        NextRun next = nextRun(started, interval, clock.instant());
        if (next.skipped() > 0) {
            stats.skipped(next.skipped());
            Counter.builder("hostwatch.ticks.skipped").tag("tick", tick).register(meterRegistry)
                    .increment(next.skipped());
            log.warn("{} tick overran its {}s interval, skipped {} run(s)", tick, interval.toSeconds(), next.skipped());
        }
        synchronized (this) {
            if (running) {
                scheduled.removeIf(ScheduledFuture::isDone);
                scheduled.add(taskScheduler.schedule(self, next.at()));
            }
        }
    }

    /**
     * One pass over the configured metric kinds. Returns the transitions produced,
     * one per kind that could be sampled.
     */
    public List<AlertTransition> runMetricChecks() {
        tickLock.lock();
        try {
            stats.tick();
            Instant deadline = clock.instant().plus(tickBudget);
            List<AlertTransition> transitions = new ArrayList<>();
            for (int i = 0; i < metricKinds.size(); i++) {
                Instant remediateBy = deadline.minus(notificationReserve.multipliedBy(metricKinds.size() - i));
                evaluateKind(metricKinds.get(i), remediateBy).ifPresent(transitions::add);
            }
            return transitions;
        } finally {
            tickLock.unlock();
        }
    }

    public Optional<AlertTransition> runServiceHealthCheck() {
        if (!serviceHealthEnabled) {
            return Optional.empty();
        }
        tickLock.lock();
        try {
            Instant remediateBy = clock.instant().plus(tickBudget).minus(notificationReserve);
            return evaluateKind(MetricKind.SERVICE_HEALTH, remediateBy);
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Queue a metric pass on the scheduler thread, alongside the regular ticks.
     */
    public CompletableFuture<List<AlertTransition>> requestTick() {
        log.info("Manual metric check requested");
        return CompletableFuture.supplyAsync(this::runMetricChecks, taskScheduler);
    }

    Optional<AlertTransition> evaluateKind(MetricKind kind, Instant remediateBy) {
        MetricReading reading;
        try {
            reading = sources.get(kind).sample();
        } catch (MetricAcquisitionException e) {
            stats.acquisitionFailed();
            log.warn("Skipping {} this tick: {}", kind, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            stats.acquisitionFailed();
            log.warn("Skipping {} this tick, sampling failed unexpectedly: {}", kind, e.getMessage(), e);
            return Optional.empty();
        }
        latestReadings.put(kind, reading);

        AlertState current = store.get(kind);
        Severity severity = evaluator.evaluate(reading, thresholds.get(kind), current.status());
        AlertTransition transition = stateMachine.advance(store, reading, severity);
        if (transition.type() != TransitionType.NONE) {
            Counter.builder("hostwatch.transitions")
                    .tag("kind", kind.key())
                    .tag("type", transition.type().name().toLowerCase())
                    .register(meterRegistry)
                    .increment();
        }

        try {
            handle(transition, remediateBy);
        } catch (RuntimeException e) {
            log.error("Failed to act on {} transition for {}", transition.type(), kind, e);
        }
        return Optional.of(transition);
    }

    private void handle(AlertTransition transition, Instant remediateBy) {
        switch (transition.type()) {
            case RAISED -> {
                stats.alertRaised();
                RemediationOutcome outcome = null;
                if (issueTypes.isRemediable(transition.kind())) {
                    outcome = remediation.dispatch(transition, remediateBy);
                    stats.remediation(outcome);
                } else {
                    log.info("Remediation of {} is disabled, notifying only", transition.kind());
                }
                record(notifications.notify(transition, outcome));
            }
            case REPEATED, CLEARED -> record(notifications.notify(transition));
            case REPEATED_SUPPRESSED -> log.debug("{} still breaching ({} consecutive), re-notification not due",
                    transition.kind(), transition.consecutiveBreaches());
            case NONE -> {
            }
        }
    }

    private void announceStartup() {
        String thresholdSummary = metricKinds.stream()
                .map(kind -> String.format("%s >= %.0f%%", kind.key(), thresholds.get(kind).highWaterMark()))
                .reduce((a, b) -> a + ", " + b)
                .orElse("none");
        record(notifications.notifyText(NotificationSeverity.INFO, String.format(
                "Hostwatch started on %s (%d CPUs). Thresholds: %s. Check interval: %ds",
                host.hostname(), host.availableProcessors(), thresholdSummary,
                properties.getMonitoring().getCheckIntervalSeconds())));
    }

    private void record(DeliveryResult result) {
        stats.notification(result);
    }

    // ── Reports ──

    /**
     * Samples the metric kinds now and posts a health report. Kinds that cannot be
     * sampled fall back to their last reading.
     */
    public DeliveryResult sendHealthReport() {
        Map<MetricKind, MetricReading> readings = new EnumMap<>(MetricKind.class);
        readings.putAll(latestReadings);
        for (MetricKind kind : metricKinds) {
            try {
                readings.put(kind, sources.get(kind).sample());
            } catch (MetricAcquisitionException e) {
                log.warn("Health report uses last {} reading: {}", kind, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Health report uses last {} reading, sampling failed unexpectedly: {}", kind, e.getMessage(), e);
            }
        }
        DeliveryResult result = notifications.notifyHealthReport(host.hostname(), readings);
        record(result);
        return result;
    }

    public Map<String, Object> getStatus() {
        Instant now = clock.instant();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", running);
        status.put("hostname", host.hostname());
        status.putAll(stats.toMap(now));

        Map<String, Object> thresholdView = new LinkedHashMap<>();
        Map<String, Object> alertView = new LinkedHashMap<>();
        for (Map.Entry<MetricKind, AlertState> entry : store.snapshot().entrySet()) {
            MetricKind kind = entry.getKey();
            ThresholdConfig config = thresholds.get(kind);
            thresholdView.put(kind.key(), Map.of(
                    "high", config.highWaterMark(),
                    "low", config.lowWaterMark(),
                    "intervalSeconds", config.checkInterval().toSeconds()));

            AlertState state = entry.getValue();
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("status", state.status());
            view.put("consecutiveBreaches", state.consecutiveBreaches());
            view.put("lastTransitionAt", state.lastTransitionAt().toString());
            view.put("cooldownUntil", state.cooldownUntil().toString());
            MetricReading latest = latestReadings.get(kind);
            view.put("lastValue", latest != null ? latest.value() : null);
            view.put("lastObservedAt", latest != null ? latest.observedAt().toString() : null);
            alertView.put(kind.key(), view);
        }
        status.put("thresholds", thresholdView);
        status.put("alerts", alertView);
        return status;
    }

    public AlertStateStore getStore() {
        return store;
    }

    public MonitorStats getStats() {
        return stats;
    }

    /**
     * When the next run is due after a tick that started at {@code started} and finished at
     * {@code finished}. Slots already in the past are skipped.
     */
    static NextRun nextRun(Instant started, Duration interval, Instant finished) {
        Instant next = started.plus(interval);
        long skipped = 0;
        while (next.isBefore(finished)) {
            next = next.plus(interval);
            skipped++;
        }
        return new NextRun(next, skipped);
    }

    record NextRun(Instant at, long skipped) {
    }

    private static Map<MetricKind, MetricSource> index(List<MetricSource> sources) {
        Map<MetricKind, MetricSource> byKind = new EnumMap<>(MetricKind.class);
        for (MetricSource source : sources) {
            MetricSource previous = byKind.put(source.kind(), source);
            if (previous != null) {
                throw new InvalidConfigurationException("Two metric sources for " + source.kind() + ": "
                        + previous.getClass().getSimpleName() + " and " + source.getClass().getSimpleName());
            }
        }
        return byKind;
    }
}
