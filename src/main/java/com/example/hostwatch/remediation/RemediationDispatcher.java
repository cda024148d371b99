package com.example.hostwatch.remediation;

import com.example.hostwatch.alert.AlertTransition;
import com.example.hostwatch.config.MonitorProperties;
import com.example.hostwatch.monitoring.MetricKind;
import com.example.hostwatch.monitoring.MetricReading;
import com.example.hostwatch.monitoring.ThresholdConfigRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remediation Dispatcher - turns a RAISED transition into a remediation call.
 *
 * Each attempt is bounded by the executor's timeout. Transport failures are retried
 * up to {@code retry-attempts} times with exponential backoff (1s, 2s, 4s... each capped
 * at the timeout); application failures are returned as they are. An attempt only starts
 * when it can finish before the caller's deadline. Nothing thrown by the executor escapes:
 * on exhaustion the outcome is "remediation service unreachable".
 */
@Slf4j
@Component
public class RemediationDispatcher {

    private final RemediationExecutor executor;
    private final IssueTypeRegistry issueTypes;
    private final ThresholdConfigRegistry thresholds;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration timeout;
    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final Retry retry;
    private final String serviceName;

    public RemediationDispatcher(RemediationExecutor executor, IssueTypeRegistry issueTypes,
                                 ThresholdConfigRegistry thresholds, MonitorProperties properties,
                                 MeterRegistry meterRegistry, Clock clock) {
        this.executor = executor;
        this.issueTypes = issueTypes;
        this.thresholds = thresholds;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        MonitorProperties.RemediationConfig config = properties.getRemediation();
        this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        this.maxAttempts = config.getRetryAttempts() + 1;
        this.backoff = IntervalFunction.ofExponentialBackoff(config.getInitialBackoffMillis(), 2.0, timeout.toMillis());
        this.serviceName = properties.getServiceHealth().getServiceName();

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff)
                .retryExceptions(IOException.class)
                .build();
        this.retry = Retry.of("remediation", retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Remediation attempt {}/{} failed, retrying in {}ms: {}",
                        event.getNumberOfRetryAttempts(), maxAttempts, event.getWaitInterval().toMillis(),
                        event.getLastThrowable().getMessage()))
                .onError(event -> log.error("Remediation gave up after {} attempt(s): {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    /**
     * Dispatch a RAISED transition; no attempt is started that could run past {@code deadline}.
     */
    public RemediationOutcome dispatch(AlertTransition transition, Instant deadline) {
        if (!transition.isRaised()) {
            log.warn("Ignoring remediation request for {} transition of {}", transition.type(), transition.kind());
            return RemediationOutcome.failure("Remediation is only dispatched for raised alerts", null);
        }

        IssueType issueType = issueTypes.issueTypeFor(transition.kind());
        RemediationRequest request = buildRequest(transition, issueType);
        log.info("Dispatching remediation {} for {} via {} executor (priority {})",
                issueType.id(), transition.kind(), executor.mode(), request.priority());
        return executeWithRetry(request, deadline);
    }

    RemediationRequest buildRequest(AlertTransition transition, IssueType issueType) {
        MetricReading reading = transition.reading();
        MetricKind kind = transition.kind();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("hostname", reading.hostname());
        context.put("timestamp", reading.observedAt().toString());
        context.put("metric", kind.key());
        if (kind.isPercentage()) {
            context.put(kind.key() + "_percent", reading.value());
        } else {
            context.put("serviceName", serviceName);
            context.put("healthy", reading.value() == MetricReading.HEALTHY);
        }
        context.put("threshold", thresholds.get(kind).highWaterMark());
        context.put("consecutiveBreaches", transition.consecutiveBreaches());

        int priority = Math.max(RemediationRequest.MIN_PRIORITY,
                Math.min(RemediationRequest.MAX_PRIORITY, issueType.defaultPriority()));
        return new RemediationRequest(issueType.id(), context, priority);
    }

    RemediationOutcome executeWithRetry(RemediationRequest request, Instant deadline) {
        String issueType = request.issueType();
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<String> lastError = new AtomicReference<>();

        Callable<RemediationOutcome> attempt = () -> {
            int number = attempts.get() + 1;
            Instant finishBy = clock.instant().plus(timeout);
            if (finishBy.isAfter(deadline)) {
                throw new OutOfTimeException(lastError.get());
            }
            attempts.set(number);
            boolean roomForRetry = number < maxAttempts && !finishBy.plus(backoffFor(number)).isAfter(deadline);
            try {
                RemediationOutcome outcome = executor.execute(request);
                count(issueType, outcome.isSuccess() ? "success" : "failure");
                if (outcome.isSuccess()) {
                    log.info("Remediation {} succeeded on attempt {}: {}", issueType, number, outcome.getMessage());
                } else {
                    log.warn("Remediation {} failed on attempt {}: {} {}", issueType, number,
                            outcome.getMessage(), outcome.getError() != null ? "(" + outcome.getError() + ")" : "");
                }
                return outcome;
            } catch (IOException e) {
                count(issueType, "transport_error");
                lastError.set(e.getMessage());
                if (number < maxAttempts && !roomForRetry) {
                    throw new OutOfTimeException(e.getMessage());
                }
                throw e;
            }
        };

        try {
            return retry.executeCallable(attempt);
        } catch (OutOfTimeException e) {
            count(issueType, "out_of_time");
            log.warn("Remediation {} stopped after {} attempt(s): tick time budget exhausted",
                    issueType, attempts.get());
            return RemediationOutcome.outOfTime(e.getMessage());
        } catch (IOException e) {
            return RemediationOutcome.unreachable(e.getMessage());
        } catch (RuntimeException e) {
            count(issueType, "error");
            log.error("Unexpected error during remediation {}", issueType, e);
            return RemediationOutcome.failure("Unexpected error during remediation", e.getMessage());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Remediation {} interrupted: {}", issueType, e.toString());
            return RemediationOutcome.unreachable(lastError.get());
        }
    }

    /**
     * Delay before retry number {@code retry} (1-based): initial * 2^(retry-1), capped at the timeout.
     */
    Duration backoffFor(int retry) {
        return Duration.ofMillis(backoff.apply(retry));
    }

    Retry retry() {
        return retry;
    }

    private void count(String issueType, String result) {
        Counter.builder("hostwatch.remediation.attempts")
                .tag("issue_type", issueType)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static final class OutOfTimeException extends RuntimeException {
        OutOfTimeException(String lastError) {
            super(lastError);
        }
    }
}
