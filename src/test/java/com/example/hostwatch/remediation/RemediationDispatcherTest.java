package com.example.hostwatch.remediation;

import com.example.hostwatch.alert.AlertStatus;
import com.example.hostwatch.alert.AlertTransition;
import com.example.hostwatch.alert.TransitionType;
import com.example.hostwatch.config.MonitorProperties;
import com.example.hostwatch.monitoring.MetricKind;
import com.example.hostwatch.monitoring.MetricReading;
import com.example.hostwatch.monitoring.ThresholdConfigRegistry;
import com.example.hostwatch.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RemediationDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final Instant NO_DEADLINE = Instant.MAX;

    private RemediationExecutor executor;
    private MonitorProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private List<Duration> waits;
    private RemediationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = mock(RemediationExecutor.class);
        when(executor.mode()).thenReturn("mock");
        properties = new MonitorProperties();
        properties.getMonitoring().setCpuThreshold(90);
        properties.getRemediation().setRetryAttempts(3);
        properties.getRemediation().setInitialBackoffMillis(10);
        properties.getRemediation().setTimeoutSeconds(30);
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(NOW);
        waits = new ArrayList<>();
        dispatcher = newDispatcher();
    }

    private RemediationDispatcher newDispatcher() {
        RemediationDispatcher created = new RemediationDispatcher(executor, new IssueTypeRegistry(properties),
                new ThresholdConfigRegistry(properties), properties, meterRegistry, clock);
        created.retry().getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval()));
        return created;
    }

    @Test
    @DisplayName("CPU breach is sent as high_cpu with metric context")
    void buildsCpuRequest() throws IOException {
        when(executor.execute(any())).thenReturn(RemediationOutcome.success("done", List.of("step"), Duration.ZERO));

        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.CPU, 92.0), NO_DEADLINE);

        ArgumentCaptor<RemediationRequest> captor = ArgumentCaptor.forClass(RemediationRequest.class);
        verify(executor).execute(captor.capture());
        RemediationRequest request = captor.getValue();
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(request.issueType()).isEqualTo("high_cpu");
        assertThat(request.priority()).isEqualTo(7);
        assertThat(request.context())
                .containsEntry("hostname", "host-1")
                .containsEntry("cpu_percent", 92.0)
                .containsEntry("threshold", 90.0)
                .containsEntry("timestamp", NOW.toString());
    }

    @Test
    @DisplayName("Service health breach is sent as service_restart with the service name")
    void buildsServiceRestartRequest() throws IOException {
        when(executor.execute(any())).thenReturn(RemediationOutcome.success("restarted", List.of(), Duration.ZERO));

        dispatcher.dispatch(new AlertTransition(MetricKind.SERVICE_HEALTH, AlertStatus.OK, AlertStatus.ALERTING,
                TransitionType.RAISED, MetricReading.serviceHealth(false, "host-1", NOW), 1), NO_DEADLINE);

        ArgumentCaptor<RemediationRequest> captor = ArgumentCaptor.forClass(RemediationRequest.class);
        verify(executor).execute(captor.capture());
        assertThat(captor.getValue().issueType()).isEqualTo("service_restart");
        assertThat(captor.getValue().priority()).isEqualTo(8);
        assertThat(captor.getValue().context())
                .containsEntry("serviceName", "remediator")
                .containsEntry("healthy", false);
    }

    @Test
    @DisplayName("Transport failures retry exactly retry-attempts times with growing backoff")
    void retriesTransportFailures() throws IOException {
        when(executor.execute(any())).thenThrow(new ConnectException("Connection refused"));

        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.CPU, 95.0), NO_DEADLINE);

        verify(executor, times(4)).execute(any());
        assertThat(waits).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40));
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo(RemediationOutcome.UNREACHABLE_MESSAGE);
        assertThat(outcome.getError()).isEqualTo("Connection refused");
    }

    @Test
    @DisplayName("Recovers when a retry succeeds")
    void succeedsOnRetry() throws IOException {
        when(executor.execute(any()))
                .thenThrow(new RemediationHttpException(503, "Remediation service returned HTTP 503"))
                .thenReturn(RemediationOutcome.success("ok", List.of(), Duration.ZERO));

        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.DISK, 97.0), NO_DEADLINE);

        assertThat(outcome.isSuccess()).isTrue();
        verify(executor, times(2)).execute(any());
        assertThat(waits).containsExactly(Duration.ofMillis(10));
    }

    @Test
    @DisplayName("Application failures are returned without retry")
    void applicationFailureNotRetried() throws IOException {
        when(executor.execute(any())).thenReturn(RemediationOutcome.failure("Failed to kill process", "EPERM"));

        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.MEMORY, 95.0), NO_DEADLINE);

        verify(executor, times(1)).execute(any());
        assertThat(waits).isEmpty();
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo("Failed to kill process");
    }

    @Test
    @DisplayName("Zero retry attempts means a single attempt")
    void noRetries() throws IOException {
        properties.getRemediation().setRetryAttempts(0);
        dispatcher = newDispatcher();
        when(executor.execute(any())).thenThrow(new IOException("timeout"));

        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.CPU, 95.0), NO_DEADLINE);

        verify(executor, times(1)).execute(any());
        assertThat(outcome.getMessage()).isEqualTo(RemediationOutcome.UNREACHABLE_MESSAGE);
    }

    @Test
    @DisplayName("Backoff doubles and is capped at the timeout")
    void backoffIsCapped() {
        properties.getRemediation().setTimeoutSeconds(5);
        properties.getRemediation().setInitialBackoffMillis(1000);
        RemediationDispatcher capped = newDispatcher();

        assertThat(capped.backoffFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(capped.backoffFor(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(capped.backoffFor(4)).isEqualTo(Duration.ofSeconds(5));
        assertThat(capped.backoffFor(40)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("No attempt starts when the deadline leaves less than one timeout")
    void deadlineTooClose() throws IOException {
        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.CPU, 95.0), NOW.plusSeconds(20));

        verify(executor, never()).execute(any());
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo(RemediationOutcome.OUT_OF_TIME_MESSAGE);
        assertThat(meterRegistry.get("hostwatch.remediation.attempts")
                .tag("result", "out_of_time")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Retries stop once another backoff and attempt would pass the deadline")
    void deadlineCutsRetriesShort() throws IOException {
        when(executor.execute(any())).thenThrow(new ConnectException("Connection refused"));

        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.CPU, 95.0),
                NOW.plusSeconds(30).plusMillis(5));

        verify(executor, times(1)).execute(any());
        assertThat(waits).isEmpty();
        assertThat(outcome.getMessage()).isEqualTo(RemediationOutcome.OUT_OF_TIME_MESSAGE);
        assertThat(outcome.getError()).isEqualTo("Connection refused");
    }

    @Test
    @DisplayName("Retries continue while the deadline has room for them")
    void deadlineWithRoom() throws IOException {
        when(executor.execute(any()))
                .thenThrow(new ConnectException("Connection refused"))
                .thenReturn(RemediationOutcome.success("ok", List.of(), Duration.ZERO));

        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.CPU, 95.0), NOW.plusSeconds(120));

        assertThat(outcome.isSuccess()).isTrue();
        verify(executor, times(2)).execute(any());
    }

    @Test
    @DisplayName("Unexpected executor errors become a failed outcome")
    void unexpectedError() throws IOException {
        when(executor.execute(any())).thenThrow(new IllegalStateException("boom"));

        RemediationOutcome outcome = dispatcher.dispatch(raised(MetricKind.CPU, 95.0), NO_DEADLINE);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getError()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Only RAISED transitions are dispatched")
    void ignoresOtherTransitions() throws IOException {
        AlertTransition cleared = new AlertTransition(MetricKind.CPU, AlertStatus.ALERTING, AlertStatus.COOLDOWN,
                TransitionType.CLEARED, new MetricReading(MetricKind.CPU, 40, "host-1", NOW), 3);

        RemediationOutcome outcome = dispatcher.dispatch(cleared, NO_DEADLINE);

        assertThat(outcome.isSuccess()).isFalse();
        verify(executor, never()).execute(any());
    }

    @Test
    @DisplayName("Attempts are counted by result")
    void countsAttempts() throws IOException {
        when(executor.execute(any())).thenThrow(new IOException("down"));

        dispatcher.dispatch(raised(MetricKind.CPU, 95.0), NO_DEADLINE);

        assertThat(meterRegistry.get("hostwatch.remediation.attempts")
                .tag("issue_type", "high_cpu")
                .tag("result", "transport_error")
                .counter().count()).isEqualTo(4.0);
    }

    private static AlertTransition raised(MetricKind kind, double value) {
        return new AlertTransition(kind, AlertStatus.OK, AlertStatus.ALERTING, TransitionType.RAISED,
                new MetricReading(kind, value, "host-1", NOW), 1);
    }
}
