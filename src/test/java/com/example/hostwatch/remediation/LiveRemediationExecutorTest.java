package com.example.hostwatch.remediation;

import com.example.hostwatch.config.MonitorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiveRemediationExecutorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private LiveRemediationExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        MonitorProperties.RemediationConfig config = new MonitorProperties.RemediationConfig();
        config.setUrl(server.url("/").toString());
        config.setTimeoutSeconds(5);
        executor = new LiveRemediationExecutor(new OkHttpClient(), objectMapper, config);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Posts the request and parses a successful result")
    void executesSuccessfully() throws Exception {
        server.enqueue(json(200, """
                {"success": true, "message": "High CPU remediation completed",
                 "details": ["Killed process 123", "Cleared /tmp"], "executionTimeMs": 1500}
                """));

        RemediationOutcome outcome = executor.execute(request());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getMessage()).isEqualTo("High CPU remediation completed");
        assertThat(outcome.getDetailSteps()).containsExactly("Killed process 123", "Cleared /tmp");
        assertThat(outcome.getExecutionDuration()).isEqualTo(Duration.ofMillis(1500));

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/api/remediation/execute");
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertThat(body.get("issueType").asText()).isEqualTo("high_cpu");
        assertThat(body.get("priority").asInt()).isEqualTo(7);
        assertThat(body.get("hostname").asText()).isEqualTo("host-1");
        assertThat(body.get("context").get("cpu_percent").asDouble()).isEqualTo(95.5);
    }

    @Test
    @DisplayName("success:false is an application failure")
    void applicationFailure() throws Exception {
        server.enqueue(json(200, """
                {"success": false, "message": "Remediation failed", "error": "permission denied"}
                """));

        RemediationOutcome outcome = executor.execute(request());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo("Remediation failed");
        assertThat(outcome.getError()).isEqualTo("permission denied");
    }

    @Test
    @DisplayName("A 500 carrying success:false is returned, not thrown")
    void serverErrorWithFailureBody() throws Exception {
        server.enqueue(json(500, """
                {"success": false, "message": "Remediation failed", "error": "disk busy"}
                """));

        RemediationOutcome outcome = executor.execute(request());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getError()).isEqualTo("disk busy");
    }

    @Test
    @DisplayName("Retryable statuses surface as transport failures")
    void retryableStatusThrows() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

        assertThatThrownBy(() -> executor.execute(request()))
                .isInstanceOf(RemediationHttpException.class)
                .satisfies(e -> assertThat(((RemediationHttpException) e).getStatusCode()).isEqualTo(503));
    }

    @Test
    @DisplayName("Unknown issue type (404) is a non-retried failure")
    void unknownIssueType() throws Exception {
        server.enqueue(json(404, """
                {"message": "Unknown issue type"}
                """));

        RemediationOutcome outcome = executor.execute(request());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo("Unknown issue type: high_cpu");
    }

    @Test
    @DisplayName("Plain-text 2xx answers count as success")
    void plainTextSuccess() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("OK"));

        RemediationOutcome outcome = executor.execute(request());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getMessage()).isEqualTo("OK");
    }

    @Test
    @DisplayName("Lists the available actions")
    void availableActions() throws Exception {
        server.enqueue(json(200, """
                {"actions": ["high_cpu", "high_memory", "high_disk", "service_restart"]}
                """));

        assertThat(executor.availableActions()).containsExactly("high_cpu", "high_memory", "high_disk", "service_restart");
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/remediation/actions");
    }

    @Test
    @DisplayName("A failing action listing is an IOException")
    void availableActionsFailure() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> executor.availableActions()).isInstanceOf(RemediationHttpException.class);
    }

    @Test
    @DisplayName("Connection refused is an IOException")
    void connectionRefused() throws IOException {
        server.shutdown();

        assertThatThrownBy(() -> executor.execute(request())).isInstanceOf(IOException.class);
    }

    private static RemediationRequest request() {
        return new RemediationRequest("high_cpu", Map.of(
                "hostname", "host-1",
                "timestamp", "2024-01-01T12:00:00Z",
                "cpu_percent", 95.5), 7);
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
