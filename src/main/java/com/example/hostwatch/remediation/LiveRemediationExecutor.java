package com.example.hostwatch.remediation;

import com.example.hostwatch.config.MonitorProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Remediation over HTTP against the remediation service.
 *
 * <ul>
 *   <li>{@code POST {url}{executePath}} with {@code {issueType, context, priority, hostname, timestamp}}</li>
 *   <li>{@code GET {url}/api/remediation/actions} for the supported issue types</li>
 * </ul>
 *
 * Retryable statuses surface as {@link RemediationHttpException}. A JSON body with
 * {@code success:false} is an application failure and is returned, whatever the status.
 */
@Slf4j
public class LiveRemediationExecutor implements RemediationExecutor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String executePath;

    public LiveRemediationExecutor(OkHttpClient httpClient, ObjectMapper objectMapper,
                                   MonitorProperties.RemediationConfig config) {
        int timeout = config.getTimeoutSeconds();
        this.client = httpClient.newBuilder()
                .connectTimeout(Math.min(timeout, 10), TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.SECONDS)
                .writeTimeout(timeout, TimeUnit.SECONDS)
                .callTimeout(timeout, TimeUnit.SECONDS)
                .build();
        this.objectMapper = objectMapper;
        this.baseUrl = config.getUrl().endsWith("/")
                ? config.getUrl().substring(0, config.getUrl().length() - 1)
                : config.getUrl();
        this.executePath = config.getExecutePath().startsWith("/") ? config.getExecutePath() : "/" + config.getExecutePath();
    }

    @Override
    public RemediationOutcome execute(RemediationRequest remediationRequest) throws IOException {
        String body = buildRequestBody(remediationRequest);
        Request request = new Request.Builder()
                .url(baseUrl + executePath)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(body, JSON))
                .build();

        long start = System.currentTimeMillis();
        try (Response response = client.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            Duration elapsed = Duration.ofMillis(System.currentTimeMillis() - start);
            JsonNode json = parseJson(responseBody);

            if (response.isSuccessful()) {
                return parseOutcome(json, responseBody, elapsed);
            }
            if (json != null && json.has("success") && !json.get("success").asBoolean(true)) {
                // the service ran the action and reported failure
                return parseOutcome(json, responseBody, elapsed);
            }
            if (RemediationHttpException.isRetryable(response.code())) {
                throw new RemediationHttpException(response.code(),
                        "Remediation service returned HTTP " + response.code());
            }
            String detail = json != null ? textOrNull(json, "message") : null;
            log.warn("Remediation request for {} rejected with HTTP {}", remediationRequest.issueType(), response.code());
            return RemediationOutcome.failure(
                    describeRejection(response.code(), remediationRequest.issueType()),
                    detail != null ? detail : "HTTP " + response.code());
        }
    }

    @Override
    public List<String> availableActions() throws IOException {
        JsonNode root = getJson("/api/remediation/actions");
        List<String> actions = new ArrayList<>();
        JsonNode array = root != null ? root.get("actions") : null;
        if (array != null && array.isArray()) {
            array.forEach(node -> actions.add(node.asText()));
        }
        return actions;
    }

    @Override
    public String mode() {
        return "live";
    }

    private JsonNode getJson(String path) throws IOException {
        Request request = new Request.Builder().url(baseUrl + path).get().build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new RemediationHttpException(response.code(),
                        "GET " + path + " returned HTTP " + response.code());
            }
            return parseJson(response.body() != null ? response.body().string() : "");
        }
    }

    private String buildRequestBody(RemediationRequest request) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("issueType", request.issueType());
        root.set("context", objectMapper.valueToTree(request.context()));
        root.put("priority", request.priority());
        Object hostname = request.context().get("hostname");
        if (hostname != null) {
            root.put("hostname", hostname.toString());
        }
        Object timestamp = request.context().get("timestamp");
        if (timestamp != null) {
            root.put("timestamp", timestamp.toString());
        }
        return objectMapper.writeValueAsString(root);
    }

    private RemediationOutcome parseOutcome(JsonNode json, String rawBody, Duration elapsed) {
        if (json == null || !json.isObject()) {
            // plain-text 2xx answers count as success
            return RemediationOutcome.success(rawBody.isBlank() ? "Remediation accepted" : rawBody.trim(),
                    List.of(), elapsed);
        }
        boolean success = !json.has("success") || json.get("success").asBoolean(true);
        String message = textOrNull(json, "message");
        List<String> details = new ArrayList<>();
        JsonNode detailsNode = json.get("details");
        if (detailsNode != null && detailsNode.isArray()) {
            detailsNode.forEach(node -> details.add(node.asText()));
        }
        Duration duration = json.has("executionTimeMs")
                ? Duration.ofMillis(json.get("executionTimeMs").asLong())
                : elapsed;

        return RemediationOutcome.builder()
                .success(success)
                .message(message != null ? message : (success ? "Remediation completed" : "Remediation failed"))
                .detailSteps(List.copyOf(details))
                .executionDuration(duration)
                .error(textOrNull(json, "error"))
                .build();
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Remediation service response is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String describeRejection(int status, String issueType) {
        return switch (status) {
            case 400 -> "Invalid remediation request";
            case 404 -> "Unknown issue type: " + issueType;
            default -> "Remediation rejected with HTTP " + status;
        };
    }
}
