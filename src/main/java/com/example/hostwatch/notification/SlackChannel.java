package com.example.hostwatch.notification;

import com.example.hostwatch.config.InvalidConfigurationException;
import com.example.hostwatch.config.MonitorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Slack channel.
 *
 * With a bot token, posts through {@code chat.postMessage} (Bearer auth, {@code ok} flag in the
 * response body). Without one, posts to the incoming webhook URL.
 * Error details returned to the caller never contain the token or webhook URL.
 */
@Slf4j
public class SlackChannel implements NotificationChannel {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final MonitorProperties.NotificationConfig.SlackConfig config;

    public SlackChannel(OkHttpClient httpClient, ObjectMapper objectMapper,
                        MonitorProperties.NotificationConfig.SlackConfig config) {
        validate(config);
        this.client = httpClient.newBuilder()
                .connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .callTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public DeliveryResult post(NotificationMessage message) {
        return usesBotToken() ? postWithToken(message) : postToWebhook(message);
    }

    boolean usesBotToken() {
        return config.getToken() != null && !config.getToken().isBlank();
    }

    private DeliveryResult postWithToken(NotificationMessage message) {
        try {
            Request request = new Request.Builder()
                    .url(trimSlash(config.getApiUrl()) + "/chat.postMessage")
                    .addHeader("Authorization", "Bearer " + config.getToken())
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload(message)), JSON))
                    .build();

            try (Response response = client.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    return DeliveryResult.failed(message.channel(), "Slack API HTTP " + response.code());
                }
                JsonNode body = objectMapper.readTree(response.body() != null ? response.body().string() : "{}");
                if (body.path("ok").asBoolean(false)) {
                    log.debug("Slack message posted to {}", message.channel());
                    return DeliveryResult.delivered(message.channel());
                }
                String error = body.path("error").asText("unknown");
                return DeliveryResult.failed(message.channel(), "Slack API error: " + error);
            }
        } catch (IOException e) {
            return DeliveryResult.failed(message.channel(), "Slack request failed: " + e.getClass().getSimpleName());
        }
    }

    private DeliveryResult postToWebhook(NotificationMessage message) {
        try {
            Request request = new Request.Builder()
                    .url(config.getWebhookUrl())
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload(message)), JSON))
                    .build();

            try (Response response = client.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.debug("Slack webhook message posted to {}", message.channel());
                    return DeliveryResult.delivered(message.channel());
                }
                return DeliveryResult.failed(message.channel(), "Slack webhook HTTP " + response.code());
            }
        } catch (IOException e) {
            return DeliveryResult.failed(message.channel(), "Slack webhook failed: " + e.getClass().getSimpleName());
        }
    }

    private Map<String, Object> payload(NotificationMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", message.channel());
        payload.put("text", message.severity().emoji() + " " + message.text());
        payload.put("username", config.getUsername());
        payload.put("icon_emoji", config.getIconEmoji());
        return payload;
    }

    private static void validate(MonitorProperties.NotificationConfig.SlackConfig config) {
        boolean hasToken = config.getToken() != null && !config.getToken().isBlank();
        boolean hasWebhook = config.getWebhookUrl() != null && !config.getWebhookUrl().isBlank();
        if (!hasToken && !hasWebhook) {
            throw new InvalidConfigurationException(
                    "Slack is enabled but neither a bot token nor a webhook URL is configured");
        }
        if (hasToken && !config.getToken().startsWith("xoxb-")) {
            throw new InvalidConfigurationException("Invalid Slack token format: expected a bot token starting with 'xoxb-'");
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
