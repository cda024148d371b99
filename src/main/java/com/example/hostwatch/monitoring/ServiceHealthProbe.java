package com.example.hostwatch.monitoring;

import com.example.hostwatch.config.MonitorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Reachability of an external dependency (by default the remediation service),
 * reported as a boolean-coded {@link MetricKind#SERVICE_HEALTH} reading.
 *
 * An unreachable service is a valid reading (unhealthy), not an acquisition failure.
 */
@Slf4j
@Component
public class ServiceHealthProbe implements MetricSource {

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final HostIdentity host;
    private final Clock clock;
    private final String url;
    private final String serviceName;

    public ServiceHealthProbe(OkHttpClient httpClient, ObjectMapper objectMapper, HostIdentity host,
                              Clock clock, MonitorProperties properties) {
        MonitorProperties.ServiceHealthConfig config = properties.getServiceHealth();
        this.client = httpClient.newBuilder()
                .connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .callTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        this.objectMapper = objectMapper;
        this.host = host;
        this.clock = clock;
        this.url = config.getUrl() == null || config.getUrl().isBlank()
                ? stripTrailingSlash(properties.getRemediation().getUrl()) + "/health"
                : config.getUrl();
        this.serviceName = config.getServiceName();
    }

    @Override
    public MetricKind kind() {
        return MetricKind.SERVICE_HEALTH;
    }

    @Override
    public MetricReading sample() {
        boolean healthy = check();
        return MetricReading.serviceHealth(healthy, host.hostname(), clock.instant());
    }

    private boolean check() {
        long start = System.currentTimeMillis();
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            long duration = System.currentTimeMillis() - start;
            if (!response.isSuccessful()) {
                log.warn("Health check for {} returned HTTP {} ({}ms)", serviceName, response.code(), duration);
                return false;
            }
            ResponseBody body = response.body();
            boolean healthy = isHealthyBody(body != null ? body.string() : "");
            log.debug("Health check for {}: {} ({}ms)", serviceName, healthy ? "healthy" : "unhealthy", duration);
            return healthy;
        } catch (IOException e) {
            log.warn("Health check for {} failed: {}", serviceName, e.getMessage());
            return false;
        }
    }

    /**
     * A 2xx body counts as healthy unless it is JSON carrying a status other than "healthy".
     */
    boolean isHealthyBody(String body) {
        if (body == null || body.isBlank()) {
            return true;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode status = root.get("status");
            return status == null || "healthy".equalsIgnoreCase(status.asText());
        } catch (IOException e) {
            return true;
        }
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
