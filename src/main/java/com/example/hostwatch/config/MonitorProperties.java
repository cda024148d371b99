package com.example.hostwatch.config;

import com.example.hostwatch.monitoring.MetricKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for Hostwatch.
 * Maps to the 'hostwatch' prefix in application.yml.
 * Read once at startup; components treat it as read-only afterwards.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hostwatch")
public class MonitorProperties {

    private MonitoringConfig monitoring = new MonitoringConfig();
    private ServiceHealthConfig serviceHealth = new ServiceHealthConfig();
    private RemediationConfig remediation = new RemediationConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();

    @Data
    public static class MonitoringConfig {
        private double cpuThreshold = 80;
        private double memoryThreshold = 85;
        private double diskThreshold = 90;
        /** Low-water mark = threshold - margin, unless a recovery threshold is set. */
        private double hysteresisMargin = 10;
        private Double cpuRecoveryThreshold;
        private Double memoryRecoveryThreshold;
        private Double diskRecoveryThreshold;
        private int checkIntervalSeconds = 60;
        private int cooldownSeconds = 60;
        /** Re-notify every N consecutive breaches while alerting; 0 disables. */
        private int renotifyInterval = 10;
        private List<MetricKind> kinds = new ArrayList<>(List.of(MetricKind.CPU, MetricKind.MEMORY, MetricKind.DISK));
        private String diskPath = "/";
    }

    @Data
    public static class ServiceHealthConfig {
        private boolean enabled = true;
        private int checkIntervalSeconds = 300;
        /** Blank means the remediation service's /health endpoint. */
        private String url = "";
        private String serviceName = "remediator";
        private int timeoutSeconds = 10;
    }

    @Data
    public static class RemediationConfig {
        private Mode mode = Mode.LIVE;
        private String url = "http://localhost:5001";
        private String executePath = "/api/remediation/execute";
        private int timeoutSeconds = 30;
        private int retryAttempts = 3;
        private long initialBackoffMillis = 1000;
        private List<String> enabledIssueTypes = new ArrayList<>(
                List.of("high_cpu", "high_memory", "high_disk", "service_restart"));

        public enum Mode {
            LIVE, SIMULATED
        }
    }

    @Data
    public static class NotificationConfig {
        private int dedupeWindowSeconds = 60;
        private String channel = "#alerts";
        private boolean lifecycleMessages = true;
        private SlackConfig slack = new SlackConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            /** Bot token (xoxb-...); when set, chat.postMessage is used instead of the webhook. */
            private String token = "";
            private String webhookUrl = "";
            private String apiUrl = "https://slack.com/api";
            private String username = "Hostwatch";
            private String iconEmoji = ":robot_face:";
            private int timeoutSeconds = 10;
        }
    }

    @Data
    public static class SchedulerConfig {
        private boolean autoStart = true;
        private int shutdownTimeoutSeconds = 60;
    }
}
