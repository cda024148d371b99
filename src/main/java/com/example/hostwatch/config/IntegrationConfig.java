package com.example.hostwatch.config;

import com.example.hostwatch.notification.LogOnlyChannel;
import com.example.hostwatch.notification.NotificationChannel;
import com.example.hostwatch.notification.SlackChannel;
import com.example.hostwatch.remediation.LiveRemediationExecutor;
import com.example.hostwatch.remediation.RemediationExecutor;
import com.example.hostwatch.remediation.SimulatedRemediationExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the external collaborators from configuration: remediation executor
 * (live or simulated) and notification channel (Slack or log only).
 */
@Slf4j
@Configuration
public class IntegrationConfig {

    @Bean
    public RemediationExecutor remediationExecutor(MonitorProperties properties, OkHttpClient okHttpClient,
                                                   ObjectMapper objectMapper) {
        MonitorProperties.RemediationConfig config = properties.getRemediation();
        RemediationExecutor executor = switch (config.getMode()) {
            case LIVE -> new LiveRemediationExecutor(okHttpClient, objectMapper, config);
            case SIMULATED -> new SimulatedRemediationExecutor();
        };
        log.info("Remediation mode: {} ({})", executor.mode(),
                config.getMode() == MonitorProperties.RemediationConfig.Mode.LIVE ? config.getUrl() : "in-process");
        return executor;
    }

    @Bean
    public NotificationChannel notificationChannel(MonitorProperties properties, OkHttpClient okHttpClient,
                                                   ObjectMapper objectMapper) {
        MonitorProperties.NotificationConfig.SlackConfig slack = properties.getNotifications().getSlack();
        if (slack.isEnabled()) {
            return new SlackChannel(okHttpClient, objectMapper, slack);
        }
        log.info("Slack notifications disabled; messages are written to the log only");
        return new LogOnlyChannel();
    }
}
