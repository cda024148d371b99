package com.example.hostwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Hostwatch - host resource monitor with automated remediation.
 *
 * Control loop:
 * - Metric sources → CPU, memory, disk and remediation-service health
 * - Threshold evaluator → high/low water marks with a sticky hysteresis band
 * - Alert state machine → OK / ALERTING / COOLDOWN per metric kind
 * - Remediation dispatcher → remediation service with timeout and bounded retry
 * - Notification dispatcher → Slack with dedupe window and secret masking
 */
@SpringBootApplication
public class HostwatchApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔══════════════════════════════════════════════════╗
            ║         Hostwatch v0.1.0                         ║
            ║         monitor → alert → remediate → notify     ║
            ╚══════════════════════════════════════════════════╝
            """);
        SpringApplication.run(HostwatchApplication.class, args);
    }
}
