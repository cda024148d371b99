package com.example.hostwatch.remediation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Result of a remediation dispatch, attached to the originating transition for notification.
 */
@Value
@Builder
public class RemediationOutcome {

    public static final String UNREACHABLE_MESSAGE = "remediation service unreachable";
    public static final String OUT_OF_TIME_MESSAGE = "remediation stopped: tick time budget exhausted";

    boolean success;
    String message;
    @Builder.Default
    List<String> detailSteps = List.of();
    @Builder.Default
    Duration executionDuration = Duration.ZERO;
    String error;

    public static RemediationOutcome success(String message, List<String> detailSteps, Duration executionDuration) {
        return RemediationOutcome.builder()
                .success(true)
                .message(message)
                .detailSteps(detailSteps != null ? List.copyOf(detailSteps) : List.of())
                .executionDuration(executionDuration)
                .build();
    }

    public static RemediationOutcome failure(String message, String error) {
        return RemediationOutcome.builder()
                .success(false)
                .message(message)
                .error(error)
                .build();
    }

    public static RemediationOutcome unreachable(String lastError) {
        return failure(UNREACHABLE_MESSAGE, lastError);
    }

    public static RemediationOutcome outOfTime(String lastError) {
        return failure(OUT_OF_TIME_MESSAGE, lastError);
    }
}
