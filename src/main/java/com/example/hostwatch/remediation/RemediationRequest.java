package com.example.hostwatch.remediation;

import java.util.Map;
import java.util.Objects;

/**
 * One remediation call. Priority ranges from 1 (lowest) to 10.
 */
public record RemediationRequest(String issueType, Map<String, Object> context, int priority) {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    public RemediationRequest {
        Objects.requireNonNull(issueType, "issueType must not be null");
        context = context == null ? Map.of() : Map.copyOf(context);
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be between 1 and 10, got " + priority);
        }
    }
}
