package com.example.hostwatch.remediation;

import java.io.IOException;

/**
 * The remediation service answered with a status worth retrying (408, 429, 5xx).
 * Treated like any other transport failure.
 */
public class RemediationHttpException extends IOException {

    private final int statusCode;

    public RemediationHttpException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public static boolean isRetryable(int statusCode) {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
