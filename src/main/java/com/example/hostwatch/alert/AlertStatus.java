package com.example.hostwatch.alert;

/**
 * Per-kind alert status. Moves only along OK → ALERTING → COOLDOWN → OK.
 */
public enum AlertStatus {
    OK, ALERTING, COOLDOWN
}
