package com.example.hostwatch.monitoring;

public enum Severity {
    NORMAL, WARNING, BREACH
}
