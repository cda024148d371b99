package com.example.hostwatch.alert;

public enum TransitionType {
    NONE,
    RAISED,
    /** Still breaching and due for a re-notification. */
    REPEATED,
    /** Still breaching, between re-notifications. */
    REPEATED_SUPPRESSED,
    CLEARED;

    public boolean isNotifiable() {
        return this == RAISED || this == REPEATED || this == CLEARED;
    }
}
