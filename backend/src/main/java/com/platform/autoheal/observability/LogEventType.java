package com.platform.autoheal.observability;

/**
 * Event types carried by structured log lines.
 */
public enum LogEventType {
    HEALING_ESCALATED,
    HEALING_ACTION_FAILED,
    HEALING_RECOVERED,
    HEALING_EXHAUSTED,
    HEALING_RESET,
    HEALING_CONFLICT,
    HEALING_PERMISSION_DENIED,
    HEALING_CLAIM_ABANDONED,
    HEALING_RECHECK
}
