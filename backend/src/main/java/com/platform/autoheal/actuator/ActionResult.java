package com.platform.autoheal.actuator;

/**
 * Outcome of one remediation call. Failures are reported by exception, so a result
 * always describes a call the platform accepted.
 */
public record ActionResult(String action, boolean success, String message, long durationMs) {

    public static ActionResult ok(String action, String message, long startNanos) {
        return new ActionResult(action, true, message, (System.nanoTime() - startNanos) / 1_000_000);
    }
}
