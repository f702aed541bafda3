package com.platform.autoheal.state;

import java.time.Duration;
import java.time.Instant;

/**
 * Marker written before a remediation runs so that concurrent cycles stay off the workload
 * and an interrupted cycle can be resumed.
 */
public record InFlightClaim(HealingAction action, Instant claimedAt) {

    private static final char SEPARATOR = '@';

    public Duration age(Instant now) {
        return Duration.between(claimedAt, now);
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return age(now).compareTo(ttl) >= 0;
    }

    /**
     * Encodes as {@code ACTION@epochMillis}.
     */
    public String encode() {
        return action.name() + SEPARATOR + claimedAt.toEpochMilli();
    }

    /**
     * Decodes the stored marker; malformed markers yield null.
     */
    public static InFlightClaim decode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        int at = value.indexOf(SEPARATOR);
        if (at < 0) {
            return null;
        }
        HealingAction action = HealingAction.parse(value.substring(0, at));
        if (action == null || action == HealingAction.NONE) {
            return null;
        }
        try {
            return new InFlightClaim(action, Instant.ofEpochMilli(Long.parseLong(value.substring(at + 1))));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
