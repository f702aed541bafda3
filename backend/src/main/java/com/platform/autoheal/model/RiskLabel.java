package com.platform.autoheal.model;

/**
 * Binary risk label derived from a failure probability and the configured threshold.
 */
public enum RiskLabel {
    HIGH,
    LOW;

    /**
     * HIGH iff {@code probability >= threshold}.
     */
    public static RiskLabel classify(double probability, double threshold) {
        return probability >= threshold ? HIGH : LOW;
    }
}
