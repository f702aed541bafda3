package com.platform.autoheal.model;

/**
 * Predicted failure probability plus the derived label.
 *
 * @param probability failure probability, always within [0, 1]
 * @param riskLabel   HIGH iff probability is at or above the threshold
 * @param degraded    true when the score came from the fallback heuristic
 * @param threshold   threshold the label was derived with
 */
public record RiskAssessment(
    double probability,
    RiskLabel riskLabel,
    boolean degraded,
    double threshold
) {

    public static RiskAssessment of(double probability, double threshold, boolean degraded) {
        double clamped = clamp(probability);
        return new RiskAssessment(clamped, RiskLabel.classify(clamped, threshold), degraded, threshold);
    }

    public boolean isHigh() {
        return riskLabel == RiskLabel.HIGH;
    }

    public String summary() {
        return String.format("%s (p=%.3f, threshold=%.2f%s)",
            riskLabel, probability, threshold, degraded ? ", degraded" : "");
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
