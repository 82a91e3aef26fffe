package com.chicu.opsdash.fusion;

/**
 * Расхождение predicted vs realized.
 *  predicted != 0 → |realized - predicted| / |predicted| > threshold
 *  predicted == 0 → realized != 0
 */
public class DiscrepancyRule {

    public static final double DEFAULT_THRESHOLD = 0.25;

    private final double threshold;

    public DiscrepancyRule(double threshold) {
        if (!Double.isFinite(threshold) || threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0: " + threshold);
        }
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isDiscrepant(double predicted, double realized) {
        if (predicted != 0.0) {
            return Math.abs(realized - predicted) / Math.abs(predicted) > threshold;
        }
        return realized != 0.0;
    }
}
