package com.modelgate.promotion;

/**
 * Absolute minimum quality a candidate must reach regardless of the champion.
 */
public record GateThresholds(double minAccuracy, double minF1) {
    public static GateThresholds none() {
        return new GateThresholds(0.0, 0.0);
    }
}
