package com.sentinelx.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Weights and smoothing parameters of the risk engine.
 *
 * @since 1.0.0
 */
public class RiskSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double weightIdleBurst = 0.4;
    private double weightFocusInstability = 0.35;
    private double weightBehavioralDrift = 0.25;

    /** Capacity of the raw-score history used for smoothing. */
    private int smoothingWindow = 3;

    /** Weight of the newest raw score against the mean of the older ones. */
    private double recencyWeight = 0.6;

    void validate(List<String> errors) {
        if (weightIdleBurst < 0 || weightFocusInstability < 0 || weightBehavioralDrift < 0) {
            errors.add("risk weights must be >= 0, got: " + weightIdleBurst + ", "
                    + weightFocusInstability + ", " + weightBehavioralDrift);
        }
        if (smoothingWindow < 1) {
            errors.add("risk.smoothingWindow must be >= 1, got: " + smoothingWindow);
        }
        if (!(recencyWeight >= 0 && recencyWeight <= 1)) {
            errors.add("risk.recencyWeight must be in [0, 1], got: " + recencyWeight);
        }
    }

    public double getWeightIdleBurst() {
        return weightIdleBurst;
    }

    public void setWeightIdleBurst(double weightIdleBurst) {
        this.weightIdleBurst = weightIdleBurst;
    }

    public double getWeightFocusInstability() {
        return weightFocusInstability;
    }

    public void setWeightFocusInstability(double weightFocusInstability) {
        this.weightFocusInstability = weightFocusInstability;
    }

    public double getWeightBehavioralDrift() {
        return weightBehavioralDrift;
    }

    public void setWeightBehavioralDrift(double weightBehavioralDrift) {
        this.weightBehavioralDrift = weightBehavioralDrift;
    }

    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public void setSmoothingWindow(int smoothingWindow) {
        this.smoothingWindow = smoothingWindow;
    }

    public double getRecencyWeight() {
        return recencyWeight;
    }

    public void setRecencyWeight(double recencyWeight) {
        this.recencyWeight = recencyWeight;
    }

    @Override
    public String toString() {
        return "RiskSettings{" +
                "weights=[" + weightIdleBurst + ", " + weightFocusInstability + ", " + weightBehavioralDrift + ']' +
                ", smoothingWindow=" + smoothingWindow +
                ", recencyWeight=" + recencyWeight +
                '}';
    }
}
