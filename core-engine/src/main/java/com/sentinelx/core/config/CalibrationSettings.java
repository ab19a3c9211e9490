package com.sentinelx.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Baseline calibration settings.
 *
 * <p>
 * Calibration converges early once {@code minSamples} vectors were observed,
 * {@code convergenceFraction} of {@code durationSeconds} has elapsed and at
 * least one vector shows typing activity (typing speed above
 * {@code typingActivityThreshold} or more than
 * {@code keyPressActivityThreshold} presses). Otherwise it is forced when the
 * duration runs out.
 * </p>
 *
 * @since 1.0.0
 */
public class CalibrationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double durationSeconds = 180.0;
    private int minSamples = 5;
    private double convergenceFraction = 0.5;
    private double typingActivityThreshold = 5.0;
    private int keyPressActivityThreshold = 2;

    /** Sample count at which typing-free history is accepted as a baseline. */
    private int fallbackSampleCount = 10;

    void validate(List<String> errors) {
        if (!(durationSeconds > 0)) {
            errors.add("calibration.durationSeconds must be > 0, got: " + durationSeconds);
        }
        if (minSamples < 1) {
            errors.add("calibration.minSamples must be >= 1, got: " + minSamples);
        }
        if (!(convergenceFraction >= 0 && convergenceFraction <= 1)) {
            errors.add("calibration.convergenceFraction must be in [0, 1], got: " + convergenceFraction);
        }
        if (typingActivityThreshold < 0) {
            errors.add("calibration.typingActivityThreshold must be >= 0, got: " + typingActivityThreshold);
        }
        if (keyPressActivityThreshold < 0) {
            errors.add("calibration.keyPressActivityThreshold must be >= 0, got: " + keyPressActivityThreshold);
        }
        if (fallbackSampleCount < 1) {
            errors.add("calibration.fallbackSampleCount must be >= 1, got: " + fallbackSampleCount);
        }
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getConvergenceFraction() {
        return convergenceFraction;
    }

    public void setConvergenceFraction(double convergenceFraction) {
        this.convergenceFraction = convergenceFraction;
    }

    public double getTypingActivityThreshold() {
        return typingActivityThreshold;
    }

    public void setTypingActivityThreshold(double typingActivityThreshold) {
        this.typingActivityThreshold = typingActivityThreshold;
    }

    public int getKeyPressActivityThreshold() {
        return keyPressActivityThreshold;
    }

    public void setKeyPressActivityThreshold(int keyPressActivityThreshold) {
        this.keyPressActivityThreshold = keyPressActivityThreshold;
    }

    public int getFallbackSampleCount() {
        return fallbackSampleCount;
    }

    public void setFallbackSampleCount(int fallbackSampleCount) {
        this.fallbackSampleCount = fallbackSampleCount;
    }

    @Override
    public String toString() {
        return "CalibrationSettings{" +
                "durationSeconds=" + durationSeconds +
                ", minSamples=" + minSamples +
                ", convergenceFraction=" + convergenceFraction +
                ", typingActivityThreshold=" + typingActivityThreshold +
                ", keyPressActivityThreshold=" + keyPressActivityThreshold +
                ", fallbackSampleCount=" + fallbackSampleCount +
                '}';
    }
}
