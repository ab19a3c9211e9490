package com.sentinelx.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Sliding-window settings for the feature extractor.
 *
 * @since 1.0.0
 */
public class FeatureSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Length of the trailing aggregation window, in seconds. */
    private double windowDurationSeconds = 30.0;

    void validate(List<String> errors) {
        if (!(windowDurationSeconds > 0)) {
            errors.add("features.windowDurationSeconds must be > 0, got: " + windowDurationSeconds);
        }
    }

    public double getWindowDurationSeconds() {
        return windowDurationSeconds;
    }

    public void setWindowDurationSeconds(double windowDurationSeconds) {
        this.windowDurationSeconds = windowDurationSeconds;
    }

    @Override
    public String toString() {
        return "FeatureSettings{windowDurationSeconds=" + windowDurationSeconds + '}';
    }
}
