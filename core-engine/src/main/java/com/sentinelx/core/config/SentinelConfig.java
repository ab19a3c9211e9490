package com.sentinelx.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the SentinelX YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * features:
 *   windowDurationSeconds: 30.0
 * calibration:
 *   durationSeconds: 180.0
 *   minSamples: 5
 * detection:
 *   idleMultiplier: 1.2
 *   driftThreshold: 0.3
 * risk:
 *   smoothingWindow: 3
 * reporting:
 *   reportIntervalSeconds: 5.0
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private FeatureSettings features = new FeatureSettings();
    private CalibrationSettings calibration = new CalibrationSettings();
    private DetectionSettings detection = new DetectionSettings();
    private RiskSettings risk = new RiskSettings();
    private ReportingSettings reporting = new ReportingSettings();

    /**
     * Configuration with every default applied.
     */
    public static SentinelConfig defaults() {
        return new SentinelConfig();
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception if any setting is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        features.validate(errors);
        calibration.validate(errors);
        detection.validate(errors);
        risk.validate(errors);
        reporting.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "SentinelX configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (null sections fall back to defaults)
    // ---------------------------------------------------------------

    public FeatureSettings getFeatures() {
        return features;
    }

    public void setFeatures(FeatureSettings features) {
        this.features = features != null ? features : new FeatureSettings();
    }

    public CalibrationSettings getCalibration() {
        return calibration;
    }

    public void setCalibration(CalibrationSettings calibration) {
        this.calibration = calibration != null ? calibration : new CalibrationSettings();
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public RiskSettings getRisk() {
        return risk;
    }

    public void setRisk(RiskSettings risk) {
        this.risk = risk != null ? risk : new RiskSettings();
    }

    public ReportingSettings getReporting() {
        return reporting;
    }

    public void setReporting(ReportingSettings reporting) {
        this.reporting = reporting != null ? reporting : new ReportingSettings();
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "features=" + features +
                ", calibration=" + calibration +
                ", detection=" + detection +
                ", risk=" + risk +
                ", reporting=" + reporting +
                '}';
    }
}
