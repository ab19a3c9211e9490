package com.sentinelx.core.session;

import com.sentinelx.core.baseline.CalibrationState;
import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.FeatureVector;
import com.sentinelx.core.model.RiskReport;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything one {@link SessionMonitor#tick(double)} produced.
 *
 * <p>
 * Scores are present once the baseline is installed. A report is present
 * only when one is due; the caller must then mark it delivered or handled,
 * or leave it to be rebuilt on the next tick.
 * </p>
 *
 * @since 1.0.0
 */
public final class TickResult {

    private final FeatureVector features;
    private final CalibrationState state;
    private final double calibrationProgress;
    private final AnomalyScores scores;
    private final double riskScore;
    private final RiskReport report;

    TickResult(FeatureVector features, CalibrationState state, double calibrationProgress,
            AnomalyScores scores, double riskScore, RiskReport report) {
        this.features = Objects.requireNonNull(features, "features must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.calibrationProgress = calibrationProgress;
        this.scores = scores;
        this.riskScore = riskScore;
        this.report = report;
    }

    public FeatureVector getFeatures() {
        return features;
    }

    public CalibrationState getState() {
        return state;
    }

    /** 0–100. */
    public double getCalibrationProgress() {
        return calibrationProgress;
    }

    public Optional<AnomalyScores> getScores() {
        return Optional.ofNullable(scores);
    }

    /** Smoothed risk; 0 while calibrating. */
    public double getRiskScore() {
        return riskScore;
    }

    public Optional<RiskReport> getReport() {
        return Optional.ofNullable(report);
    }

    @Override
    public String toString() {
        return "TickResult{" +
                "state=" + state +
                ", progress=" + String.format("%.0f%%", calibrationProgress) +
                ", scores=" + scores +
                ", riskScore=" + String.format("%.1f", riskScore) +
                ", reportDue=" + (report != null) +
                '}';
    }
}
