package com.sentinelx.core.validation;

import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.RiskReport;

import java.util.Objects;

/**
 * Bounds and consistency checks a collector applies to incoming risk
 * reports.
 *
 * <p>
 * Checks run in this order and the first failure wins:
 * </p>
 * <ol>
 * <li>risk score within [0, 100]</li>
 * <li>each rule score within [0, 100]</li>
 * <li>a zero risk score carries zero rule scores</li>
 * <li>non-blank session id</li>
 * <li>positive timestamp</li>
 * </ol>
 * <p>
 * NaN fails every range check. Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class RiskReportValidator {

    public static final double MIN_SCORE = AnomalyScores.MIN_SCORE;
    public static final double MAX_SCORE = AnomalyScores.MAX_SCORE;

    /**
     * @param report report to check; must not be {@code null}
     * @return validation outcome; never throws for malformed content
     */
    public ValidationResult validate(RiskReport report) {
        Objects.requireNonNull(report, "RiskReport must not be null");

        double risk = report.getRiskScore();
        if (!inRange(risk)) {
            return ValidationResult.invalid(String.format(
                    "Risk score %s out of range [%.1f, %.1f]", risk, MIN_SCORE, MAX_SCORE));
        }

        AnomalyScores scores = report.getAnomalyScores();
        if (scores == null) {
            return ValidationResult.invalid("Anomaly scores are missing");
        }
        String outOfRange = firstOutOfRange(scores);
        if (outOfRange != null) {
            return ValidationResult.invalid(outOfRange);
        }

        if (risk == 0.0 && (scores.getIdleBurst() != 0.0
                || scores.getFocusInstability() != 0.0
                || scores.getBehavioralDrift() != 0.0)) {
            return ValidationResult.invalid("Risk score is zero but anomaly scores are non-zero");
        }

        String sessionId = report.getSessionId();
        if (sessionId == null || sessionId.isBlank()) {
            return ValidationResult.invalid("Session ID is empty or missing");
        }

        if (!(report.getTimestamp() > 0)) {
            return ValidationResult.invalid("Invalid timestamp: " + report.getTimestamp());
        }

        return ValidationResult.valid();
    }

    private static String firstOutOfRange(AnomalyScores scores) {
        if (!inRange(scores.getIdleBurst())) {
            return "Anomaly score idle_burst: " + scores.getIdleBurst() + " out of range";
        }
        if (!inRange(scores.getFocusInstability())) {
            return "Anomaly score focus_instability: " + scores.getFocusInstability() + " out of range";
        }
        if (!inRange(scores.getBehavioralDrift())) {
            return "Anomaly score behavioral_drift: " + scores.getBehavioralDrift() + " out of range";
        }
        return null;
    }

    private static boolean inRange(double value) {
        return value >= MIN_SCORE && value <= MAX_SCORE;
    }
}
