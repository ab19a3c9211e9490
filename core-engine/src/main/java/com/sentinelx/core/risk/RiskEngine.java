package com.sentinelx.core.risk;

import com.sentinelx.core.config.RiskSettings;
import com.sentinelx.core.model.AnomalyScores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Combines anomaly scores into one weighted risk value and smooths it over
 * recent history.
 *
 * <h3>Smoothing</h3>
 * <p>
 * Raw scores go into a history bounded by {@code smoothingWindow}. With a
 * single entry the smoothed value is the raw score; otherwise it is
 * {@code recencyWeight × raw + (1 - recencyWeight) × mean(older entries)}.
 * The newest sample is excluded from the mean, which is not a plain moving
 * average.
 * </p>
 *
 * @since 1.0.0
 */
public class RiskEngine implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RiskEngine.class);

    private final double weightIdleBurst;
    private final double weightFocusInstability;
    private final double weightBehavioralDrift;
    private final int smoothingWindow;
    private final double recencyWeight;

    private final ArrayDeque<Double> history;
    private double currentRisk;
    private double rawRisk;

    public RiskEngine(RiskSettings settings) {
        Objects.requireNonNull(settings, "RiskSettings must not be null");
        if (settings.getSmoothingWindow() < 1) {
            throw new IllegalArgumentException("Smoothing window must be >= 1, got: "
                    + settings.getSmoothingWindow());
        }
        this.weightIdleBurst = settings.getWeightIdleBurst();
        this.weightFocusInstability = settings.getWeightFocusInstability();
        this.weightBehavioralDrift = settings.getWeightBehavioralDrift();
        this.smoothingWindow = settings.getSmoothingWindow();
        this.recencyWeight = settings.getRecencyWeight();
        this.history = new ArrayDeque<>(smoothingWindow);
    }

    /**
     * Weighted raw score, clamped to [0, 100].
     */
    public double weightedScore(AnomalyScores scores) {
        return AnomalyScores.clamp(weightIdleBurst * scores.getIdleBurst()
                + weightFocusInstability * scores.getFocusInstability()
                + weightBehavioralDrift * scores.getBehavioralDrift());
    }

    /**
     * Record {@code scores} and return the smoothed risk.
     *
     * @param scores anomaly scores of the current tick
     * @return smoothed risk in [0, 100]
     */
    public double computeRisk(AnomalyScores scores) {
        Objects.requireNonNull(scores, "AnomalyScores must not be null");
        double raw = weightedScore(scores);

        if (history.size() == smoothingWindow) {
            history.removeFirst();
        }
        history.addLast(raw);

        double smoothed;
        if (history.size() == 1) {
            smoothed = raw;
        } else {
            double older = 0;
            int count = 0;
            for (double value : history) {
                if (count == history.size() - 1) {
                    break;
                }
                older += value;
                count++;
            }
            smoothed = recencyWeight * raw + (1.0 - recencyWeight) * (older / count);
        }

        rawRisk = raw;
        currentRisk = AnomalyScores.clamp(smoothed);
        LOG.debug("Risk raw={} smoothed={} ({})", raw, currentRisk, RiskLevel.of(currentRisk));
        return currentRisk;
    }

    /** Last smoothed risk, 0 before the first computation. */
    public double currentRisk() {
        return currentRisk;
    }

    /** Last unsmoothed risk, 0 before the first computation. */
    public double rawRisk() {
        return rawRisk;
    }

    public RiskLevel currentLevel() {
        return RiskLevel.of(currentRisk);
    }

    /** Clear history and cached values for a new session. */
    public void reset() {
        history.clear();
        currentRisk = 0.0;
        rawRisk = 0.0;
        LOG.info("Risk engine reset");
    }
}
