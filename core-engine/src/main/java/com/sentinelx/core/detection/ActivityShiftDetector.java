package com.sentinelx.core.detection;

import com.sentinelx.core.config.DetectionSettings;
import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares live feature vectors against a frozen baseline with three
 * independent {@link ShiftRule}s.
 *
 * <p>
 * Without a baseline every score is zero. With one, the idle-burst,
 * focus-instability and behavioral-drift rules each score the vector and
 * {@code overall} is their maximum. The last {@value #HISTORY_SIZE} overall
 * scores are kept for reporting.
 * </p>
 *
 * @since 1.0.0
 */
public class ActivityShiftDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ActivityShiftDetector.class);

    static final int HISTORY_SIZE = 10;

    static final String NORMAL = "Normal behavior detected";

    private final ShiftRule idleBurst;
    private final ShiftRule focusInstability;
    private final ShiftRule behavioralDrift;
    private final double warningThreshold;
    private final double criticalThreshold;

    private final ArrayDeque<Double> recentOverall = new ArrayDeque<>(HISTORY_SIZE);
    private BaselineProfile baseline;

    public ActivityShiftDetector(DetectionSettings settings) {
        this(settings, new IdleBurstRule(settings), new FocusInstabilityRule(settings),
                new BehavioralDriftRule(settings));
    }

    ActivityShiftDetector(DetectionSettings settings, ShiftRule idleBurst, ShiftRule focusInstability,
            ShiftRule behavioralDrift) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.idleBurst = Objects.requireNonNull(idleBurst, "idleBurst rule must not be null");
        this.focusInstability = Objects.requireNonNull(focusInstability, "focusInstability rule must not be null");
        this.behavioralDrift = Objects.requireNonNull(behavioralDrift, "behavioralDrift rule must not be null");
        this.warningThreshold = settings.getWarningThreshold();
        this.criticalThreshold = settings.getCriticalThreshold();
    }

    /**
     * Install the frozen baseline. A session has exactly one.
     *
     * @throws NullPointerException  if {@code profile} is {@code null}
     * @throws IllegalStateException if a baseline is already installed
     */
    public void setBaseline(BaselineProfile profile) {
        Objects.requireNonNull(profile, "BaselineProfile must not be null");
        if (baseline != null) {
            throw new IllegalStateException("Baseline already set: " + baseline);
        }
        baseline = profile;
        LOG.info("Baseline set: {}", profile);
    }

    public Optional<BaselineProfile> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    /**
     * Score {@code features} against the baseline.
     *
     * @return per-rule and overall scores; {@link AnomalyScores#NONE} without
     *         a baseline
     */
    public AnomalyScores computeScores(FeatureVector features) {
        Objects.requireNonNull(features, "FeatureVector must not be null");
        if (baseline == null) {
            LOG.debug("No baseline available, returning zero scores");
            return AnomalyScores.NONE;
        }

        AnomalyScores scores = AnomalyScores.of(
                idleBurst.score(features, baseline),
                focusInstability.score(features, baseline),
                behavioralDrift.score(features, baseline));

        if (recentOverall.size() == HISTORY_SIZE) {
            recentOverall.removeFirst();
        }
        recentOverall.addLast(scores.getOverall());

        if (scores.getOverall() > criticalThreshold) {
            LOG.warn("High anomaly detected: {}", scores);
        } else if (scores.getOverall() > warningThreshold) {
            LOG.info("Elevated anomaly: {}", scores);
        }
        return scores;
    }

    /**
     * Human-readable explanation of {@code scores}, one entry per rule above
     * the warning band, joined with {@code " | "}.
     */
    public String explain(AnomalyScores scores) {
        Objects.requireNonNull(scores, "AnomalyScores must not be null");
        List<String> parts = new ArrayList<>(3);
        describe(parts, idleBurst, scores.getIdleBurst());
        describe(parts, focusInstability, scores.getFocusInstability());
        describe(parts, behavioralDrift, scores.getBehavioralDrift());
        return parts.isEmpty() ? NORMAL : String.join(" | ", parts);
    }

    private void describe(List<String> parts, ShiftRule rule, double score) {
        if (score > criticalThreshold) {
            parts.add("CRITICAL: " + rule.criticalMessage());
        } else if (score > warningThreshold) {
            parts.add("WARNING: " + rule.warningMessage());
        }
    }

    /**
     * Overall scores of the most recent computations, oldest first.
     */
    public List<Double> recentOverallScores() {
        return List.copyOf(recentOverall);
    }

    /** Clear the score history; the baseline is kept. */
    public void reset() {
        recentOverall.clear();
        LOG.info("Detector history reset");
    }
}
