package com.sentinelx.core.detection;

import com.sentinelx.core.config.DetectionSettings;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Behavioral-drift rule: typing speed deviating from the baseline in either
 * direction.
 *
 * <p>
 * With {@code deviation = |typing - baselineTyping| / baselineTyping}, fires
 * above {@code driftThreshold}; the score is
 * {@code (deviation - driftThreshold) × driftGain}, capped at
 * {@code driftScale}.
 * </p>
 *
 * @since 1.0.0
 */
public class BehavioralDriftRule implements ShiftRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BehavioralDriftRule.class);

    private final double threshold;
    private final double gain;
    private final double scale;

    public BehavioralDriftRule(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.threshold = settings.getDriftThreshold();
        this.gain = settings.getDriftGain();
        this.scale = settings.getDriftScale();
    }

    @Override
    public double score(FeatureVector features, BaselineProfile baseline) {
        double reference = baseline.getAvgTypingSpeed();
        if (reference <= 0) {
            return 0.0;
        }
        double deviation = Math.abs(features.getAvgTypingSpeed() - reference) / reference;
        if (deviation <= threshold) {
            return 0.0;
        }

        double score = ShiftRule.cap((deviation - threshold) * gain, scale);
        LOG.debug("Behavioral drift: baseline={}, current={}, deviation={}, score={}",
                reference, features.getAvgTypingSpeed(), deviation, score);
        return score;
    }

    @Override
    public String getRuleName() {
        return "behavioral_drift";
    }

    @Override
    public String criticalMessage() {
        return "Typing speed drastically changed";
    }

    @Override
    public String warningMessage() {
        return "Typing pattern shifted";
    }
}
