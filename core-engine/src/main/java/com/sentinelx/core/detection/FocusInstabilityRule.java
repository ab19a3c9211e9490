package com.sentinelx.core.detection;

import com.sentinelx.core.config.DetectionSettings;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Focus-instability rule: window or tab switching well above the baseline
 * rate.
 *
 * <p>
 * The live rate is {@code focusLossCount × 60 / windowLength} (0 for an empty
 * window). Fires when it exceeds {@code focusMultiplier} × a positive baseline
 * rate; the score is {@code (rate / baselineRate - focusMultiplier) ×
 * focusGain}, capped at {@code focusScale}.
 * </p>
 *
 * @since 1.0.0
 */
public class FocusInstabilityRule implements ShiftRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FocusInstabilityRule.class);

    private final double focusMultiplier;
    private final double gain;
    private final double scale;

    public FocusInstabilityRule(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.focusMultiplier = settings.getFocusMultiplier();
        this.gain = settings.getFocusGain();
        this.scale = settings.getFocusScale();
    }

    /**
     * Focus losses per minute over the vector's window.
     */
    static double focusRate(FeatureVector features) {
        double length = features.windowLength();
        return length > 0 ? features.getFocusLossCount() * 60.0 / length : 0.0;
    }

    @Override
    public double score(FeatureVector features, BaselineProfile baseline) {
        double baselineRate = baseline.getAvgFocusRate();
        double rate = focusRate(features);
        if (baselineRate <= 0 || rate <= baselineRate * focusMultiplier) {
            return 0.0;
        }

        double score = ShiftRule.cap((rate / baselineRate - focusMultiplier) * gain, scale);
        LOG.debug("Focus instability: rate={}/min, baseline={}/min, score={}", rate, baselineRate, score);
        return score;
    }

    @Override
    public String getRuleName() {
        return "focus_instability";
    }

    @Override
    public String criticalMessage() {
        return "Excessive window/tab switching";
    }

    @Override
    public String warningMessage() {
        return "Frequent focus changes";
    }
}
