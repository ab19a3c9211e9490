package com.sentinelx.core.detection;

import com.sentinelx.core.config.DetectionSettings;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Idle-to-burst rule: long idle periods combined with typing well above the
 * baseline speed, the signature of pasted or dictated input.
 *
 * <p>
 * Fires when idle exceeds {@code idleMultiplier} × baseline idle and typing
 * exceeds {@code typingMultiplier} × baseline typing. The score is
 * {@code (typing / baselineTyping - typingMultiplier) × idleBurstGain},
 * capped at {@code idleScale}.
 * </p>
 *
 * @since 1.0.0
 */
public class IdleBurstRule implements ShiftRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(IdleBurstRule.class);

    private final double idleMultiplier;
    private final double typingMultiplier;
    private final double gain;
    private final double scale;

    public IdleBurstRule(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.idleMultiplier = settings.getIdleMultiplier();
        this.typingMultiplier = settings.getTypingMultiplier();
        this.gain = settings.getIdleBurstGain();
        this.scale = settings.getIdleScale();
    }

    @Override
    public double score(FeatureVector features, BaselineProfile baseline) {
        if (baseline.getAvgTypingSpeed() <= 0) {
            return 0.0;
        }
        if (features.getAvgIdleDuration() <= baseline.getAvgIdleDuration() * idleMultiplier) {
            return 0.0;
        }
        if (features.getAvgTypingSpeed() <= baseline.getAvgTypingSpeed() * typingMultiplier) {
            return 0.0;
        }

        double ratio = features.getAvgTypingSpeed() / baseline.getAvgTypingSpeed();
        double score = ShiftRule.cap((ratio - typingMultiplier) * gain, scale);
        LOG.debug("Idle burst: idle={}s, typing ratio={}, score={}",
                features.getAvgIdleDuration(), ratio, score);
        return score;
    }

    @Override
    public String getRuleName() {
        return "idle_burst";
    }

    @Override
    public String criticalMessage() {
        return "Extreme typing burst after idle, possible paste";
    }

    @Override
    public String warningMessage() {
        return "Unusual typing pattern after idle";
    }
}
