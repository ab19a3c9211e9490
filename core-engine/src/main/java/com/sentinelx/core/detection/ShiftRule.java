package com.sentinelx.core.detection;

import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.FeatureVector;

import java.io.Serializable;

/**
 * Contract for a single deviation rule of the
 * {@link ActivityShiftDetector}.
 * <p>
 * Rules are stateless: the score depends only on the live feature vector and
 * the frozen baseline. They must be {@link Serializable} because the detector
 * lives in checkpointed keyed state.
 * </p>
 */
public interface ShiftRule extends Serializable {

    /**
     * Score the deviation of {@code features} from {@code baseline}.
     *
     * @return a score in {@code [0, scale]}; 0 when the rule does not fire or
     *         the input is degenerate
     */
    double score(FeatureVector features, BaselineProfile baseline);

    /**
     * @return short rule name used in logs
     */
    String getRuleName();

    /** Explanation for a score above the critical band. */
    String criticalMessage();

    /** Explanation for a score above the warning band. */
    String warningMessage();

    /**
     * Clamp {@code value} to {@code [0, max]}; NaN maps to 0.
     */
    static double cap(double value, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(max, Math.max(0.0, value));
    }
}
