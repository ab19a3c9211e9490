package com.sentinelx.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Frozen reference profile of a session's normal behavior.
 *
 * <p>
 * Created once per session when calibration converges and never mutated
 * afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Used when calibration is forced to finish without any observations. */
    public static final BaselineProfile FALLBACK = new BaselineProfile(150.0, 2.0, 0.5);

    /** Key presses per minute. */
    private final double avgTypingSpeed;

    /** Seconds. */
    private final double avgIdleDuration;

    /** Focus losses per minute. */
    private final double avgFocusRate;

    public BaselineProfile(double avgTypingSpeed, double avgIdleDuration, double avgFocusRate) {
        this.avgTypingSpeed = avgTypingSpeed;
        this.avgIdleDuration = avgIdleDuration;
        this.avgFocusRate = avgFocusRate;
    }

    public double getAvgTypingSpeed() {
        return avgTypingSpeed;
    }

    public double getAvgIdleDuration() {
        return avgIdleDuration;
    }

    public double getAvgFocusRate() {
        return avgFocusRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineProfile that))
            return false;
        return Double.compare(avgTypingSpeed, that.avgTypingSpeed) == 0
                && Double.compare(avgIdleDuration, that.avgIdleDuration) == 0
                && Double.compare(avgFocusRate, that.avgFocusRate) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(avgTypingSpeed, avgIdleDuration, avgFocusRate);
    }

    @Override
    public String toString() {
        return String.format("BaselineProfile{typing=%.1f/min, idle=%.2fs, focusRate=%.2f/min}",
                avgTypingSpeed, avgIdleDuration, avgFocusRate);
    }
}
