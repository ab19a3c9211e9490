package com.sentinelx.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Aggregate snapshot of one sliding window of interaction events.
 *
 * <p>
 * A pure value: produced fresh on every feature computation and never
 * mutated. Use the {@link Builder} to construct instances; unset numeric
 * fields default to zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Key presses per minute. */
    private final double avgTypingSpeed;

    /** Mean idle-period duration in seconds. */
    private final double avgIdleDuration;

    private final int focusLossCount;

    /** Pixels per second along the sampled mouse path. */
    private final double avgMouseSpeed;

    /** Mean press-to-press delta in seconds. */
    private final double interKeyInterval;

    private final int keyPressCount;

    private final double windowStart;
    private final double windowEnd;

    private FeatureVector(Builder b) {
        this.avgTypingSpeed = b.avgTypingSpeed;
        this.avgIdleDuration = b.avgIdleDuration;
        this.focusLossCount = b.focusLossCount;
        this.avgMouseSpeed = b.avgMouseSpeed;
        this.interKeyInterval = b.interKeyInterval;
        this.keyPressCount = b.keyPressCount;
        this.windowStart = b.windowStart;
        this.windowEnd = b.windowEnd;
    }

    /**
     * An all-zero vector spanning the given window.
     *
     * @param windowStart window start (seconds)
     * @param windowEnd   window end (seconds)
     * @return empty feature vector
     */
    public static FeatureVector empty(double windowStart, double windowEnd) {
        return builder().windowStart(windowStart).windowEnd(windowEnd).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link FeatureVector}.
     */
    public static class Builder {
        private double avgTypingSpeed;
        private double avgIdleDuration;
        private int focusLossCount;
        private double avgMouseSpeed;
        private double interKeyInterval;
        private int keyPressCount;
        private double windowStart;
        private double windowEnd;

        public Builder avgTypingSpeed(double v) {
            this.avgTypingSpeed = v;
            return this;
        }

        public Builder avgIdleDuration(double v) {
            this.avgIdleDuration = v;
            return this;
        }

        public Builder focusLossCount(int v) {
            this.focusLossCount = v;
            return this;
        }

        public Builder avgMouseSpeed(double v) {
            this.avgMouseSpeed = v;
            return this;
        }

        public Builder interKeyInterval(double v) {
            this.interKeyInterval = v;
            return this;
        }

        public Builder keyPressCount(int v) {
            this.keyPressCount = v;
            return this;
        }

        public Builder windowStart(double v) {
            this.windowStart = v;
            return this;
        }

        public Builder windowEnd(double v) {
            this.windowEnd = v;
            return this;
        }

        /**
         * Convenience for a window of {@code lengthSeconds} ending at {@code end}.
         */
        public Builder window(double end, double lengthSeconds) {
            this.windowEnd = end;
            this.windowStart = end - lengthSeconds;
            return this;
        }

        public FeatureVector build() {
            return new FeatureVector(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double getAvgTypingSpeed() {
        return avgTypingSpeed;
    }

    public double getAvgIdleDuration() {
        return avgIdleDuration;
    }

    public int getFocusLossCount() {
        return focusLossCount;
    }

    public double getAvgMouseSpeed() {
        return avgMouseSpeed;
    }

    public double getInterKeyInterval() {
        return interKeyInterval;
    }

    public int getKeyPressCount() {
        return keyPressCount;
    }

    public double getWindowStart() {
        return windowStart;
    }

    public double getWindowEnd() {
        return windowEnd;
    }

    /**
     * @return {@code windowEnd - windowStart}, possibly zero or negative for
     *         degenerate windows
     */
    public double windowLength() {
        return windowEnd - windowStart;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return Double.compare(avgTypingSpeed, that.avgTypingSpeed) == 0
                && Double.compare(avgIdleDuration, that.avgIdleDuration) == 0
                && focusLossCount == that.focusLossCount
                && Double.compare(avgMouseSpeed, that.avgMouseSpeed) == 0
                && Double.compare(interKeyInterval, that.interKeyInterval) == 0
                && keyPressCount == that.keyPressCount
                && Double.compare(windowStart, that.windowStart) == 0
                && Double.compare(windowEnd, that.windowEnd) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(avgTypingSpeed, avgIdleDuration, focusLossCount, avgMouseSpeed,
                interKeyInterval, keyPressCount, windowStart, windowEnd);
    }

    @Override
    public String toString() {
        return String.format(
                "FeatureVector{typing=%.1f/min, idle=%.2fs, focusLoss=%d, mouse=%.1fpx/s, "
                        + "interKey=%.3fs, keyPresses=%d, window=[%.2f, %.2f]}",
                avgTypingSpeed, avgIdleDuration, focusLossCount, avgMouseSpeed,
                interKeyInterval, keyPressCount, windowStart, windowEnd);
    }
}
