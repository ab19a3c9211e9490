package com.sentinelx.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Per-rule anomaly scores and their overall maximum, each in [0, 100].
 *
 * <p>
 * Built through {@link #of(double, double, double)}, which clamps the three
 * rule scores and derives {@code overall} as their maximum.
 * {@link #received} keeps whatever the wire carried so that a collector can
 * validate foreign payloads as-is.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"idle_burst", "focus_instability", "behavioral_drift", "overall"})
public final class AnomalyScores implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    /** All-zero scores, used when no baseline exists yet. */
    public static final AnomalyScores NONE = of(0.0, 0.0, 0.0);

    private final double idleBurst;
    private final double focusInstability;
    private final double behavioralDrift;
    private final double overall;

    private AnomalyScores(double idleBurst, double focusInstability, double behavioralDrift, double overall) {
        this.idleBurst = idleBurst;
        this.focusInstability = focusInstability;
        this.behavioralDrift = behavioralDrift;
        this.overall = overall;
    }

    /**
     * Create scores, clamping each to [0, 100] and setting
     * {@code overall = max(idleBurst, focusInstability, behavioralDrift)}.
     */
    public static AnomalyScores of(double idleBurst, double focusInstability, double behavioralDrift) {
        double i = clamp(idleBurst);
        double f = clamp(focusInstability);
        double d = clamp(behavioralDrift);
        return new AnomalyScores(i, f, d, Math.max(i, Math.max(f, d)));
    }

    /**
     * Scores exactly as received from a remote producer, without clamping or
     * deriving {@code overall}. Only collectors validating foreign payloads
     * should use this.
     */
    @JsonCreator
    public static AnomalyScores received(@JsonProperty("idle_burst") double idleBurst,
            @JsonProperty("focus_instability") double focusInstability,
            @JsonProperty("behavioral_drift") double behavioralDrift,
            @JsonProperty("overall") double overall) {
        return new AnomalyScores(idleBurst, focusInstability, behavioralDrift, overall);
    }

    /**
     * Clamp a score to [0, 100]; NaN maps to 0.
     */
    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return MIN_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    @JsonProperty("idle_burst")
    public double getIdleBurst() {
        return idleBurst;
    }

    @JsonProperty("focus_instability")
    public double getFocusInstability() {
        return focusInstability;
    }

    @JsonProperty("behavioral_drift")
    public double getBehavioralDrift() {
        return behavioralDrift;
    }

    @JsonProperty("overall")
    public double getOverall() {
        return overall;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyScores that))
            return false;
        return Double.compare(idleBurst, that.idleBurst) == 0
                && Double.compare(focusInstability, that.focusInstability) == 0
                && Double.compare(behavioralDrift, that.behavioralDrift) == 0
                && Double.compare(overall, that.overall) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(idleBurst, focusInstability, behavioralDrift, overall);
    }

    @Override
    public String toString() {
        return String.format("AnomalyScores{idleBurst=%.1f, focus=%.1f, drift=%.1f, overall=%.1f}",
                idleBurst, focusInstability, behavioralDrift, overall);
    }
}
