package com.sentinelx.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Thresholds, gains and caps of the three activity-shift rules.
 *
 * <ul>
 * <li>idle burst: fires when idle exceeds {@code idleMultiplier} × baseline and
 * typing exceeds {@code typingMultiplier} × baseline; score
 * {@code (ratio - typingMultiplier) × idleBurstGain}, capped at
 * {@code idleScale}</li>
 * <li>focus instability: fires when the focus-loss rate exceeds
 * {@code focusMultiplier} × baseline; score
 * {@code (ratio - focusMultiplier) × focusGain}, capped at
 * {@code focusScale}</li>
 * <li>behavioral drift: fires when typing deviates by more than
 * {@code driftThreshold} (fraction); score
 * {@code (deviation - driftThreshold) × driftGain}, capped at
 * {@code driftScale}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double idleMultiplier = 1.2;
    private double typingMultiplier = 1.3;
    private double focusMultiplier = 1.5;
    private double driftThreshold = 0.3;

    private double idleScale = 70.0;
    private double focusScale = 70.0;
    private double driftScale = 70.0;

    private double idleBurstGain = 100.0;
    private double focusGain = 70.0;
    private double driftGain = 200.0;

    // --- explanation bands ---
    private double warningThreshold = 30.0;
    private double criticalThreshold = 60.0;

    void validate(List<String> errors) {
        requirePositive(errors, "idleMultiplier", idleMultiplier);
        requirePositive(errors, "typingMultiplier", typingMultiplier);
        requirePositive(errors, "focusMultiplier", focusMultiplier);
        if (!(driftThreshold >= 0)) {
            errors.add("detection.driftThreshold must be >= 0, got: " + driftThreshold);
        }
        requireScale(errors, "idleScale", idleScale);
        requireScale(errors, "focusScale", focusScale);
        requireScale(errors, "driftScale", driftScale);
        requirePositive(errors, "idleBurstGain", idleBurstGain);
        requirePositive(errors, "focusGain", focusGain);
        requirePositive(errors, "driftGain", driftGain);
        if (!(warningThreshold >= 0 && warningThreshold <= criticalThreshold)) {
            errors.add("detection.warningThreshold must be in [0, criticalThreshold], got: "
                    + warningThreshold + " / " + criticalThreshold);
        }
    }

    private static void requirePositive(List<String> errors, String name, double value) {
        if (!(value > 0)) {
            errors.add("detection." + name + " must be > 0, got: " + value);
        }
    }

    private static void requireScale(List<String> errors, String name, double value) {
        if (!(value >= 0 && value <= 100)) {
            errors.add("detection." + name + " must be in [0, 100], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getIdleMultiplier() {
        return idleMultiplier;
    }

    public void setIdleMultiplier(double idleMultiplier) {
        this.idleMultiplier = idleMultiplier;
    }

    public double getTypingMultiplier() {
        return typingMultiplier;
    }

    public void setTypingMultiplier(double typingMultiplier) {
        this.typingMultiplier = typingMultiplier;
    }

    public double getFocusMultiplier() {
        return focusMultiplier;
    }

    public void setFocusMultiplier(double focusMultiplier) {
        this.focusMultiplier = focusMultiplier;
    }

    public double getDriftThreshold() {
        return driftThreshold;
    }

    public void setDriftThreshold(double driftThreshold) {
        this.driftThreshold = driftThreshold;
    }

    public double getIdleScale() {
        return idleScale;
    }

    public void setIdleScale(double idleScale) {
        this.idleScale = idleScale;
    }

    public double getFocusScale() {
        return focusScale;
    }

    public void setFocusScale(double focusScale) {
        this.focusScale = focusScale;
    }

    public double getDriftScale() {
        return driftScale;
    }

    public void setDriftScale(double driftScale) {
        this.driftScale = driftScale;
    }

    public double getIdleBurstGain() {
        return idleBurstGain;
    }

    public void setIdleBurstGain(double idleBurstGain) {
        this.idleBurstGain = idleBurstGain;
    }

    public double getFocusGain() {
        return focusGain;
    }

    public void setFocusGain(double focusGain) {
        this.focusGain = focusGain;
    }

    public double getDriftGain() {
        return driftGain;
    }

    public void setDriftGain(double driftGain) {
        this.driftGain = driftGain;
    }

    public double getWarningThreshold() {
        return warningThreshold;
    }

    public void setWarningThreshold(double warningThreshold) {
        this.warningThreshold = warningThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "idleMultiplier=" + idleMultiplier +
                ", typingMultiplier=" + typingMultiplier +
                ", focusMultiplier=" + focusMultiplier +
                ", driftThreshold=" + driftThreshold +
                ", idleScale=" + idleScale +
                ", focusScale=" + focusScale +
                ", driftScale=" + driftScale +
                ", idleBurstGain=" + idleBurstGain +
                ", focusGain=" + focusGain +
                ", driftGain=" + driftGain +
                '}';
    }
}
