package com.sentinelx.core.baseline;

import com.sentinelx.core.config.CalibrationSettings;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Observes feature vectors during calibration and freezes a
 * {@link BaselineProfile} once enough typing evidence has accumulated.
 *
 * <h3>Convergence</h3>
 * <p>
 * While {@link CalibrationState#CALIBRATING}, every vector inside the
 * calibration window is recorded. The baseline is built early when at least
 * {@code minSamples} vectors were recorded, {@code convergenceFraction} of the
 * window has elapsed and one of them shows typing activity. Once the window
 * has elapsed, construction is forced on the next update.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Only vectors with typing signal are averaged. Without any, all vectors are
 * used once {@code fallbackSampleCount} were recorded; otherwise construction
 * is deferred and the builder stays calibrating. An empty history at forced
 * finalization yields {@link BaselineProfile#FALLBACK}.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineBuilder implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(BaselineBuilder.class);

    /** Window length assumed when the first valid sample carries none. */
    static final double DEFAULT_WINDOW_SECONDS = 30.0;

    private final CalibrationSettings settings;

    private CalibrationState state = CalibrationState.UNINITIALIZED;
    private final List<FeatureVector> history = new ArrayList<>();
    private double calibrationStart;

    /** Non-null exactly when {@code state == CALIBRATED}. */
    private BaselineProfile baseline;

    public BaselineBuilder(CalibrationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "CalibrationSettings must not be null");
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Discard history and any baseline, and start a calibration window at
     * {@code startTime}.
     */
    public void startCalibration(double startTime) {
        history.clear();
        baseline = null;
        calibrationStart = startTime;
        state = CalibrationState.CALIBRATING;
        LOG.info("Calibration started at {} for {}s", startTime, settings.getDurationSeconds());
    }

    /**
     * Feed one feature vector.
     *
     * @param features vector of the window ending at {@code now}
     * @param now      current time in seconds
     * @return {@code true} if this update froze the baseline
     */
    public boolean update(FeatureVector features, double now) {
        Objects.requireNonNull(features, "FeatureVector must not be null");
        if (state == CalibrationState.CALIBRATED) {
            return false;
        }
        if (state == CalibrationState.UNINITIALIZED) {
            startCalibration(now);
            return false;
        }

        double elapsed = now - calibrationStart;
        if (elapsed <= settings.getDurationSeconds()) {
            history.add(features);
            LOG.debug("Calibration: {}s elapsed, {} sample(s)", elapsed, history.size());
            if (history.size() >= settings.getMinSamples()
                    && elapsed >= settings.getDurationSeconds() * settings.getConvergenceFraction()
                    && hasTypingActivity()) {
                return buildBaseline();
            }
            return false;
        }
        return buildBaseline();
    }

    /** Back to {@link CalibrationState#UNINITIALIZED}. */
    public void reset() {
        history.clear();
        baseline = null;
        calibrationStart = 0;
        state = CalibrationState.UNINITIALIZED;
        LOG.info("Baseline builder reset");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean hasTypingActivity() {
        for (FeatureVector fv : history) {
            if (fv.getAvgTypingSpeed() > settings.getTypingActivityThreshold()
                    || fv.getKeyPressCount() > settings.getKeyPressActivityThreshold()) {
                return true;
            }
        }
        return false;
    }

    private boolean buildBaseline() {
        if (history.isEmpty()) {
            LOG.warn("No feature history at end of calibration, using fallback baseline {}",
                    BaselineProfile.FALLBACK);
            freeze(BaselineProfile.FALLBACK);
            return true;
        }

        List<FeatureVector> valid = new ArrayList<>();
        for (FeatureVector fv : history) {
            if (fv.getAvgTypingSpeed() > 0 || fv.getKeyPressCount() > 0) {
                valid.add(fv);
            }
        }

        if (valid.isEmpty()) {
            if (history.size() < settings.getFallbackSampleCount()) {
                LOG.info("No typing in {} sample(s) yet, calibration continues", history.size());
                return false;
            }
            LOG.warn("No typing detected in {} samples, calibrating on all of them", history.size());
            valid = history;
        }

        double typing = 0;
        double idle = 0;
        double focusLosses = 0;
        for (FeatureVector fv : valid) {
            typing += fv.getAvgTypingSpeed();
            idle += fv.getAvgIdleDuration();
            focusLosses += fv.getFocusLossCount();
        }
        int n = valid.size();

        double windowLength = valid.get(0).windowLength();
        if (windowLength <= 0) {
            windowLength = DEFAULT_WINDOW_SECONDS;
        }
        double focusRate = (focusLosses / n) * (60.0 / windowLength);

        int samples = history.size();
        freeze(new BaselineProfile(typing / n, idle / n, focusRate));
        LOG.info("Baseline frozen after {} sample(s): {}", samples, baseline);
        return true;
    }

    private void freeze(BaselineProfile profile) {
        baseline = profile;
        state = CalibrationState.CALIBRATED;
        history.clear();
    }

    // ---------------------------------------------------------------
    // Read-only queries
    // ---------------------------------------------------------------

    public CalibrationState state() {
        return state;
    }

    public boolean isCalibrated() {
        return state == CalibrationState.CALIBRATED;
    }

    public Optional<BaselineProfile> baseline() {
        return Optional.ofNullable(baseline);
    }

    /** Vectors recorded in the current calibration window. */
    public int sampleCount() {
        return history.size();
    }

    /**
     * Calibration progress in percent: 0 before start, 100 once calibrated,
     * otherwise elapsed time over duration, capped at 100.
     */
    public double calibrationProgress(double now) {
        return switch (state) {
            case UNINITIALIZED -> 0.0;
            case CALIBRATED -> 100.0;
            case CALIBRATING -> Math.min(100.0,
                    Math.max(0.0, now - calibrationStart) / settings.getDurationSeconds() * 100.0);
        };
    }
}
