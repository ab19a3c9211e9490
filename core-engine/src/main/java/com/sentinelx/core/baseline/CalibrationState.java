package com.sentinelx.core.baseline;

/**
 * Lifecycle of a session baseline. {@link #CALIBRATED} is terminal until an
 * explicit reset.
 *
 * @since 1.0.0
 */
public enum CalibrationState {

    /** No calibration window has been anchored yet. */
    UNINITIALIZED,

    /** Collecting feature vectors. */
    CALIBRATING,

    /** Baseline frozen. */
    CALIBRATED
}
