/**
 * Per-session baseline calibration.
 *
 * <p>
 * {@link com.sentinelx.core.baseline.BaselineBuilder} moves through
 * {@link com.sentinelx.core.baseline.CalibrationState} and freezes one
 * {@link com.sentinelx.core.model.BaselineProfile} per session.
 * </p>
 */
package com.sentinelx.core.baseline;
