/**
 * Deviation-based activity-shift detection.
 *
 * <p>
 * {@link com.sentinelx.core.detection.ActivityShiftDetector} evaluates three
 * {@link com.sentinelx.core.detection.ShiftRule} implementations against the
 * session baseline:
 * </p>
 * <ul>
 * <li>{@link com.sentinelx.core.detection.IdleBurstRule}: long idle followed
 * by a typing burst</li>
 * <li>{@link com.sentinelx.core.detection.FocusInstabilityRule}: excessive
 * focus switching</li>
 * <li>{@link com.sentinelx.core.detection.BehavioralDriftRule}: typing speed
 * drifting from the baseline</li>
 * </ul>
 *
 * <p>
 * All multipliers, gains and caps come from
 * {@link com.sentinelx.core.config.DetectionSettings}.
 * </p>
 *
 * @since 1.0.0
 */
package com.sentinelx.core.detection;
