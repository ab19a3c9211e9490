/**
 * Domain model classes for SentinelX.
 *
 * <p>
 * Every type here carries timing or aggregate numbers only, never content:
 * </p>
 * <ul>
 * <li>{@link com.sentinelx.core.model.InteractionEvent}: timestamped input
 * event with a kind-specific payload</li>
 * <li>{@link com.sentinelx.core.model.FeatureVector}: one sliding-window
 * aggregate</li>
 * <li>{@link com.sentinelx.core.model.BaselineProfile}: frozen per-session
 * reference</li>
 * <li>{@link com.sentinelx.core.model.AnomalyScores}: per-rule and overall
 * scores</li>
 * <li>{@link com.sentinelx.core.model.RiskReport}: boundary record for the
 * sink</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.sentinelx.core.model;
