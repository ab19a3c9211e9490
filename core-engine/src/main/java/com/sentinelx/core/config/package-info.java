/**
 * YAML-backed configuration of the SentinelX pipeline.
 *
 * <p>
 * {@link com.sentinelx.core.config.SentinelConfigLoader} resolves and parses
 * {@link com.sentinelx.core.config.SentinelConfig}, whose sections tune the
 * feature window, baseline calibration, shift detection, risk smoothing and
 * report cadence.
 * </p>
 */
package com.sentinelx.core.config;
