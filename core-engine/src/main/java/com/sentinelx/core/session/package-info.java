/**
 * Per-session pipeline orchestration.
 *
 * <p>
 * {@link com.sentinelx.core.session.SessionMonitor} bundles one feature
 * extractor, baseline builder, detector and risk engine;
 * {@link com.sentinelx.core.session.MonitoringLoop} drives it from an event
 * source to a report sink on a fixed cadence. Per-session signals go to an
 * injected {@link com.sentinelx.core.session.PipelineObserver}.
 * </p>
 */
package com.sentinelx.core.session;
