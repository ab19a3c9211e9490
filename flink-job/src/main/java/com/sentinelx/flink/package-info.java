/**
 * Apache Flink deployment of the SentinelX pipeline.
 *
 * <p>
 * Interaction events arrive on Kafka tagged with a session id; each session
 * gets its own {@link com.sentinelx.core.session.SessionMonitor} in keyed
 * state, ticked by processing-time timers, and validated risk reports are
 * published back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.sentinelx.flink.SentinelRiskJob}: main entry point</li>
 * <li>{@link com.sentinelx.flink.SessionRiskFunction}: keyed per-session
 * pipeline</li>
 * <li>{@link com.sentinelx.flink.JobConfig}: environment-driven deployment
 * settings</li>
 * <li>{@link com.sentinelx.flink.HealthServer}: liveness and readiness
 * probes</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.sentinelx.flink;
