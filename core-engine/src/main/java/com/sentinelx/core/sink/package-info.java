/**
 * Destinations for risk reports.
 *
 * <p>
 * {@link com.sentinelx.core.sink.HttpReportSink} posts to a remote collector;
 * {@link com.sentinelx.core.sink.InMemoryReportSink} validates and aggregates
 * in process.
 * </p>
 */
package com.sentinelx.core.sink;
