package com.sentinelx.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metrics of the SentinelX job, exposed through the cluster's
 * configured metric reporters.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code events_ingested_total}: interaction events fed to monitors</li>
 *   <li>{@code reports_emitted_total}: valid reports published</li>
 *   <li>{@code reports_rejected_total}: reports that failed validation</li>
 *   <li>{@code baselines_frozen_total}: sessions that finished calibration</li>
 *   <li>{@code sessions_expired_total}: session states cleared after idling</li>
 *   <li>{@code tick_latency_ms}: histogram of per-tick processing time</li>
 * </ul>
 */
public class SentinelMetrics {

    private final Counter eventsIngested;
    private final Counter reportsEmitted;
    private final Counter reportsRejected;
    private final Counter baselinesFrozen;
    private final Counter sessionsExpired;
    private final Histogram tickLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("sentinelx");

        this.eventsIngested = group.counter("events_ingested_total");
        this.reportsEmitted = group.counter("reports_emitted_total");
        this.reportsRejected = group.counter("reports_rejected_total");
        this.baselinesFrozen = group.counter("baselines_frozen_total");
        this.sessionsExpired = group.counter("sessions_expired_total");
        this.tickLatency = group.histogram("tick_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementEventsIngested(long count) {
        eventsIngested.inc(count);
    }

    public void incrementReportsEmitted() {
        reportsEmitted.inc();
    }

    public void incrementReportsRejected() {
        reportsRejected.inc();
    }

    public void incrementBaselinesFrozen() {
        baselinesFrozen.inc();
    }

    public void incrementSessionsExpired() {
        sessionsExpired.inc();
    }

    public void recordTickLatency(long milliseconds) {
        tickLatency.update(milliseconds);
    }
}
