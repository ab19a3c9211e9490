package com.sentinelx.flink;

import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.session.LoggingPipelineObserver;

import java.util.Objects;

/**
 * Pipeline observer for the streaming job: logs like
 * {@link LoggingPipelineObserver} and also feeds {@link SentinelMetrics}.
 */
public class MetricsPipelineObserver extends LoggingPipelineObserver {

    private final SentinelMetrics metrics;

    public MetricsPipelineObserver(SentinelMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public void eventsIngested(String sessionId, int count) {
        super.eventsIngested(sessionId, count);
        metrics.incrementEventsIngested(count);
    }

    @Override
    public void baselineFrozen(String sessionId, BaselineProfile baseline, double now) {
        super.baselineFrozen(sessionId, baseline, now);
        metrics.incrementBaselinesFrozen();
    }

    @Override
    public void reportDelivered(String sessionId, RiskReport report) {
        super.reportDelivered(sessionId, report);
        metrics.incrementReportsEmitted();
    }

    @Override
    public void reportRejected(String sessionId, RiskReport report, String reason) {
        super.reportRejected(sessionId, report, reason);
        metrics.incrementReportsRejected();
    }
}
