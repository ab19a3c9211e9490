package com.sentinelx.core.session;

import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.risk.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PipelineObserver} that writes every signal to SLF4J, tagged with the
 * session id.
 *
 * @since 1.0.0
 */
public class LoggingPipelineObserver implements PipelineObserver {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingPipelineObserver.class);

    @Override
    public void eventsIngested(String sessionId, int count) {
        LOG.trace("[{}] ingested {} event(s)", sessionId, count);
    }

    @Override
    public void baselineFrozen(String sessionId, BaselineProfile baseline, double now) {
        LOG.info("[{}] baseline calibrated at {}: {}", sessionId, now, baseline);
    }

    @Override
    public void scored(String sessionId, AnomalyScores scores, double riskScore, double now) {
        LOG.debug("[{}] risk={} ({}) {}", sessionId, String.format("%.1f", riskScore),
                RiskLevel.of(riskScore), scores);
    }

    @Override
    public void reportDelivered(String sessionId, RiskReport report) {
        LOG.info("[{}] risk {} ({}) reported | I:{} F:{} D:{}", sessionId,
                String.format("%.1f", report.getRiskScore()), RiskLevel.of(report.getRiskScore()),
                Math.round(report.getAnomalyScores().getIdleBurst()),
                Math.round(report.getAnomalyScores().getFocusInstability()),
                Math.round(report.getAnomalyScores().getBehavioralDrift()));
    }

    @Override
    public void reportRejected(String sessionId, RiskReport report, String reason) {
        LOG.warn("[{}] report rejected: {}", sessionId, reason);
    }

    @Override
    public void reportDropped(String sessionId, RiskReport report, String detail) {
        LOG.warn("[{}] report dropped, next tick sends fresh data: {}", sessionId, detail);
    }
}
