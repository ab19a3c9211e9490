package com.sentinelx.core.aggregate;

import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.model.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory, per-session aggregation of accepted risk reports.
 *
 * <p>
 * Keeps running risk statistics per session and counts, per rule, the
 * reports whose score exceeds {@value #ANOMALY_COUNT_THRESHOLD}. Safe for
 * concurrent use by many session threads. Nothing survives a restart.
 * </p>
 *
 * @since 1.0.0
 */
public class RiskAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(RiskAggregator.class);

    public static final double ANOMALY_COUNT_THRESHOLD = 50.0;

    private final ConcurrentHashMap<String, SessionStats> sessions = new ConcurrentHashMap<>();

    /**
     * Fold one report into its session's statistics.
     *
     * @param report an already validated report
     */
    public void add(RiskReport report) {
        Objects.requireNonNull(report, "RiskReport must not be null");
        String sessionId = Objects.requireNonNull(report.getSessionId(), "sessionId must not be null");
        sessions.computeIfAbsent(sessionId, id -> new SessionStats()).add(report);
        LOG.debug("Aggregated risk {} for session {}", report.getRiskScore(), sessionId);
    }

    /**
     * @return aggregate for {@code sessionId}, empty if nothing was recorded
     */
    public Optional<SessionSummary> summary(String sessionId) {
        SessionStats stats = sessions.get(sessionId);
        return stats == null ? Optional.empty() : stats.summarize(sessionId);
    }

    /** Forget everything recorded for {@code sessionId}. */
    public void resetSession(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            LOG.info("Aggregates reset for session {}", sessionId);
        }
    }

    public Set<String> sessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static final class SessionStats {
        private int count;
        private double total;
        private double max = Double.NEGATIVE_INFINITY;
        private double min = Double.POSITIVE_INFINITY;
        private int idleBurst;
        private int focusInstability;
        private int behavioralDrift;

        synchronized void add(RiskReport report) {
            double risk = report.getRiskScore();
            count++;
            total += risk;
            max = Math.max(max, risk);
            min = Math.min(min, risk);

            AnomalyScores scores = report.getAnomalyScores();
            if (scores == null) {
                return;
            }
            if (scores.getIdleBurst() > ANOMALY_COUNT_THRESHOLD) {
                idleBurst++;
            }
            if (scores.getFocusInstability() > ANOMALY_COUNT_THRESHOLD) {
                focusInstability++;
            }
            if (scores.getBehavioralDrift() > ANOMALY_COUNT_THRESHOLD) {
                behavioralDrift++;
            }
        }

        synchronized Optional<SessionSummary> summarize(String sessionId) {
            if (count == 0) {
                return Optional.empty();
            }
            Map<String, Integer> counts = new LinkedHashMap<>();
            counts.put("idle_burst", idleBurst);
            counts.put("focus_instability", focusInstability);
            counts.put("behavioral_drift", behavioralDrift);
            return Optional.of(new SessionSummary(sessionId, count, total / count, max, min, counts));
        }
    }
}
