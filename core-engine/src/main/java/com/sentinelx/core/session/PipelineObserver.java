package com.sentinelx.core.session;

import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.RiskReport;

/**
 * Structured per-session signals emitted by a {@link SessionMonitor}.
 * <p>
 * Injected per session so that concurrent sessions never share logging or
 * metric state. Every method defaults to a no-op; implementations override
 * what they record and must not throw.
 * </p>
 */
public interface PipelineObserver {

    /** Observer that ignores every signal. */
    PipelineObserver NOOP = new PipelineObserver() {
    };

    default void eventsIngested(String sessionId, int count) {
    }

    default void baselineFrozen(String sessionId, BaselineProfile baseline, double now) {
    }

    default void scored(String sessionId, AnomalyScores scores, double riskScore, double now) {
    }

    default void reportDelivered(String sessionId, RiskReport report) {
    }

    default void reportRejected(String sessionId, RiskReport report, String reason) {
    }

    default void reportDropped(String sessionId, RiskReport report, String detail) {
    }
}
