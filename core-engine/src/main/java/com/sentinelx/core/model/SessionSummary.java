package com.sentinelx.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collector-side aggregate of every accepted report for one session.
 *
 * <p>
 * {@code anomalyCounts} maps each rule name ({@code idle_burst},
 * {@code focus_instability}, {@code behavioral_drift}) to the number of
 * reports in which that rule scored above the counting threshold.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"session_id", "risk_count", "average_risk", "max_risk", "min_risk", "anomaly_counts"})
public final class SessionSummary {

    private final String sessionId;
    private final int riskCount;
    private final double averageRisk;
    private final double maxRisk;
    private final double minRisk;
    private final Map<String, Integer> anomalyCounts;

    public SessionSummary(String sessionId, int riskCount, double averageRisk,
            double maxRisk, double minRisk, Map<String, Integer> anomalyCounts) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.riskCount = riskCount;
        this.averageRisk = averageRisk;
        this.maxRisk = maxRisk;
        this.minRisk = minRisk;
        this.anomalyCounts = Collections.unmodifiableMap(new LinkedHashMap<>(anomalyCounts));
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("risk_count")
    public int getRiskCount() {
        return riskCount;
    }

    @JsonProperty("average_risk")
    public double getAverageRisk() {
        return averageRisk;
    }

    @JsonProperty("max_risk")
    public double getMaxRisk() {
        return maxRisk;
    }

    @JsonProperty("min_risk")
    public double getMinRisk() {
        return minRisk;
    }

    /**
     * @return unmodifiable map of rule name to count
     */
    @JsonProperty("anomaly_counts")
    public Map<String, Integer> getAnomalyCounts() {
        return anomalyCounts;
    }

    @Override
    public String toString() {
        return String.format("SessionSummary{sessionId='%s', reports=%d, avg=%.1f, max=%.1f, min=%.1f, anomalies=%s}",
                sessionId, riskCount, averageRisk, maxRisk, minRisk, anomalyCounts);
    }
}
