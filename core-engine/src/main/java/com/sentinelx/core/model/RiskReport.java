package com.sentinelx.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Periodic risk record handed to the external sink.
 *
 * <p>
 * Serialized as snake_case JSON:
 * </p>
 *
 * <pre>
 * {
 *   "timestamp": 1718000000.0,
 *   "risk_score": 42.5,
 *   "anomaly_scores": {"idle_burst": 0.0, "focus_instability": 70.0,
 *                      "behavioral_drift": 12.0, "overall": 70.0},
 *   "session_id": "5f0c...",
 *   "source": "sentinelx-client"
 * }
 * </pre>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code sessionId} and {@code anomalyScores} are
 * required; omitting either throws {@link NullPointerException} at build
 * time. Range checks are the sink's job, see
 * {@code com.sentinelx.core.validation.RiskReportValidator}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"timestamp", "risk_score", "anomaly_scores", "session_id", "source"})
public class RiskReport implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_SOURCE = "sentinelx-client";

    /** Seconds since the epoch at which the risk was computed. */
    private double timestamp;

    private double riskScore;

    private AnomalyScores anomalyScores;

    private String sessionId;

    /** Producer tag, e.g. "sentinelx-client" or "synthetic". */
    private String source = DEFAULT_SOURCE;

    /** No-arg constructor required by Jackson. */
    public RiskReport() {
    }

    private RiskReport(Builder builder) {
        this.timestamp = builder.timestamp;
        this.riskScore = builder.riskScore;
        this.anomalyScores = Objects.requireNonNull(builder.anomalyScores, "anomalyScores must not be null");
        this.sessionId = Objects.requireNonNull(builder.sessionId, "sessionId must not be null");
        this.source = builder.source != null ? builder.source : DEFAULT_SOURCE;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link RiskReport} instances.
     */
    public static class Builder {
        private double timestamp;
        private double riskScore;
        private AnomalyScores anomalyScores;
        private String sessionId;
        private String source;

        public Builder timestamp(double timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder riskScore(double riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder anomalyScores(AnomalyScores anomalyScores) {
            this.anomalyScores = anomalyScores;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * @return a new {@link RiskReport}
         * @throws NullPointerException if {@code sessionId} or
         *                              {@code anomalyScores} is {@code null}
         */
        public RiskReport build() {
            return new RiskReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    @JsonProperty("timestamp")
    public double getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(double timestamp) {
        this.timestamp = timestamp;
    }

    @JsonProperty("risk_score")
    public double getRiskScore() {
        return riskScore;
    }

    @JsonProperty("risk_score")
    public void setRiskScore(double riskScore) {
        this.riskScore = riskScore;
    }

    @JsonProperty("anomaly_scores")
    public AnomalyScores getAnomalyScores() {
        return anomalyScores;
    }

    @JsonProperty("anomaly_scores")
    public void setAnomalyScores(AnomalyScores anomalyScores) {
        this.anomalyScores = anomalyScores;
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("session_id")
    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RiskReport that))
            return false;
        return Double.compare(timestamp, that.timestamp) == 0
                && Double.compare(riskScore, that.riskScore) == 0
                && Objects.equals(anomalyScores, that.anomalyScores)
                && Objects.equals(sessionId, that.sessionId)
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, riskScore, anomalyScores, sessionId, source);
    }

    @Override
    public String toString() {
        return "RiskReport{" +
                "sessionId='" + sessionId + '\'' +
                ", timestamp=" + timestamp +
                ", riskScore=" + String.format("%.2f", riskScore) +
                ", anomalyScores=" + anomalyScores +
                ", source='" + source + '\'' +
                '}';
    }
}
