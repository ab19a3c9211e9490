package com.sentinelx.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Cadence of the polling loop and the report emission.
 *
 * @since 1.0.0
 */
public class ReportingSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Seconds between feature computations. */
    private double tickIntervalSeconds = 1.0;

    /** Minimum seconds between two emitted reports. */
    private double reportIntervalSeconds = 5.0;

    /** Upper bound on each event-source drain. */
    private long drainTimeoutMillis = 500;

    private String source = "sentinelx-client";

    void validate(List<String> errors) {
        if (!(tickIntervalSeconds > 0)) {
            errors.add("reporting.tickIntervalSeconds must be > 0, got: " + tickIntervalSeconds);
        }
        if (reportIntervalSeconds < 0) {
            errors.add("reporting.reportIntervalSeconds must be >= 0, got: " + reportIntervalSeconds);
        }
        if (drainTimeoutMillis < 0) {
            errors.add("reporting.drainTimeoutMillis must be >= 0, got: " + drainTimeoutMillis);
        }
        if (source == null || source.isBlank()) {
            errors.add("reporting.source is required");
        }
    }

    public double getTickIntervalSeconds() {
        return tickIntervalSeconds;
    }

    public void setTickIntervalSeconds(double tickIntervalSeconds) {
        this.tickIntervalSeconds = tickIntervalSeconds;
    }

    public double getReportIntervalSeconds() {
        return reportIntervalSeconds;
    }

    public void setReportIntervalSeconds(double reportIntervalSeconds) {
        this.reportIntervalSeconds = reportIntervalSeconds;
    }

    public long getDrainTimeoutMillis() {
        return drainTimeoutMillis;
    }

    public void setDrainTimeoutMillis(long drainTimeoutMillis) {
        this.drainTimeoutMillis = drainTimeoutMillis;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    @Override
    public String toString() {
        return "ReportingSettings{" +
                "tickIntervalSeconds=" + tickIntervalSeconds +
                ", reportIntervalSeconds=" + reportIntervalSeconds +
                ", drainTimeoutMillis=" + drainTimeoutMillis +
                ", source='" + source + '\'' +
                '}';
    }
}
