package com.sentinelx.core.session;

import com.sentinelx.core.baseline.BaselineBuilder;
import com.sentinelx.core.baseline.CalibrationState;
import com.sentinelx.core.config.SentinelConfig;
import com.sentinelx.core.detection.ActivityShiftDetector;
import com.sentinelx.core.feature.FeatureExtractor;
import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.FeatureVector;
import com.sentinelx.core.model.InteractionEvent;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.risk.RiskEngine;

import java.io.Serializable;
import java.util.Collection;
import java.util.Objects;

/**
 * The full risk pipeline of one session: feature extraction, baseline
 * calibration, shift detection and risk smoothing.
 *
 * <h3>Tick</h3>
 * <ol>
 * <li>features over the trailing window ending at {@code now}</li>
 * <li>baseline update; once calibrated the baseline is handed to the
 * detector exactly once</li>
 * <li>after calibration: anomaly scores and smoothed risk</li>
 * <li>a report when {@code reportIntervalSeconds} have passed since the last
 * delivered or rejected one</li>
 * </ol>
 *
 * <p>
 * Single-threaded; every session owns its own instance. The instance is
 * {@link Serializable} so that a streaming job can keep it in keyed state;
 * the {@link PipelineObserver} is transient and must be re-attached with
 * {@link #attach(PipelineObserver)} after restore.
 * </p>
 *
 * @since 1.0.0
 */
public class SessionMonitor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sessionId;
    private final String source;
    private final double reportInterval;

    private final FeatureExtractor extractor;
    private final BaselineBuilder baselineBuilder;
    private final ActivityShiftDetector detector;
    private final RiskEngine riskEngine;

    private boolean baselineInstalled;
    private double lastReportTime = Double.NEGATIVE_INFINITY;
    private long eventCount;
    private long reportCount;

    private transient PipelineObserver observer;

    public SessionMonitor(String sessionId, SentinelConfig config) {
        this(sessionId, config, new LoggingPipelineObserver());
    }

    /**
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if {@code sessionId} is blank
     */
    public SessionMonitor(String sessionId, SentinelConfig config, PipelineObserver observer) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        Objects.requireNonNull(config, "SentinelConfig must not be null");
        this.sessionId = sessionId;
        this.source = config.getReporting().getSource();
        this.reportInterval = config.getReporting().getReportIntervalSeconds();
        this.extractor = new FeatureExtractor(config.getFeatures());
        this.baselineBuilder = new BaselineBuilder(config.getCalibration());
        this.detector = new ActivityShiftDetector(config.getDetection());
        this.riskEngine = new RiskEngine(config.getRisk());
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    /** Replace the observer, e.g. after the monitor was deserialized. */
    public void attach(PipelineObserver observer) {
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    private PipelineObserver observer() {
        return observer != null ? observer : PipelineObserver.NOOP;
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    public void addEvent(InteractionEvent event) {
        extractor.addEvent(event);
        eventCount++;
        observer().eventsIngested(sessionId, 1);
    }

    public void addEvents(Collection<InteractionEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        for (InteractionEvent event : events) {
            extractor.addEvent(event);
        }
        eventCount += events.size();
        observer().eventsIngested(sessionId, events.size());
    }

    // ---------------------------------------------------------------
    // Tick
    // ---------------------------------------------------------------

    /**
     * Run one pipeline iteration at {@code now}.
     *
     * @param now current time in seconds
     * @return what the iteration produced; never {@code null}
     */
    public TickResult tick(double now) {
        FeatureVector features = extractor.computeFeatures(now);
        baselineBuilder.update(features, features.getWindowEnd());

        if (!baselineInstalled && baselineBuilder.isCalibrated()) {
            BaselineProfile baseline = baselineBuilder.baseline().orElseThrow();
            detector.setBaseline(baseline);
            baselineInstalled = true;
            observer().baselineFrozen(sessionId, baseline, now);
        }

        CalibrationState state = baselineBuilder.state();
        double progress = baselineBuilder.calibrationProgress(now);
        if (!baselineInstalled) {
            return new TickResult(features, state, progress, null, 0.0, null);
        }

        AnomalyScores scores = detector.computeScores(features);
        double risk = riskEngine.computeRisk(scores);
        observer().scored(sessionId, scores, risk, now);

        RiskReport report = null;
        if (now - lastReportTime >= reportInterval) {
            report = RiskReport.builder()
                    .timestamp(now)
                    .riskScore(risk)
                    .anomalyScores(scores)
                    .sessionId(sessionId)
                    .source(source)
                    .build();
        }
        return new TickResult(features, state, progress, scores, risk, report);
    }

    // ---------------------------------------------------------------
    // Delivery outcomes
    // ---------------------------------------------------------------

    /** The receiver stored {@code report}; the report timer restarts. */
    public void markReportDelivered(RiskReport report) {
        lastReportTime = report.getTimestamp();
        reportCount++;
        observer().reportDelivered(sessionId, report);
    }

    /**
     * The receiver refused {@code report}. It is neither resent nor
     * recalculated; the report timer restarts.
     */
    public void markReportHandled(RiskReport report, String reason) {
        lastReportTime = report.getTimestamp();
        observer().reportRejected(sessionId, report, reason);
    }

    /**
     * {@code report} was lost in transit. The timer is left alone so the next
     * tick builds a fresh report.
     */
    public void reportDropped(RiskReport report, String detail) {
        observer().reportDropped(sessionId, report, detail);
    }

    // ---------------------------------------------------------------
    // Read-only queries
    // ---------------------------------------------------------------

    public String getSessionId() {
        return sessionId;
    }

    public CalibrationState calibrationState() {
        return baselineBuilder.state();
    }

    public double calibrationProgress(double now) {
        return baselineBuilder.calibrationProgress(now);
    }

    public double currentRisk() {
        return riskEngine.currentRisk();
    }

    public String explain(AnomalyScores scores) {
        return detector.explain(scores);
    }

    public long getEventCount() {
        return eventCount;
    }

    public long getReportCount() {
        return reportCount;
    }

    public int bufferedEventCount() {
        return extractor.bufferedCount();
    }

    @Override
    public String toString() {
        return "SessionMonitor{" +
                "sessionId='" + sessionId + '\'' +
                ", state=" + baselineBuilder.state() +
                ", risk=" + String.format("%.1f", riskEngine.currentRisk()) +
                ", events=" + eventCount +
                ", reports=" + reportCount +
                '}';
    }
}
