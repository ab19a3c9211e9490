package com.sentinelx.flink;

import com.sentinelx.core.config.SentinelConfig;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.session.SessionMonitor;
import com.sentinelx.core.session.TickResult;
import com.sentinelx.core.validation.RiskReportValidator;
import com.sentinelx.core.validation.ValidationResult;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.TimerService;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Keyed process function running one {@link SessionMonitor} per session id.
 *
 * <p>
 * Events are fed to the session's monitor as they arrive. A processing-time
 * timer fires every tick interval; each firing ticks the monitor at the
 * session's {@link SessionClock} time (the producer's time base) and, when a
 * report is due, validates it with {@link RiskReportValidator}. Valid reports
 * are emitted and marked delivered; invalid ones are counted, logged and
 * marked handled so they are not recalculated.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * {@code ValueState<SessionMonitor>} holds the whole per-session pipeline and
 * is snapshotted with checkpoints. The monitor's observer is transient and is
 * re-attached on every access. A session that receives no events for the
 * idle timeout has its state cleared and its timer chain ends.
 * </p>
 *
 * @since 1.0.0
 */
public class SessionRiskFunction extends KeyedProcessFunction<String, SessionEvent, RiskReport> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SessionRiskFunction.class);

    private final SentinelConfig config;
    private final long tickIntervalMs;
    private final long idleTimeoutMs;
    private final RiskReportValidator validator = new RiskReportValidator();

    private transient ValueState<SessionMonitor> monitorState;
    private transient ValueState<SessionClock> clockState;
    private transient ValueState<Long> lastEventState;
    private transient ValueState<Long> nextTickState;

    private transient SentinelMetrics metrics;
    private transient MetricsPipelineObserver observer;

    /**
     * @param config        validated pipeline configuration
     * @param idleTimeoutMs processing-time ms without events after which a
     *                      session is forgotten
     */
    public SessionRiskFunction(SentinelConfig config, long idleTimeoutMs) {
        this.config = Objects.requireNonNull(config, "SentinelConfig must not be null");
        if (idleTimeoutMs < 1) {
            throw new IllegalArgumentException("idleTimeoutMs must be >= 1, got: " + idleTimeoutMs);
        }
        this.tickIntervalMs = Math.max(1L, Math.round(config.getReporting().getTickIntervalSeconds() * 1000));
        this.idleTimeoutMs = idleTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        monitorState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("session-monitor", TypeInformation.of(SessionMonitor.class)));
        clockState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("session-clock", TypeInformation.of(SessionClock.class)));
        lastEventState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("last-event-ms", TypeInformation.of(Long.class)));
        nextTickState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("next-tick-ms", TypeInformation.of(Long.class)));

        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        observer = new MetricsPipelineObserver(metrics);
        LOG.info("SessionRiskFunction opened: tick={}ms idleTimeout={}ms", tickIntervalMs, idleTimeoutMs);
    }

    @Override
    public void close() {
        LOG.info("SessionRiskFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(SessionEvent value,
            KeyedProcessFunction<String, SessionEvent, RiskReport>.Context ctx,
            Collector<RiskReport> out) throws Exception {
        SessionMonitor monitor = monitorState.value();
        if (monitor == null) {
            monitor = new SessionMonitor(ctx.getCurrentKey(), config, observer);
            LOG.info("New session {}", ctx.getCurrentKey());
        } else {
            monitor.attach(observer);
        }
        monitor.addEvent(value.getEvent());
        monitorState.update(monitor);

        long now = ctx.timerService().currentProcessingTime();
        SessionClock clock = clockState.value();
        if (clock == null) {
            clock = new SessionClock();
        }
        clock.observe(value.getEvent().getTimestamp(), now);
        clockState.update(clock);
        lastEventState.update(now);
        if (nextTickState.value() == null) {
            scheduleTick(ctx.timerService(), now + tickIntervalMs);
        }
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, SessionEvent, RiskReport>.OnTimerContext ctx,
            Collector<RiskReport> out) throws Exception {
        SessionMonitor monitor = monitorState.value();
        SessionClock clock = clockState.value();
        if (monitor == null || clock == null) {
            nextTickState.clear();
            return;
        }
        monitor.attach(observer);

        long startNanos = System.nanoTime();
        try {
            TickResult result = monitor.tick(clock.now(timestamp));
            Optional<RiskReport> report = result.getReport();
            if (report.isPresent()) {
                publish(monitor, report.get(), out);
            }
        } catch (RuntimeException e) {
            LOG.error("Tick failed for session {}, continuing", ctx.getCurrentKey(), e);
        }
        metrics.recordTickLatency((System.nanoTime() - startNanos) / 1_000_000);

        Long lastEvent = lastEventState.value();
        if (lastEvent == null || timestamp - lastEvent >= idleTimeoutMs) {
            LOG.info("Session {} idle for {}ms, clearing state: {}", ctx.getCurrentKey(),
                    lastEvent == null ? -1 : timestamp - lastEvent, monitor);
            monitorState.clear();
            clockState.clear();
            lastEventState.clear();
            nextTickState.clear();
            metrics.incrementSessionsExpired();
            return;
        }
        monitorState.update(monitor);
        clockState.update(clock);
        scheduleTick(ctx.timerService(), timestamp + tickIntervalMs);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void publish(SessionMonitor monitor, RiskReport report, Collector<RiskReport> out) {
        ValidationResult validation = validator.validate(report);
        if (validation.isValid()) {
            out.collect(report);
            monitor.markReportDelivered(report);
        } else {
            monitor.markReportHandled(report, validation.getReason());
        }
    }

    private void scheduleTick(TimerService timers, long at) throws IOException {
        timers.registerProcessingTimeTimer(at);
        nextTickState.update(at);
    }
}
