package com.sentinelx.core.session;

import com.sentinelx.core.config.ReportingSettings;
import com.sentinelx.core.model.InteractionEvent;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.sink.DeliveryResult;
import com.sentinelx.core.sink.ReportSink;
import com.sentinelx.core.source.EventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

/**
 * Single-threaded polling loop driving one {@link SessionMonitor}.
 *
 * <p>
 * Each iteration drains the {@link EventSource} with a bounded wait, feeds
 * the monitor, ticks it and hands a due report to the {@link ReportSink},
 * then sleeps until the next tick. Delivery outcomes:
 * </p>
 * <ul>
 * <li>accepted: the report timer restarts</li>
 * <li>rejected: logged, never resent or recalculated</li>
 * <li>failed: dropped; the next tick builds a fresh report</li>
 * </ul>
 *
 * <p>
 * Only {@link #stop()} ends the loop, after the current iteration. Runtime
 * exceptions from an iteration are logged and the loop carries on.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringLoop implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringLoop.class);

    private final SessionMonitor monitor;
    private final EventSource source;
    private final ReportSink sink;
    private final Duration drainTimeout;
    private final long tickMillis;
    private final DoubleSupplier clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MonitoringLoop(SessionMonitor monitor, EventSource source, ReportSink sink,
            ReportingSettings settings) {
        this(monitor, source, sink, settings, () -> System.currentTimeMillis() / 1000.0);
    }

    /**
     * @param clock wall clock in seconds
     */
    public MonitoringLoop(SessionMonitor monitor, EventSource source, ReportSink sink,
            ReportingSettings settings, DoubleSupplier clock) {
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(settings, "ReportingSettings must not be null");
        this.drainTimeout = Duration.ofMillis(settings.getDrainTimeoutMillis());
        this.tickMillis = Math.max(1L, Math.round(settings.getTickIntervalSeconds() * 1000));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Loop for session " + monitor.getSessionId() + " already running");
        }
        LOG.info("Monitoring loop started for session {}", monitor.getSessionId());
        source.start();
        try {
            while (!stopRequested.get()) {
                long started = System.nanoTime();
                try {
                    runOnce();
                } catch (RuntimeException e) {
                    LOG.error("Tick failed for session {}, continuing", monitor.getSessionId(), e);
                }
                long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                long pause = tickMillis - elapsedMillis;
                if (pause > 0 && !stopRequested.get()) {
                    TimeUnit.MILLISECONDS.sleep(pause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Monitoring loop for session {} interrupted", monitor.getSessionId());
        } finally {
            source.stop();
            running.set(false);
            LOG.info("Monitoring loop stopped for session {}: {}", monitor.getSessionId(), monitor);
        }
    }

    /** Ask the loop to exit after its current iteration. */
    public void stop() {
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    public SessionMonitor getMonitor() {
        return monitor;
    }

    // ---------------------------------------------------------------
    // Iteration
    // ---------------------------------------------------------------

    /**
     * One drain, tick and delivery cycle.
     */
    TickResult runOnce() {
        List<InteractionEvent> events = source.drain(drainTimeout);
        monitor.addEvents(events);

        double now = clock.getAsDouble();
        TickResult result = monitor.tick(now);
        Optional<RiskReport> due = result.getReport();
        if (due.isPresent()) {
            deliver(due.get());
        } else if (result.getScores().isEmpty()) {
            LOG.debug("Session {} calibrating: {}%", monitor.getSessionId(),
                    Math.round(result.getCalibrationProgress()));
        }
        return result;
    }

    private void deliver(RiskReport report) {
        DeliveryResult outcome;
        try {
            outcome = sink.deliver(report);
        } catch (RuntimeException e) {
            outcome = DeliveryResult.failed(e.toString());
        }
        switch (outcome.getStatus()) {
            case ACCEPTED -> monitor.markReportDelivered(report);
            case REJECTED -> monitor.markReportHandled(report, outcome.getDetail());
            case FAILED -> monitor.reportDropped(report, outcome.getDetail());
        }
    }
}
