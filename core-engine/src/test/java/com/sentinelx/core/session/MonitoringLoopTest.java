package com.sentinelx.core.session;

import com.sentinelx.core.config.ReportingSettings;
import com.sentinelx.core.config.SentinelConfig;
import com.sentinelx.core.model.InteractionEvent;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.sink.DeliveryResult;
import com.sentinelx.core.sink.ReportSink;
import com.sentinelx.core.source.EventSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MonitoringLoop}.
 */
class MonitoringLoopTest {

    private ScriptedSource source;
    private ScriptedSink sink;
    private double clock;
    private SessionMonitor monitor;
    private MonitoringLoop loop;

    @BeforeEach
    void setUp() {
        SentinelConfig config = SentinelConfig.defaults();
        config.getFeatures().setWindowDurationSeconds(10.0);
        config.getCalibration().setDurationSeconds(10.0);
        config.getCalibration().setMinSamples(3);
        config.getReporting().setReportIntervalSeconds(2.0);

        source = new ScriptedSource();
        sink = new ScriptedSink();
        clock = 100.0;
        monitor = new SessionMonitor("loop-session", config, PipelineObserver.NOOP);
        loop = new MonitoringLoop(monitor, source, sink, config.getReporting(), () -> clock);
    }

    @Test
    @DisplayName("Nothing is delivered before the baseline freezes")
    void shouldNotDeliverWhileCalibrating() {
        step();
        step();

        assertThat(sink.received).isEmpty();
        assertThat(monitor.getEventCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("Accepted report waits a full interval before the next one")
    void shouldPaceAcceptedReports() {
        calibrate();
        assertThat(sink.received).hasSize(1);

        step();
        assertThat(sink.received).hasSize(1);
        step();
        assertThat(sink.received).hasSize(2);
        assertThat(monitor.getReportCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Rejected report is neither resent nor recalculated")
    void shouldNotRetryRejectedReport() {
        sink.outcomes.add(DeliveryResult.rejected("Invalid timestamp: -1.0"));
        calibrate();

        step();

        assertThat(sink.received).hasSize(1);
        assertThat(monitor.getReportCount()).isZero();
    }

    @Test
    @DisplayName("Failed delivery retries with a fresh report on the next tick")
    void shouldRetryAfterFailure() {
        sink.outcomes.add(DeliveryResult.failed("HTTP 503"));
        calibrate();

        step();

        assertThat(sink.received).hasSize(2);
        assertThat(sink.received.get(1).getTimestamp())
                .isGreaterThan(sink.received.get(0).getTimestamp());
        assertThat(monitor.getReportCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A throwing sink is treated as a failed delivery")
    void shouldSurviveThrowingSink() {
        sink.throwOnce = true;
        calibrate();

        step();

        assertThat(sink.received).hasSize(2);
        assertThat(monitor.getReportCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Run starts the source and stops it when the loop exits")
    void shouldStartAndStopSource() throws InterruptedException {
        ReportingSettings fast = new ReportingSettings();
        fast.setTickIntervalSeconds(0.01);
        fast.setDrainTimeoutMillis(1);
        MonitoringLoop running = new MonitoringLoop(monitor, source, sink, fast, () -> clock);

        Thread thread = new Thread(running, "loop-test");
        thread.start();
        waitFor(() -> source.drains.get() > 2);
        running.stop();
        thread.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(thread.isAlive()).isFalse();
        assertThat(source.started).isTrue();
        assertThat(source.stopped).isTrue();
        assertThat(running.isRunning()).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Advance the clock one second, queue four key presses, run one cycle. */
    private void step() {
        for (int i = 1; i <= 4; i++) {
            source.pending.add(InteractionEvent.keyPress(clock + i * 0.25));
        }
        clock += 1.0;
        loop.runOnce();
    }

    private void calibrate() {
        for (int i = 0; i < 20 && sink.received.isEmpty(); i++) {
            step();
        }
        assertThat(sink.received).as("first report after calibration").isNotEmpty();
    }

    private static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }

    private static final class ScriptedSource implements EventSource {
        final Deque<InteractionEvent> pending = new ArrayDeque<>();
        final AtomicInteger drains = new AtomicInteger();
        volatile boolean started;
        volatile boolean stopped;

        @Override
        public void start() {
            started = true;
        }

        @Override
        public void stop() {
            stopped = true;
        }

        @Override
        public synchronized List<InteractionEvent> drain(Duration timeout) {
            drains.incrementAndGet();
            List<InteractionEvent> out = new ArrayList<>(pending);
            pending.clear();
            return out;
        }
    }

    private static final class ScriptedSink implements ReportSink {
        final List<RiskReport> received = new ArrayList<>();
        final Deque<DeliveryResult> outcomes = new ArrayDeque<>();
        boolean throwOnce;

        @Override
        public DeliveryResult deliver(RiskReport report) {
            received.add(report);
            if (throwOnce) {
                throwOnce = false;
                throw new IllegalStateException("sink exploded");
            }
            DeliveryResult next = outcomes.poll();
            return next != null ? next : DeliveryResult.accepted();
        }
    }
}
