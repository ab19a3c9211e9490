package com.sentinelx.flink;

import com.sentinelx.core.config.SentinelConfig;
import com.sentinelx.core.model.InteractionEvent;
import com.sentinelx.core.model.RiskReport;
import org.apache.flink.api.common.typeinfo.BasicTypeInfo;
import org.apache.flink.streaming.util.KeyedOneInputStreamOperatorTestHarness;
import org.apache.flink.streaming.util.ProcessFunctionTestHarnesses;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Operator-level tests for {@link SessionRiskFunction} driven by Flink's keyed
 * test harness. Producer timestamps are kept far below cluster processing time.
 */
class SessionRiskFunctionTest {

    private static final long PROC_START = 1_700_000_000_000L;
    private static final long IDLE_TIMEOUT_MS = 5_000L;
    private static final int MAX_STEPS = 30;

    private KeyedOneInputStreamOperatorTestHarness<String, SessionEvent, RiskReport> harness;
    private final Map<String, Double> typedUntil = new HashMap<>();
    private long procNow;

    @BeforeEach
    void setUp() throws Exception {
        harness = ProcessFunctionTestHarnesses.forKeyedProcessFunction(
                new SessionRiskFunction(fastConfig(), IDLE_TIMEOUT_MS),
                SessionEvent::getSessionId,
                BasicTypeInfo.STRING_TYPE_INFO);
        procNow = PROC_START;
        harness.setProcessingTime(procNow);
    }

    @AfterEach
    void tearDown() throws Exception {
        harness.close();
    }

    @Test
    @DisplayName("Non-positive idle timeout is rejected")
    void shouldRejectIdleTimeout() {
        assertThatThrownBy(() -> new SessionRiskFunction(fastConfig(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Advancing processing time emits a report in the producer's time base")
    void shouldEmitReportOnTick() throws Exception {
        List<RiskReport> reports = runUntilReport("s-1", 5_000.0);

        assertThat(reports).isNotEmpty();
        RiskReport report = reports.get(0);
        assertThat(report.getSessionId()).isEqualTo("s-1");
        assertThat(report.getSource()).isEqualTo("flink-test");
        assertThat(report.getTimestamp()).isBetween(5_000.0, 5_000.0 + MAX_STEPS);
    }

    @Test
    @DisplayName("Idle session clears its state and stops its timer")
    void shouldExpireIdleSession() throws Exception {
        runUntilReport("s-1", 5_000.0);
        assertThat(harness.numKeyedStateEntries()).isPositive();

        for (int i = 0; i <= IDLE_TIMEOUT_MS / 1_000; i++) {
            advanceOneSecond();
        }

        assertThat(harness.numKeyedStateEntries()).isZero();
        assertThat(harness.numProcessingTimeTimers()).isZero();
    }

    @Test
    @DisplayName("Report failing validation is not emitted")
    void shouldDropInvalidReport() throws Exception {
        for (int step = 0; step < MAX_STEPS; step++) {
            typeAt("valid", 5_000.0 + step);
            typeAt("negative-clock", -5_000.0 + step);
            advanceOneSecond();
        }

        List<RiskReport> reports = harness.extractOutputValues();
        assertThat(reports).isNotEmpty();
        assertThat(reports).allSatisfy(r -> assertThat(r.getSessionId()).isEqualTo("valid"));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** 10 s window, 10 s calibration, 3 samples, 1 s ticks, reports every 2 s. */
    private static SentinelConfig fastConfig() {
        SentinelConfig config = SentinelConfig.defaults();
        config.getFeatures().setWindowDurationSeconds(10.0);
        config.getCalibration().setDurationSeconds(10.0);
        config.getCalibration().setMinSamples(3);
        config.getReporting().setTickIntervalSeconds(1.0);
        config.getReporting().setReportIntervalSeconds(2.0);
        config.getReporting().setSource("flink-test");
        return config;
    }

    private List<RiskReport> runUntilReport(String session, double producerStart) throws Exception {
        for (int step = 0; step < MAX_STEPS && harness.extractOutputValues().isEmpty(); step++) {
            typeAt(session, producerStart + step);
            advanceOneSecond();
        }
        return harness.extractOutputValues();
    }

    /** Steady typing at four keys per second up to producer time {@code until}. */
    private void typeAt(String session, double until) throws Exception {
        double t = typedUntil.getOrDefault(session, until - 10.0);
        while (t + 0.25 <= until) {
            t += 0.25;
            harness.processElement(new SessionEvent(session, InteractionEvent.keyPress(t)), procNow);
        }
        typedUntil.put(session, t);
    }

    private void advanceOneSecond() throws Exception {
        procNow += 1_000;
        harness.setProcessingTime(procNow);
    }
}
