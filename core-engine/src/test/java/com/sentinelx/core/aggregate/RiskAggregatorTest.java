package com.sentinelx.core.aggregate;

import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.model.SessionSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RiskAggregator}.
 */
class RiskAggregatorTest {

    private RiskAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new RiskAggregator();
    }

    @Test
    @DisplayName("Unknown session has no summary")
    void shouldReturnEmptyForUnknownSession() {
        assertThat(aggregator.summary("nope")).isEmpty();
    }

    @Test
    @DisplayName("Summary tracks risk statistics and counts rule scores above 50")
    void shouldSummarizeSession() {
        aggregator.add(report("s1", 10.0, AnomalyScores.of(60.0, 0.0, 0.0)));
        aggregator.add(report("s1", 30.0, AnomalyScores.of(50.0, 70.0, 0.0)));
        aggregator.add(report("s1", 50.0, AnomalyScores.of(70.0, 0.0, 51.0)));
        aggregator.add(report("s2", 90.0, AnomalyScores.NONE));

        SessionSummary summary = aggregator.summary("s1").orElseThrow();

        assertThat(summary.getRiskCount()).isEqualTo(3);
        assertThat(summary.getAverageRisk()).isCloseTo(30.0, within(1e-9));
        assertThat(summary.getMaxRisk()).isEqualTo(50.0);
        assertThat(summary.getMinRisk()).isEqualTo(10.0);
        assertThat(summary.getAnomalyCounts()).containsExactly(
                entry("idle_burst", 2), entry("focus_instability", 1), entry("behavioral_drift", 1));
        assertThat(aggregator.sessionIds()).containsExactlyInAnyOrder("s1", "s2");
    }

    @Test
    @DisplayName("Reset forgets one session only")
    void shouldResetSession() {
        aggregator.add(report("s1", 10.0, AnomalyScores.NONE));
        aggregator.add(report("s2", 20.0, AnomalyScores.NONE));

        aggregator.resetSession("s1");

        assertThat(aggregator.summary("s1")).isEmpty();
        assertThat(aggregator.summary("s2")).isPresent();
    }

    @Test
    @DisplayName("Concurrent sessions aggregate without lost updates")
    void shouldAggregateConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1_000; i++) {
                        aggregator.add(report("shared", 40.0, AnomalyScores.of(80.0, 0.0, 0.0)));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        SessionSummary summary = aggregator.summary("shared").orElseThrow();
        assertThat(summary.getRiskCount()).isEqualTo(4_000);
        assertThat(summary.getAnomalyCounts()).containsEntry("idle_burst", 4_000);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static RiskReport report(String sessionId, double risk, AnomalyScores scores) {
        return RiskReport.builder()
                .timestamp(1_000.0)
                .riskScore(risk)
                .anomalyScores(scores)
                .sessionId(sessionId)
                .build();
    }
}
