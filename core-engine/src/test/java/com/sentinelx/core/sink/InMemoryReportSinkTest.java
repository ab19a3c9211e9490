package com.sentinelx.core.sink;

import com.sentinelx.core.aggregate.RiskAggregator;
import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.validation.RiskReportValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryReportSink}.
 */
class InMemoryReportSinkTest {

    private InMemoryReportSink sink;

    @BeforeEach
    void setUp() {
        sink = new InMemoryReportSink();
    }

    @Test
    @DisplayName("Valid reports are stored and aggregated")
    void shouldStoreValidReports() {
        DeliveryResult result = sink.deliver(report(25.0, AnomalyScores.of(60.0, 0.0, 0.0)));

        assertThat(result).isEqualTo(DeliveryResult.accepted());
        assertThat(sink.storedReports()).hasSize(1);
        assertThat(sink.getAggregator().summary("s1")).isPresent();
    }

    @Test
    @DisplayName("Invalid reports are rejected and not aggregated")
    void shouldRejectInvalidReports() {
        DeliveryResult result = sink.deliver(report(0.0, AnomalyScores.of(60.0, 0.0, 0.0)));

        assertThat(result.getStatus()).isEqualTo(DeliveryResult.Status.REJECTED);
        assertThat(result.getDetail()).contains("zero");
        assertThat(sink.storedReports()).isEmpty();
        assertThat(sink.getAggregator().summary("s1")).isEmpty();
    }

    @Test
    @DisplayName("Only the most recent reports are retained while totals keep counting")
    void shouldBoundStoredReports() {
        InMemoryReportSink bounded = new InMemoryReportSink(new RiskReportValidator(), new RiskAggregator(), 3);

        for (int i = 1; i <= 10; i++) {
            bounded.deliver(RiskReport.builder().timestamp(i).riskScore(10.0)
                    .anomalyScores(AnomalyScores.of(5.0, 0.0, 0.0)).sessionId("s1").build());
        }

        assertThat(bounded.storedReports()).hasSize(3)
                .extracting(RiskReport::getTimestamp)
                .containsExactly(8.0, 9.0, 10.0);
        assertThat(bounded.getAggregator().summary("s1").orElseThrow().getRiskCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Non-positive capacity is rejected")
    void shouldRejectZeroCapacity() {
        assertThatThrownBy(() -> new InMemoryReportSink(new RiskReportValidator(), new RiskAggregator(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static RiskReport report(double risk, AnomalyScores scores) {
        return RiskReport.builder().timestamp(10.0).riskScore(risk).anomalyScores(scores).sessionId("s1").build();
    }
}
