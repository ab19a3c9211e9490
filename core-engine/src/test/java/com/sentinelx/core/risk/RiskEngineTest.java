package com.sentinelx.core.risk;

import com.sentinelx.core.config.RiskSettings;
import com.sentinelx.core.model.AnomalyScores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RiskEngine}.
 */
class RiskEngineTest {

    private RiskEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RiskEngine(new RiskSettings());
    }

    @Test
    @DisplayName("Raw score is the weighted sum of the three rule scores")
    void shouldWeightScores() {
        Random random = new Random(7);
        for (int i = 0; i < 500; i++) {
            double idle = random.nextDouble() * 100;
            double focus = random.nextDouble() * 100;
            double drift = random.nextDouble() * 100;

            double raw = engine.weightedScore(AnomalyScores.of(idle, focus, drift));

            assertThat(raw).isBetween(0.0, 100.0);
            assertThat(raw).isCloseTo(0.4 * idle + 0.35 * focus + 0.25 * drift, within(1e-9));
        }
    }

    @Test
    @DisplayName("First computation returns the raw score unchanged")
    void shouldReturnRawForFirstSample() {
        double risk = engine.computeRisk(AnomalyScores.of(50.0, 0.0, 0.0));

        assertThat(risk).isCloseTo(20.0, within(1e-9));
        assertThat(engine.rawRisk()).isCloseTo(20.0, within(1e-9));
        assertThat(engine.currentRisk()).isEqualTo(risk);
    }

    @Test
    @DisplayName("Newest sample is weighted against the mean of older samples")
    void shouldSmoothAgainstOlderMean() {
        engine.computeRisk(AnomalyScores.of(0.0, 0.0, 0.0));
        double second = engine.computeRisk(AnomalyScores.of(100.0, 100.0, 100.0));
        // 0.6 * 100 + 0.4 * mean(0)
        assertThat(second).isCloseTo(60.0, within(1e-9));

        double third = engine.computeRisk(AnomalyScores.of(50.0, 50.0, 50.0));
        // 0.6 * 50 + 0.4 * mean(0, 100)
        assertThat(third).isCloseTo(50.0, within(1e-9));

        double fourth = engine.computeRisk(AnomalyScores.of(0.0, 0.0, 0.0));
        // oldest sample evicted: 0.6 * 0 + 0.4 * mean(100, 50)
        assertThat(fourth).isCloseTo(30.0, within(1e-9));
        assertThat(engine.rawRisk()).isZero();
    }

    @Test
    @DisplayName("A constant raw score converges to itself")
    void shouldConvergeOnConstantInput() {
        engine.computeRisk(AnomalyScores.of(100.0, 100.0, 100.0));
        AnomalyScores constant = AnomalyScores.of(40.0, 20.0, 10.0);
        double raw = engine.weightedScore(constant);

        double risk = 0;
        for (int i = 0; i < 3; i++) {
            risk = engine.computeRisk(constant);
        }

        assertThat(risk).isCloseTo(raw, within(1e-9));
    }

    @Test
    @DisplayName("A window of one disables smoothing")
    void shouldNotSmoothWithWindowOfOne() {
        RiskSettings settings = new RiskSettings();
        settings.setSmoothingWindow(1);
        RiskEngine unsmoothed = new RiskEngine(settings);

        unsmoothed.computeRisk(AnomalyScores.of(100.0, 100.0, 100.0));

        assertThat(unsmoothed.computeRisk(AnomalyScores.NONE)).isZero();
    }

    @Test
    @DisplayName("Reset clears history and cached values")
    void shouldReset() {
        engine.computeRisk(AnomalyScores.of(100.0, 100.0, 100.0));
        engine.reset();

        assertThat(engine.currentRisk()).isZero();
        assertThat(engine.rawRisk()).isZero();
        assertThat(engine.computeRisk(AnomalyScores.of(50.0, 0.0, 0.0))).isCloseTo(20.0, within(1e-9));
    }

    @Test
    @DisplayName("Risk levels follow the score bands")
    void shouldBandRiskLevels() {
        assertThat(RiskLevel.of(0.0)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.of(29.9)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.of(30.0)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.of(60.0)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.of(80.0)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    @DisplayName("Should reject a zero smoothing window")
    void shouldRejectZeroWindow() {
        RiskSettings settings = new RiskSettings();
        settings.setSmoothingWindow(0);

        assertThatThrownBy(() -> new RiskEngine(settings))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
