package com.sentinelx.core.detection;

import com.sentinelx.core.config.DetectionSettings;
import com.sentinelx.core.model.BaselineProfile;
import com.sentinelx.core.model.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IdleBurstRule}.
 */
class IdleBurstRuleTest {

    private static final BaselineProfile BASELINE = new BaselineProfile(200.0, 2.0, 0.5);

    private final IdleBurstRule rule = new IdleBurstRule(new DetectionSettings());

    @Test
    @DisplayName("Should score the typing ratio above the multiplier")
    void shouldScoreBurstAfterIdle() {
        // ratio 1.5 -> (1.5 - 1.3) * 100
        assertThat(rule.score(features(300.0, 3.0), BASELINE)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    @DisplayName("Should cap the score at the idle scale")
    void shouldCapScore() {
        assertThat(rule.score(features(2000.0, 10.0), BASELINE)).isEqualTo(70.0);
    }

    @Test
    @DisplayName("Should NOT fire without a long idle")
    void shouldNotFireWithoutIdle() {
        assertThat(rule.score(features(400.0, 2.4), BASELINE)).isZero();
    }

    @Test
    @DisplayName("Should NOT fire without a typing burst")
    void shouldNotFireWithoutBurst() {
        assertThat(rule.score(features(250.0, 5.0), BASELINE)).isZero();
    }

    @Test
    @DisplayName("Should NOT fire against a zero typing baseline")
    void shouldIgnoreZeroTypingBaseline() {
        assertThat(rule.score(features(400.0, 5.0), new BaselineProfile(0.0, 2.0, 0.5))).isZero();
    }

    @Test
    @DisplayName("Gain and cap follow the settings")
    void shouldUseConfiguredGainAndCap() {
        DetectionSettings settings = new DetectionSettings();
        settings.setIdleBurstGain(10.0);
        settings.setIdleScale(100.0);

        double score = new IdleBurstRule(settings).score(features(400.0, 5.0), BASELINE);

        assertThat(score).isCloseTo(7.0, within(1e-9));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static FeatureVector features(double typing, double idle) {
        return FeatureVector.builder().avgTypingSpeed(typing).avgIdleDuration(idle).window(100.0, 30.0).build();
    }
}
