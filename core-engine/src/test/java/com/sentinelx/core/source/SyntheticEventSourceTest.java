package com.sentinelx.core.source;

import com.sentinelx.core.model.EventKind;
import com.sentinelx.core.model.InteractionEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SyntheticEventSource}.
 */
class SyntheticEventSourceTest {

    @Test
    @DisplayName("Generation steps produce every kind of timing event")
    void shouldGenerateAllEventKinds() {
        SyntheticEventSource source = new SyntheticEventSource(
                new SyntheticEventSource.Settings().idleProbability(5.0), new Random(1), () -> 0.0);

        List<InteractionEvent> events = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            long pause = source.step(i * 0.2);
            assertThat(pause).isPositive();
            events.addAll(source.drain(Duration.ZERO));
        }

        Set<EventKind> kinds = EnumSet.noneOf(EventKind.class);
        events.forEach(e -> kinds.add(e.getKind()));
        assertThat(kinds).contains(EventKind.KEY_PRESS, EventKind.KEY_RELEASE, EventKind.MOUSE_MOVE,
                EventKind.MOUSE_CLICK, EventKind.FOCUS_LOST, EventKind.FOCUS_GAINED,
                EventKind.IDLE_PERIOD, EventKind.IDLE_END);
        assertThat(events).filteredOn(e -> e.getKind().isMouse())
                .allSatisfy(e -> {
                    assertThat(e.getX()).isBetween(0, SyntheticEventSource.SCREEN_WIDTH);
                    assertThat(e.getY()).isBetween(0, SyntheticEventSource.SCREEN_HEIGHT);
                });
        assertThat(events).filteredOn(e -> e.getKind().isIdle())
                .allSatisfy(e -> assertThat(e.getDuration()).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    @DisplayName("Same seed yields the same event sequence")
    void shouldBeDeterministicForSeed() {
        assertThat(generate(7)).isEqualTo(generate(7));
    }

    @Test
    @DisplayName("Start and stop control the generator thread")
    void shouldStartAndStop() {
        SyntheticEventSource source = new SyntheticEventSource(3);

        source.start();
        assertThat(source.isRunning()).isTrue();
        List<InteractionEvent> events = source.drain(Duration.ofSeconds(5));
        source.stop();

        assertThat(events).isNotEmpty();
        assertThat(source.isRunning()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<InteractionEvent> generate(long seed) {
        SyntheticEventSource source = new SyntheticEventSource(
                new SyntheticEventSource.Settings(), new Random(seed), () -> 0.0);
        for (int i = 0; i < 200; i++) {
            source.step(i * 0.2);
        }
        return source.drain(Duration.ZERO);
    }
}
