package com.sentinelx.core.source;

import com.sentinelx.core.model.InteractionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link QueuedEventSource}.
 */
class QueuedEventSourceTest {

    private QueuedEventSource source;

    @BeforeEach
    void setUp() {
        source = new QueuedEventSource();
    }

    @Test
    @DisplayName("Drain returns every queued event in arrival order")
    void shouldDrainQueuedEvents() {
        source.offer(InteractionEvent.keyPress(1.0));
        source.offer(InteractionEvent.keyRelease(1.1));
        source.offer(InteractionEvent.focusLost(2.0));

        List<InteractionEvent> events = source.drain(Duration.ofMillis(10));

        assertThat(events).containsExactly(InteractionEvent.keyPress(1.0),
                InteractionEvent.keyRelease(1.1), InteractionEvent.focusLost(2.0));
        assertThat(source.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Drain of an empty queue returns after the timeout")
    void shouldTimeOutWhenEmpty() {
        long start = System.nanoTime();

        List<InteractionEvent> events = source.drain(Duration.ofMillis(50));

        assertThat(events).isEmpty();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(40L);
    }

    @Test
    @DisplayName("Drain wakes up for an event produced on another thread")
    void shouldReceiveEventFromProducerThread() throws InterruptedException {
        CountDownLatch waiting = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                waiting.await();
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            source.offer(InteractionEvent.mouseMove(3.0, 10, 20));
        });
        producer.start();
        waiting.countDown();

        List<InteractionEvent> events = source.drain(Duration.ofSeconds(5));
        producer.join();

        assertThat(events).containsExactly(InteractionEvent.mouseMove(3.0, 10, 20));
    }

    @Test
    @DisplayName("A bounded queue drops events when full")
    void shouldDropWhenFull() {
        QueuedEventSource bounded = new QueuedEventSource(1);

        assertThat(bounded.offer(InteractionEvent.keyPress(1.0))).isTrue();
        assertThat(bounded.offer(InteractionEvent.keyPress(2.0))).isFalse();
        assertThat(bounded.drain(Duration.ZERO)).hasSize(1);
    }
}
