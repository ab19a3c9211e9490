package com.sentinelx.core.source;

import com.sentinelx.core.model.InteractionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

/**
 * Generator of plausible timing-only events for development and load runs.
 *
 * <p>
 * A daemon thread emits short typing bursts (press/release pairs), mouse
 * moves and clicks, focus changes and occasional idle periods, sleeping an
 * exponentially distributed interval between steps. While idle it emits
 * {@code idle_period} updates carrying the elapsed idle time and finishes with
 * {@code idle_end}. Never use it as a source of real behavior.
 * </p>
 *
 * @since 1.0.0
 */
public class SyntheticEventSource extends QueuedEventSource {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticEventSource.class);

    static final int SCREEN_WIDTH = 1920;
    static final int SCREEN_HEIGHT = 1080;
    private static final double IDLE_EXIT_PROBABILITY = 0.3;
    private static final long IDLE_STEP_MILLIS = 100;

    private final Settings settings;
    private final Random random;
    private final DoubleSupplier clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Thread thread;
    private boolean idle;
    private double idleStart;

    /**
     * Generation probabilities and pacing.
     */
    public static final class Settings {
        private double meanEventIntervalSeconds = 0.2;
        private double idleProbability = 0.15;
        private double typingBurstProbability = 0.3;
        private double mouseMoveProbability = 0.3;
        private double mouseClickProbability = 0.2;

        public Settings meanEventIntervalSeconds(double v) {
            this.meanEventIntervalSeconds = v;
            return this;
        }

        public Settings idleProbability(double v) {
            this.idleProbability = v;
            return this;
        }

        public Settings typingBurstProbability(double v) {
            this.typingBurstProbability = v;
            return this;
        }

        public Settings mouseMoveProbability(double v) {
            this.mouseMoveProbability = v;
            return this;
        }

        public Settings mouseClickProbability(double v) {
            this.mouseClickProbability = v;
            return this;
        }
    }

    public SyntheticEventSource(long seed) {
        this(new Settings(), new Random(seed), () -> System.currentTimeMillis() / 1000.0);
    }

    public SyntheticEventSource(Settings settings, Random random, DoubleSupplier clock) {
        this.settings = settings;
        this.random = random;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        thread = new Thread(this::run, "synthetic-events");
        thread.setDaemon(true);
        thread.start();
        LOG.info("Synthetic event generation started (synthetic data, not real behavior)");
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(2_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Synthetic event generation stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void run() {
        while (running.get()) {
            long pauseMillis = step(clock.getAsDouble());
            try {
                TimeUnit.MILLISECONDS.sleep(pauseMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Emit the events of one generation step at {@code now}.
     *
     * @return milliseconds to pause before the next step
     */
    long step(double now) {
        if (idle) {
            if (random.nextDouble() < IDLE_EXIT_PROBABILITY) {
                idle = false;
                offer(InteractionEvent.idleEnd(now, now - idleStart));
            } else {
                offer(InteractionEvent.idlePeriod(now, now - idleStart));
                return IDLE_STEP_MILLIS;
            }
        } else if (random.nextDouble() < settings.idleProbability * 0.1) {
            idle = true;
            idleStart = now;
            offer(InteractionEvent.idlePeriod(now, 0.0));
            return IDLE_STEP_MILLIS;
        }

        double roll = random.nextDouble();
        double typingEdge = settings.typingBurstProbability;
        double moveEdge = typingEdge + settings.mouseMoveProbability;
        double clickEdge = moveEdge + settings.mouseClickProbability;
        if (roll < typingEdge) {
            int keys = 1 + random.nextInt(5);
            for (int i = 0; i < keys; i++) {
                double press = now + i * uniform(0.05, 0.15);
                offer(InteractionEvent.keyPress(press));
                offer(InteractionEvent.keyRelease(press + uniform(0.05, 0.10)));
            }
        } else if (roll < moveEdge) {
            offer(InteractionEvent.mouseMove(now, random.nextInt(SCREEN_WIDTH + 1), random.nextInt(SCREEN_HEIGHT + 1)));
        } else if (roll < clickEdge) {
            offer(InteractionEvent.mouseClick(now, random.nextInt(SCREEN_WIDTH + 1), random.nextInt(SCREEN_HEIGHT + 1)));
        } else if (random.nextBoolean()) {
            offer(InteractionEvent.focusLost(now));
        } else {
            offer(InteractionEvent.focusGained(now));
        }

        double pauseSeconds = -Math.log(1.0 - random.nextDouble()) * settings.meanEventIntervalSeconds;
        return Math.max(1L, Math.round(pauseSeconds * 1000));
    }

    boolean isIdle() {
        return idle;
    }

    private double uniform(double low, double high) {
        return low + random.nextDouble() * (high - low);
    }
}
