package com.sentinelx.core.source;

import com.sentinelx.core.model.InteractionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe handoff between an asynchronous event producer and the
 * single-threaded polling loop.
 *
 * <p>
 * Producers call {@link #offer(InteractionEvent)} from any thread.
 * {@link #drain(Duration)} waits at most the timeout for a first event, then
 * takes whatever else is already queued without waiting again.
 * </p>
 *
 * @since 1.0.0
 */
public class QueuedEventSource implements EventSource {

    private static final Logger LOG = LoggerFactory.getLogger(QueuedEventSource.class);

    private final LinkedBlockingQueue<InteractionEvent> queue;

    public QueuedEventSource() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param capacity maximum number of queued events; further offers are
     *                 dropped
     */
    public QueuedEventSource(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be >= 1, got: " + capacity);
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Enqueue an event without blocking.
     *
     * @return {@code false} if the queue is full and the event was dropped
     */
    public boolean offer(InteractionEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        boolean added = queue.offer(event);
        if (!added) {
            LOG.warn("Event queue full, dropping {}", event);
        }
        return added;
    }

    @Override
    public void start() {
        // externally fed
    }

    @Override
    public void stop() {
        // externally fed
    }

    @Override
    public List<InteractionEvent> drain(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        List<InteractionEvent> events = new ArrayList<>();
        try {
            InteractionEvent first = queue.poll(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (first == null) {
                return events;
            }
            events.add(first);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        queue.drainTo(events);
        LOG.trace("Drained {} event(s)", events.size());
        return events;
    }

    public int pendingCount() {
        return queue.size();
    }
}
