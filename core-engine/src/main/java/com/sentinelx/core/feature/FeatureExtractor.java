package com.sentinelx.core.feature;

import com.sentinelx.core.config.FeatureSettings;
import com.sentinelx.core.model.EventKind;
import com.sentinelx.core.model.FeatureVector;
import com.sentinelx.core.model.InteractionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Time-ordered, time-pruned event buffer that summarizes the trailing window
 * into a {@link FeatureVector}.
 *
 * <h3>Ordering</h3>
 * <p>
 * Events arriving in timestamp order are appended. A late event is placed
 * with a binary search after every buffered event sharing its timestamp, so
 * equal timestamps keep their arrival order. Duplicates are accepted.
 * </p>
 *
 * <h3>Pruning</h3>
 * <p>
 * {@link #computeFeatures(double)} discards every event older than
 * {@code now - windowDuration}. Discarded events are gone for good.
 * </p>
 *
 * <p>
 * Not thread-safe; drive it from a single polling thread.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureExtractor implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(FeatureExtractor.class);

    private final double windowDuration;
    private final ArrayList<InteractionEvent> buffer = new ArrayList<>();

    /**
     * @param windowDurationSeconds trailing window length; must be positive
     * @throws IllegalArgumentException if the window is not positive
     */
    public FeatureExtractor(double windowDurationSeconds) {
        if (!(windowDurationSeconds > 0)) {
            throw new IllegalArgumentException("Window duration must be > 0, got: " + windowDurationSeconds);
        }
        this.windowDuration = windowDurationSeconds;
    }

    public FeatureExtractor(FeatureSettings settings) {
        this(Objects.requireNonNull(settings, "FeatureSettings must not be null").getWindowDurationSeconds());
    }

    // ---------------------------------------------------------------
    // Buffer maintenance
    // ---------------------------------------------------------------

    /**
     * Insert an event, keeping the buffer sorted by timestamp.
     *
     * @param event event to buffer; must not be {@code null}
     */
    public void addEvent(InteractionEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        int size = buffer.size();
        if (size == 0 || event.getTimestamp() >= buffer.get(size - 1).getTimestamp()) {
            buffer.add(event);
            return;
        }
        int index = insertionPoint(event.getTimestamp());
        buffer.add(index, event);
        LOG.debug("Out-of-order event {} inserted at position {}", event, index);
    }

    /**
     * Index of the first buffered event strictly later than {@code timestamp}.
     */
    private int insertionPoint(double timestamp) {
        int lo = 0;
        int hi = buffer.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (buffer.get(mid).getTimestamp() <= timestamp) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Index of the first buffered event with {@code timestamp >= cutoff}.
     */
    private int firstAtOrAfter(double cutoff) {
        int lo = 0;
        int hi = buffer.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (buffer.get(mid).getTimestamp() < cutoff) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** Drop every buffered event. */
    public void clear() {
        buffer.clear();
        LOG.debug("Feature buffer cleared");
    }

    public int bufferedCount() {
        return buffer.size();
    }

    /**
     * Snapshot of the buffer in timestamp order.
     */
    public List<InteractionEvent> bufferedEvents() {
        return List.copyOf(buffer);
    }

    public double getWindowDuration() {
        return windowDuration;
    }

    // ---------------------------------------------------------------
    // Feature computation
    // ---------------------------------------------------------------

    /**
     * Prune the buffer and summarize the window ending at {@code now}.
     *
     * <p>
     * Never fails: an empty buffer yields an all-zero vector.
     * </p>
     *
     * @param now end of the window, in seconds
     * @return feature vector over {@code [now - windowDuration, now]}
     */
    public FeatureVector computeFeatures(double now) {
        double windowStart = now - windowDuration;
        int stale = firstAtOrAfter(windowStart);
        if (stale > 0) {
            buffer.subList(0, stale).clear();
            LOG.trace("Pruned {} event(s) older than {}", stale, windowStart);
        }

        FeatureVector.Builder fv = FeatureVector.builder().windowStart(windowStart).windowEnd(now);
        if (buffer.isEmpty()) {
            return fv.build();
        }

        int keyPresses = 0;
        double firstPress = 0;
        double lastPress = 0;
        int idleCount = 0;
        double idleTotal = 0;
        int focusLosses = 0;
        InteractionEvent firstMove = null;
        InteractionEvent previousMove = null;
        double mouseDistance = 0;

        for (InteractionEvent event : buffer) {
            EventKind kind = event.getKind();
            switch (kind) {
                case KEY_PRESS -> {
                    if (keyPresses == 0) {
                        firstPress = event.getTimestamp();
                    }
                    lastPress = event.getTimestamp();
                    keyPresses++;
                }
                case IDLE_PERIOD -> {
                    if (event.getDuration() != null) {
                        idleTotal += event.getDuration();
                        idleCount++;
                    }
                }
                case FOCUS_LOST -> focusLosses++;
                case MOUSE_MOVE -> {
                    if (event.hasPosition()) {
                        if (previousMove == null) {
                            firstMove = event;
                        } else {
                            mouseDistance += Math.hypot(event.getX() - previousMove.getX(),
                                    event.getY() - previousMove.getY());
                        }
                        previousMove = event;
                    }
                }
                default -> {
                    // not aggregated
                }
            }
        }

        fv.keyPressCount(keyPresses);
        if (keyPresses >= 2) {
            // mean of consecutive deltas telescopes to (last - first) / (n - 1)
            fv.interKeyInterval((lastPress - firstPress) / (keyPresses - 1));
            double windowLength = now - windowStart;
            if (windowLength > 0) {
                fv.avgTypingSpeed(keyPresses / windowLength * 60.0);
            }
        }

        if (idleCount > 0) {
            fv.avgIdleDuration(idleTotal / idleCount);
        }
        fv.focusLossCount(focusLosses);

        if (firstMove != null && previousMove != firstMove) {
            double span = previousMove.getTimestamp() - firstMove.getTimestamp();
            if (span > 0) {
                fv.avgMouseSpeed(mouseDistance / span);
            }
        }

        FeatureVector vector = fv.build();
        LOG.debug("Computed {}", vector);
        return vector;
    }
}
